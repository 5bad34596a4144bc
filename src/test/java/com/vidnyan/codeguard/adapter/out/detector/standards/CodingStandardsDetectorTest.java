package com.vidnyan.codeguard.adapter.out.detector.standards;

import com.vidnyan.codeguard.domain.model.Violation;
import com.vidnyan.codeguard.domain.model.ViolationType;
import com.vidnyan.codeguard.support.SyntaxTrees;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CodingStandardsDetectorTest {

    private final CodingStandardsDetector detector = new CodingStandardsDetector();

    @Test
    void detect_ShouldReportNonStandardErrorCodeOncePerFile() {
        // Arrange
        String source = """
                class Sample {
                    void fail() {
                        throw new ApiException("PAYMENT_DECLINED_ERROR");
                    }
                    void failAgain() {
                        throw new ApiException("PAYMENT_DECLINED_ERROR");
                    }
                    void notFound() {
                        throw new ApiException("NOT_FOUND");
                    }
                }
                """;

        // Act
        List<Violation> violations = detector.detect(SyntaxTrees.context(source));

        // Assert
        assertEquals(1, violations.size());
        assertEquals(ViolationType.NON_STANDARD_ERROR_CODE, violations.get(0).type());
        assertEquals(3, violations.get(0).line());
    }

    @Test
    void detect_ShouldCheckTimeoutValuesInSeconds() {
        // Arrange
        String source = """
                class Sample {
                    void configure(Builder builder, Factory factory) {
                        builder.connectTimeout(Duration.ofSeconds(7));
                        builder.readTimeout(Duration.ofSeconds(30));
                        factory.setConnectTimeout(5000);
                        factory.setReadTimeout(2500);
                    }
                }
                """;

        // Act
        List<Violation> violations = detector.detect(SyntaxTrees.context(source));

        // Assert
        assertEquals(2, violations.size());
        assertTrue(violations.stream().allMatch(v -> v.type() == ViolationType.NON_STANDARD_TIMEOUT));
        assertEquals("Non-standard timeout value: 7s", violations.get(0).description());
        assertEquals("Non-standard timeout value: 2.5s", violations.get(1).description());
    }

    @Test
    void detect_ShouldFlagUnixTimestampsAndCustomDateFormats() {
        // Arrange
        String source = """
                class Sample {
                    long stamp(Instant now) {
                        DateTimeFormatter iso = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX");
                        DateTimeFormatter custom = DateTimeFormatter.ofPattern("dd/MM/yyyy");
                        return now.toEpochMilli();
                    }
                }
                """;

        // Act
        List<Violation> violations = detector.detect(SyntaxTrees.context(source));

        // Assert
        assertEquals(2, violations.size());
        assertTrue(violations.stream().anyMatch(v -> v.type() == ViolationType.CUSTOM_DATETIME_FORMAT
                && v.line() == 4));
        assertTrue(violations.stream().anyMatch(v -> v.type() == ViolationType.UNIX_TIMESTAMP_USAGE
                && v.line() == 5));
    }
}
