package com.vidnyan.codeguard.adapter.out.detector.defensive;

import com.vidnyan.codeguard.domain.model.Severity;
import com.vidnyan.codeguard.domain.model.Violation;
import com.vidnyan.codeguard.domain.model.ViolationType;
import com.vidnyan.codeguard.support.SyntaxTrees;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExternalCallSafetyDetectorTest {

    private final ExternalCallSafetyDetector detector = new ExternalCallSafetyDetector();

    @Test
    void detect_ShouldFlagHttpClientWithoutTimeout() {
        // Arrange
        String source = """
                class Sample {
                    HttpClient client() {
                        return HttpClient.newBuilder().build();
                    }
                }
                """;

        // Act
        List<Violation> violations = detector.detect(SyntaxTrees.context(source));

        // Assert
        assertEquals(1, violations.size());
        assertEquals(ViolationType.EXTERNAL_CALL_SAFETY, violations.get(0).type());
        assertEquals(Severity.CRITICAL, violations.get(0).severity());
        assertTrue(violations.get(0).suggestion().contains("connectTimeout"));
    }

    @Test
    void detect_ShouldAcceptTimeoutInFluentChain() {
        // Arrange
        String source = """
                class Sample {
                    HttpClient client() {
                        return HttpClient.newBuilder()
                                .connectTimeout(Duration.ofSeconds(10))
                                .build();
                    }
                }
                """;

        // Act & Assert
        assertTrue(detector.detect(SyntaxTrees.context(source)).isEmpty());
    }

    @Test
    void detect_ShouldRequireTimeoutArgumentsForProcessWait() {
        // Arrange
        String source = """
                class Sample {
                    void run(Process process) throws Exception {
                        process.waitFor();
                        process.waitFor(30, TimeUnit.SECONDS);
                    }
                }
                """;

        // Act
        List<Violation> violations = detector.detect(SyntaxTrees.context(source));

        // Assert
        assertEquals(1, violations.size());
        assertEquals(ViolationType.TIMEOUT_PRESENCE, violations.get(0).type());
        assertEquals(3, violations.get(0).line());
    }
}
