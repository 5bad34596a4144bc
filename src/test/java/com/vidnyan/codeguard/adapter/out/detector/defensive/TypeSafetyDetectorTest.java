package com.vidnyan.codeguard.adapter.out.detector.defensive;

import com.vidnyan.codeguard.domain.model.Violation;
import com.vidnyan.codeguard.domain.model.ViolationType;
import com.vidnyan.codeguard.support.SyntaxTrees;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TypeSafetyDetectorTest {

    private final TypeSafetyDetector detector = new TypeSafetyDetector();

    @Test
    void detect_ShouldFlagUnguardedConversion() {
        // Arrange
        String source = """
                class Sample {
                    int port(String raw) {
                        return Integer.parseInt(raw);
                    }
                }
                """;

        // Act
        List<Violation> violations = detector.detect(SyntaxTrees.context(source));

        // Assert
        assertEquals(1, violations.size());
        assertEquals(ViolationType.TYPE_SAFETY, violations.get(0).type());
        assertTrue(violations.get(0).suggestion().contains("NumberFormatException"));
    }

    @Test
    void detect_ShouldSkipLiteralsAndGuardedConversions() {
        // Arrange
        String source = """
                class Sample {
                    int port(String raw) {
                        int fallback = Integer.parseInt("8080");
                        try {
                            return Integer.parseInt(raw);
                        } catch (NumberFormatException e) {
                            return fallback;
                        }
                    }
                    Order read(String json) throws IOException {
                        return mapper.readValue(json, Order.class);
                    }
                }
                """;

        // Act & Assert
        assertTrue(detector.detect(SyntaxTrees.context(source)).isEmpty());
    }

    @Test
    void expectedException_ShouldMatchConversionFamily() {
        assertEquals("JsonProcessingException", TypeSafetyDetector.expectedException("readValue"));
        assertEquals("DateTimeParseException", TypeSafetyDetector.expectedException("LocalDate.parse"));
        assertEquals("IllegalArgumentException", TypeSafetyDetector.expectedException("UUID.fromString"));
        assertEquals("NumberFormatException", TypeSafetyDetector.expectedException("Long.parseLong"));
    }
}
