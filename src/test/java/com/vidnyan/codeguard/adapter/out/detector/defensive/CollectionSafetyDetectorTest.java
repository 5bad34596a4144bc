package com.vidnyan.codeguard.adapter.out.detector.defensive;

import com.vidnyan.codeguard.domain.model.Severity;
import com.vidnyan.codeguard.domain.model.Violation;
import com.vidnyan.codeguard.domain.model.ViolationType;
import com.vidnyan.codeguard.support.SyntaxTrees;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CollectionSafetyDetectorTest {

    private final CollectionSafetyDetector detector = new CollectionSafetyDetector();

    @Test
    void detect_ShouldFlagFixedIndexAccessWithoutBoundsCheck() {
        // Arrange
        String source = """
                class Sample {
                    String first(List<String> items, String[] parts) {
                        String head = parts[1];
                        return items.get(0) + head;
                    }
                }
                """;

        // Act
        List<Violation> violations = detector.detect(SyntaxTrees.context(source));

        // Assert
        assertEquals(2, violations.size());
        assertTrue(violations.stream().allMatch(v -> v.type() == ViolationType.COLLECTION_SAFETY));
        assertTrue(violations.stream().allMatch(v -> v.severity() == Severity.WARNING));
        assertTrue(violations.stream().anyMatch(v -> v.description().contains("parts[1]")));
        assertTrue(violations.stream().anyMatch(v -> v.description().contains("items.get(0)")));
    }

    @Test
    void detect_ShouldAcceptBoundsAndEmptyChecks() {
        // Arrange
        String source = """
                class Sample {
                    String first(List<String> items, String[] parts, Deque<String> stack) {
                        if (items.isEmpty() || parts.length > 1 || stack.isEmpty()) {
                            return "";
                        }
                        return items.get(0) + parts[1] + stack.pop();
                    }
                }
                """;

        // Act & Assert
        assertTrue(detector.detect(SyntaxTrees.context(source)).isEmpty());
    }

    @Test
    void detect_ShouldFlagRemovalFromPossiblyEmptyCollection() {
        // Arrange
        String source = """
                class Sample {
                    String next(Deque<String> stack) {
                        return stack.pop();
                    }
                }
                """;

        // Act
        List<Violation> violations = detector.detect(SyntaxTrees.context(source));

        // Assert
        assertEquals(1, violations.size());
        assertEquals("Call to 'stack.pop()' without empty check", violations.get(0).description());
    }
}
