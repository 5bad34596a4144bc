package com.vidnyan.codeguard.adapter.out.detector.defensive;

import com.vidnyan.codeguard.domain.model.Severity;
import com.vidnyan.codeguard.domain.model.Violation;
import com.vidnyan.codeguard.domain.model.ViolationType;
import com.vidnyan.codeguard.support.SyntaxTrees;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OperationErrorHandlingDetectorTest {

    private final OperationErrorHandlingDetector detector = new OperationErrorHandlingDetector();

    @Test
    void detect_ShouldFlagDatabaseAndApiCallsOutsideTry() {
        // Arrange
        String source = """
                class Sample {
                    void save(Order order) {
                        jdbcTemplate.update("insert into orders values (?)", order.getId());
                        restTemplate.postForObject("/audit", order, Void.class);
                    }
                }
                """;

        // Act
        List<Violation> violations = detector.detect(SyntaxTrees.context(source));

        // Assert
        assertEquals(2, violations.size());
        assertTrue(violations.stream().allMatch(v -> v.type() == ViolationType.ERROR_HANDLING_MISSING));
        assertTrue(violations.stream().allMatch(v -> v.severity() == Severity.CRITICAL));
        assertTrue(violations.get(0).description().contains("jdbcTemplate.update"));
    }

    @Test
    void detect_ShouldAcceptTryBlockOrDeclaredThrows() {
        // Arrange
        String source = """
                class Sample {
                    void save(Order order) {
                        try {
                            jdbcTemplate.update("insert into orders values (?)", order.getId());
                        } catch (DataAccessException e) {
                            throw new OrderException(e);
                        }
                    }
                    void commit(Connection connection) throws SQLException {
                        connection.commit();
                    }
                }
                """;

        // Act & Assert
        assertTrue(detector.detect(SyntaxTrees.context(source)).isEmpty());
    }

    @Test
    void detect_ShouldFlagUnguardedFileOperations() {
        // Arrange
        String source = """
                class ConfigStore {
                    String read(Path path) {
                        String text = Files.readString(path);
                        Reader reader = new FileReader("settings.properties");
                        try (BufferedReader in = Files.newBufferedReader(path)) {
                            return in.readLine() + text;
                        }
                    }
                    void save(Path path, String text) {
                        try {
                            Files.writeString(path, text);
                        } catch (IOException e) {
                            throw new UncheckedIOException(e);
                        }
                        profiles.delete(path);
                    }
                }
                """;

        // Act
        List<Violation> violations = detector.detect(SyntaxTrees.context(source));

        // Assert
        assertEquals(2, violations.size());
        assertTrue(violations.stream().allMatch(v -> v.severity() == Severity.WARNING));
        assertEquals(3, violations.get(0).line());
        assertEquals("Missing error handling for file operations: 'Files.readString'", violations.get(0).description());
        assertEquals(4, violations.get(1).line());
        assertEquals("Missing error handling for file operations: 'new FileReader'", violations.get(1).description());
    }
}
