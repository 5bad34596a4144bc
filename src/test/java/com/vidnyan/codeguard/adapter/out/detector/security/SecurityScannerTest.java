package com.vidnyan.codeguard.adapter.out.detector.security;

import com.vidnyan.codeguard.domain.model.Severity;
import com.vidnyan.codeguard.domain.model.Violation;
import com.vidnyan.codeguard.domain.model.ViolationType;
import com.vidnyan.codeguard.domain.pattern.PatternLibrary;
import com.vidnyan.codeguard.domain.pattern.SecurityPatterns;
import com.vidnyan.codeguard.domain.syntax.SyntaxTree;
import com.vidnyan.codeguard.support.SyntaxTrees;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SecurityScannerTest {

    private final SecurityScanner scanner = new SecurityScanner();
    private final SecurityPatterns patterns = PatternLibrary.builtInDefaults().security();

    @Test
    void findSqlInjection_ShouldFlagConcatenationButNotPlaceholders() {
        // Arrange
        SyntaxTree tree = SyntaxTrees.parse("""
                class UserDao {
                    User find(String id) {
                        String unsafe = "SELECT * FROM users WHERE id = " + id;
                        String safe = "SELECT * FROM users WHERE id = ?";
                        return jdbc.queryForObject(safe, mapper, id);
                    }
                }
                """);

        // Act
        List<Violation> violations = scanner.findSqlInjection(tree, patterns);

        // Assert
        assertEquals(1, violations.size());
        Violation v = violations.get(0);
        assertEquals(ViolationType.SQL_INJECTION, v.type());
        assertEquals(Severity.CRITICAL, v.severity());
        assertEquals(3, v.line());
    }

    @Test
    void findSqlInjection_ShouldFlagFormattedQueries() {
        // Arrange
        SyntaxTree tree = SyntaxTrees.parse("""
                class UserDao {
                    String byName(String name) {
                        String a = "select * from users where name = '%s'".formatted(name);
                        String b = String.format("DELETE FROM users WHERE name = '%s'", name);
                        return a + b;
                    }
                }
                """);

        // Act
        List<Violation> violations = scanner.findSqlInjection(tree, patterns);

        // Assert
        assertEquals(2, violations.size());
        assertEquals(3, violations.get(0).line());
        assertEquals(4, violations.get(1).line());
    }

    @Test
    void findSqlInjection_ShouldFlagTextBlockAndWrappedConcatenation() {
        // Arrange
        SyntaxTree tree = SyntaxTrees.parse("""
                class OrderDao {
                    List<Order> byCustomer(String customerId) {
                        String sql = \"""
                                SELECT * FROM orders
                                WHERE customer_id = '%s'
                                \""".formatted(customerId);
                        return jdbc.query(sql, mapper);
                    }

                    Order byId(String id) {
                        String sql = "SELECT * FROM orders WHERE id = "
                                + id;
                        return jdbc.queryForObject(sql, mapper);
                    }
                }
                """);

        // Act
        List<Violation> violations = scanner.findSqlInjection(tree, patterns);

        // Assert
        assertEquals(2, violations.size());
        assertEquals(3, violations.get(0).line());
        assertEquals("Potential SQL injection: query built with String.formatted", violations.get(0).description());
        assertEquals(11, violations.get(1).line());
        assertEquals("Potential SQL injection: query built with string concatenation", violations.get(1).description());
    }

    @Test
    void findSqlInjection_ShouldFlagBuilderAppendsButNotConstantConcatenation() {
        // Arrange
        SyntaxTree tree = SyntaxTrees.parse("""
                class ReportDao {
                    String query(String region) {
                        StringBuilder sb = new StringBuilder();
                        sb.append("SELECT * FROM sales WHERE region = '");
                        sb.append(region).append("'");
                        String fixed = "SELECT * FROM sales " + "WHERE region = ?";
                        return sb.toString() + fixed;
                    }
                }
                """);

        // Act
        List<Violation> violations = scanner.findSqlInjection(tree, patterns);

        // Assert
        assertEquals(1, violations.size());
        assertEquals(4, violations.get(0).line());
        assertEquals("Potential SQL injection: query built with StringBuilder.append", violations.get(0).description());
    }

    @Test
    void findPiiInLogs_ShouldFlagSensitiveLogArguments() {
        // Arrange
        SyntaxTree tree = SyntaxTrees.parse("""
                class AuthService {
                    void login(String user, String password) {
                        log.info("Login for {}", user);
                        log.debug("Login for {} with password {}", user, password);
                        System.out.println("card_number=" + card);
                    }
                }
                """);

        // Act
        List<Violation> violations = scanner.findPiiInLogs(tree, patterns);

        // Assert
        assertEquals(2, violations.size());
        assertTrue(violations.stream().allMatch(v -> v.type() == ViolationType.PII_IN_LOGS));
        assertEquals("Potential PII in log statement: 'password'", violations.get(0).description());
        assertEquals(5, violations.get(1).line());
    }

    @Test
    void findMissingAuthorization_ShouldRespectAnnotationsAndExactPublicNames() {
        // Arrange
        SyntaxTree tree = SyntaxTrees.parse("""
                @RestController
                class OrderController {
                    @GetMapping("/orders")
                    List<Order> list() { return List.of(); }

                    @PreAuthorize("hasRole('ADMIN')")
                    @DeleteMapping("/orders/{id}")
                    void delete(String id) { }

                    @GetMapping("/health")
                    String health() { return "ok"; }

                    @PutMapping("/orders/{id}/status")
                    void updateStatus(String id) { }
                }

                @Secured("ROLE_USER")
                @RestController
                class ProfileController {
                    @GetMapping("/me")
                    String me() { return "me"; }
                }
                """);

        // Act
        List<Violation> violations = scanner.findMissingAuthorization(tree, patterns);

        // Assert
        assertEquals(2, violations.size());
        assertEquals(ViolationType.MISSING_AUTHORIZATION, violations.get(0).type());
        assertEquals(Severity.WARNING, violations.get(0).severity());
        assertTrue(violations.get(0).description().contains("'list'"));
        assertTrue(violations.get(1).description().contains("'updateStatus'"));
    }
}
