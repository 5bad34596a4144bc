package com.vidnyan.codeguard.application.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.codeguard.adapter.out.component.FileSystemComponentRepository;
import com.vidnyan.codeguard.adapter.out.parser.JavaParserSyntaxTreeProvider;
import com.vidnyan.codeguard.domain.context.ContextWindow;
import com.vidnyan.codeguard.domain.graph.ComponentContract;
import com.vidnyan.codeguard.domain.graph.ComponentEdge;
import com.vidnyan.codeguard.domain.graph.ComponentGraph;
import com.vidnyan.codeguard.domain.graph.ComponentNode;
import com.vidnyan.codeguard.domain.graph.DependencyAnalysis;
import com.vidnyan.codeguard.domain.model.FailureType;
import com.vidnyan.codeguard.domain.model.PredictedFailure;
import com.vidnyan.codeguard.domain.model.Severity;
import com.vidnyan.codeguard.domain.pattern.PatternLibrary;
import com.vidnyan.codeguard.scanner.RepositoryScanner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphAnalyzerTest {

    @TempDir
    Path tempDir;

    private final PatternLibrary library = PatternLibrary.builtInDefaults();
    private final DependencyGraphAnalyzer analyzer = new DependencyGraphAnalyzer(
            new FileSystemComponentRepository(new ObjectMapper(), new RepositoryScanner()),
            new JavaParserSyntaxTreeProvider());

    @Test
    void predictFailures_ShouldWarnWhenCallerTimeoutIsTooClose() {
        // Arrange
        ComponentGraph graph = twoComponents(10, 8);

        // Act
        List<PredictedFailure> failures = analyzer.predictFailures(graph, library);

        // Assert
        assertEquals(1, failures.size());
        PredictedFailure failure = failures.get(0);
        assertEquals(FailureType.TIMEOUT_CASCADE, failure.type());
        assertEquals(Severity.WARNING, failure.severity());
        assertEquals("orders", failure.componentA());
        assertEquals("billing", failure.componentB());
        assertEquals("Increase orders timeout to at least 23s", failure.fixStrategy());
    }

    @Test
    void predictFailures_ShouldAcceptTimeoutWithEnoughHeadroom() {
        // Arrange
        ComponentGraph graph = twoComponents(20, 8);

        // Act & Assert
        assertTrue(analyzer.predictFailures(graph, library).isEmpty());
    }

    @Test
    void compareContracts_ShouldReportEnumAndNullableDifferences() {
        // Arrange
        ComponentContract a = new ComponentContract("orders", null, "ISO8601", "UUID",
                Map.of("status", List.of("NEW", "PAID")), Map.of("note", true));
        ComponentContract b = new ComponentContract("billing", null, "ISO8601", "UUID",
                Map.of("status", List.of("NEW", "SETTLED")), Map.of("note", false));

        // Act
        List<PredictedFailure> failures = analyzer.compareContracts(a, b, library);

        // Assert
        assertEquals(2, failures.size());
        assertEquals(Severity.CRITICAL, failures.get(0).severity());
        assertTrue(failures.get(0).description().startsWith("Enum 'status'"));
        assertEquals(Severity.WARNING, failures.get(1).severity());
    }

    @Test
    void analyze_ShouldBuildGraphFromComponentSources() throws IOException {
        // Arrange
        write("components/orders/OrderClient.java", """
                package shop.orders;

                import shop.billing.BillingApi;

                class OrderClient {
                    private BillingApi billingApi;

                    void pay() {
                        billingApi.charge();
                    }
                }
                """);
        write("components/billing/BillingService.java", """
                package shop.billing;

                import shop.orders.OrderApi;

                class BillingService {
                    void refund(OrderApi orderApi) {
                        try {
                            orderApi.cancel();
                        } catch (RuntimeException e) {
                            retryLater(e);
                        }
                    }
                }
                """);
        write("contracts/orders.yaml", """
                x-timeout: 10
                components:
                  schemas:
                    Order:
                      properties:
                        createdAt:
                          type: string
                          format: date-time
                """);
        write("contracts/billing_api.yaml", """
                info:
                  x-timeout: 30
                components:
                  schemas:
                    Invoice:
                      properties:
                        issuedAt:
                          type: integer
                          description: unix epoch seconds
                """);

        // Act
        DependencyAnalysis analysis = analyzer.analyze(tempDir, "components", "contracts",
                library, ContextWindow.withDefaults());

        // Assert
        ComponentGraph graph = analysis.graph();
        assertEquals(2, graph.stats().edgeCount());
        ComponentEdge ordersToBilling = graph.edge("orders", "billing").orElseThrow();
        assertFalse(ordersToBilling.errorHandled());
        assertFalse(ordersToBilling.retried());
        ComponentEdge billingToOrders = graph.edge("billing", "orders").orElseThrow();
        assertTrue(billingToOrders.errorHandled());
        assertTrue(billingToOrders.retried());

        List<PredictedFailure> failures = analysis.failures();
        assertEquals(1, count(failures, FailureType.CIRCULAR_DEPENDENCY));
        assertEquals(1, count(failures, FailureType.TIMEOUT_CASCADE));
        assertEquals(1, count(failures, FailureType.MISSING_ERROR_HANDLING));
        assertEquals(1, count(failures, FailureType.MISSING_RETRY_LOGIC));
        assertEquals(2, count(failures, FailureType.DATA_FORMAT_MISMATCH));
        assertTrue(failures.stream().anyMatch(f -> f.description()
                .equals("Circular dependency detected: billing -> orders -> billing")));
        assertTrue(analysis.notes().isEmpty());
    }

    @Test
    void analyze_ShouldReturnEmptyWithoutComponentsDirectory() {
        // Act
        DependencyAnalysis analysis = analyzer.analyze(tempDir, "components", "contracts",
                library, ContextWindow.withDefaults());

        // Assert
        assertTrue(analysis.failures().isEmpty());
        assertTrue(analysis.graph().nodes().isEmpty());
    }

    @Test
    void analyze_ShouldTurnUnreadableTimeoutIntoNote() throws IOException {
        // Arrange
        write("components/orders/OrderService.java", """
                package shop.orders;

                class OrderService {
                    void place() { }
                }
                """);
        write("contracts/orders.yaml", """
                x-timeout: "99999999999"
                """);

        // Act
        DependencyAnalysis analysis = analyzer.analyze(tempDir, "components", "contracts",
                library, ContextWindow.withDefaults());

        // Assert
        assertEquals(1, analysis.graph().nodes().size());
        assertEquals(1, analysis.notes().size());
        assertEquals("contracts/orders.yaml", analysis.notes().get(0).file());
        assertTrue(analysis.failures().isEmpty());
    }

    private ComponentGraph twoComponents(int ordersTimeout, int billingTimeout) {
        ComponentNode orders = new ComponentNode("orders", Path.of("orders"), List.of(),
                new ComponentContract("orders", ordersTimeout, null, null, Map.of(), Map.of()));
        ComponentNode billing = new ComponentNode("billing", Path.of("billing"), List.of(),
                new ComponentContract("billing", billingTimeout, null, null, Map.of(), Map.of()));
        return ComponentGraph.of(List.of(orders, billing),
                List.of(new ComponentEdge("orders", "billing", List.of(), true, true)));
    }

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private static long count(List<PredictedFailure> failures, FailureType type) {
        return failures.stream().filter(f -> f.type() == type).count();
    }
}
