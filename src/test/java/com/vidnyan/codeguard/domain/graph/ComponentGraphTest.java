package com.vidnyan.codeguard.domain.graph;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComponentGraphTest {

    @Test
    void findCycles_ShouldReportTwoNodeCycleOnce() {
        // Arrange
        ComponentGraph graph = ComponentGraph.of(
                List.of(node("orders"), node("billing")),
                List.of(edge("orders", "billing"), edge("billing", "orders")));

        // Act
        List<List<String>> cycles = graph.findCycles();

        // Assert
        assertEquals(List.of(List.of("billing", "orders", "billing")), cycles);
    }

    @Test
    void findCycles_ShouldNotDependOnInsertionOrder() {
        // Arrange
        ComponentGraph forward = ComponentGraph.of(
                List.of(node("a"), node("b"), node("c")),
                List.of(edge("a", "b"), edge("b", "c"), edge("c", "a")));
        ComponentGraph reversed = ComponentGraph.of(
                List.of(node("c"), node("b"), node("a")),
                List.of(edge("c", "a"), edge("b", "c"), edge("a", "b")));

        // Act & Assert
        assertEquals(List.of(List.of("a", "b", "c", "a")), forward.findCycles());
        assertEquals(forward.findCycles(), reversed.findCycles());
    }

    @Test
    void findCycles_ShouldReturnEmptyForAcyclicGraph() {
        // Arrange
        ComponentGraph graph = ComponentGraph.of(
                List.of(node("gateway"), node("orders"), node("billing")),
                List.of(edge("gateway", "orders"), edge("orders", "billing"), edge("gateway", "billing")));

        // Act & Assert
        assertTrue(graph.findCycles().isEmpty());
        assertEquals(new ComponentGraph.Stats(3, 3), graph.stats());
    }

    @Test
    void of_ShouldRejectEdgeToUnknownComponent() {
        assertThrows(IllegalArgumentException.class, () -> ComponentGraph.of(
                List.of(node("orders")), List.of(edge("orders", "billing"))));
    }

    @Test
    void normalize_ShouldRotateToSmallestMember() {
        assertEquals(List.of("a", "b", "c", "a"), ComponentGraph.normalize(List.of("b", "c", "a")));
    }

    private static ComponentNode node(String name) {
        return new ComponentNode(name, Path.of("components", name), List.of(), null);
    }

    private static ComponentEdge edge(String from, String to) {
        return new ComponentEdge(from, to, List.of(), true, true);
    }
}
