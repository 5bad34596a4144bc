package com.vidnyan.codeguard.adapter.out.component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.codeguard.domain.graph.ComponentNode;
import com.vidnyan.codeguard.domain.model.AnalysisNote;
import com.vidnyan.codeguard.scanner.RepositoryScanner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemComponentRepositoryTest {

    @TempDir
    Path tempDir;

    private final FileSystemComponentRepository repository =
            new FileSystemComponentRepository(new ObjectMapper(), new RepositoryScanner());

    @Test
    void findComponents_ShouldKeepGoingPastBadContracts() throws IOException {
        // Arrange
        write("components/billing/BillingService.java", "class BillingService {}");
        write("components/orders/OrderService.java", "class OrderService {}");
        write("components/payments/PaymentService.java", "class PaymentService {}");
        write("contracts/billing.yml", "x-timeout: [10\n");
        write("contracts/orders.yaml", "x-timeout: \"99999999999\"\n");
        write("contracts/payments-api.yaml", "x-timeout: 15\n");
        List<AnalysisNote> notes = new ArrayList<>();

        // Act
        List<ComponentNode> components = repository.findComponents(tempDir, "components", "contracts", notes);

        // Assert
        assertEquals(List.of("billing", "orders", "payments"),
                components.stream().map(ComponentNode::name).toList());
        assertTrue(components.get(0).contractIfPresent().isEmpty());
        assertTrue(components.get(1).contractIfPresent().isPresent());
        assertEquals(Optional.empty(), components.get(1).timeoutSeconds());
        assertEquals(Optional.of(15), components.get(2).timeoutSeconds());

        assertEquals(2, notes.size());
        assertTrue(notes.stream().allMatch(n -> n.kind() == AnalysisNote.Kind.CONTRACT_ERROR));
        assertEquals(List.of("contracts/billing.yml", "contracts/orders.yaml"),
                notes.stream().map(AnalysisNote::file).toList());
        assertTrue(notes.get(1).message().contains("99999999999"));
    }

    @Test
    void findComponents_ShouldIgnoreNumericTimeoutOutOfIntRange() throws IOException {
        // Arrange
        write("components/orders/OrderService.java", "class OrderService {}");
        write("contracts/orders.json", "{\"info\": {\"x-timeout\": 99999999999}}");
        List<AnalysisNote> notes = new ArrayList<>();

        // Act
        List<ComponentNode> components = repository.findComponents(tempDir, "components", "contracts", notes);

        // Assert
        assertEquals(Optional.empty(), components.get(0).timeoutSeconds());
        assertEquals(1, notes.size());
    }

    @Test
    void stripApiSuffix_ShouldOnlyRemoveTrailingSuffix() {
        assertEquals("billing", FileSystemComponentRepository.stripApiSuffix("billing_api"));
        assertEquals("billing", FileSystemComponentRepository.stripApiSuffix("billing-api"));
        assertEquals("my_api_gateway", FileSystemComponentRepository.stripApiSuffix("my_api_gateway"));
        assertEquals("_api", FileSystemComponentRepository.stripApiSuffix("_api"));
    }

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
