package com.vidnyan.codeguard.adapter.out.component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vidnyan.codeguard.application.port.out.ComponentRepository;
import com.vidnyan.codeguard.domain.graph.ComponentContract;
import com.vidnyan.codeguard.domain.graph.ComponentNode;
import com.vidnyan.codeguard.domain.model.AnalysisNote;
import com.vidnyan.codeguard.domain.syntax.SyntaxTree;
import com.vidnyan.codeguard.scanner.RepositoryScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * File system based component repository.
 * Components are the sub-directories of the components directory; contracts are
 * OpenAPI-style YAML or JSON files named after the component.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemComponentRepository implements ComponentRepository {

    private static final List<String> CONTRACT_EXTENSIONS = List.of(".yaml", ".yml", ".json");
    private static final List<String> API_SUFFIXES = List.of("_api", "-api");

    private final ObjectMapper objectMapper;
    private final RepositoryScanner scanner;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    @Override
    public List<ComponentNode> findComponents(Path root, String componentsDir, String contractsDir,
                                              List<AnalysisNote> notes) {
        Path componentsRoot = root.resolve(componentsDir);
        if (!Files.isDirectory(componentsRoot)) {
            log.debug("No components directory at {}", componentsRoot);
            return List.of();
        }
        Map<String, ComponentContract> contracts = loadContracts(root, root.resolve(contractsDir), notes);

        List<ComponentNode> components = new ArrayList<>();
        try (Stream<Path> children = Files.list(componentsRoot)) {
            List<Path> directories = children
                    .filter(Files::isDirectory)
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .sorted()
                    .toList();
            for (Path directory : directories) {
                String name = directory.getFileName().toString();
                components.add(new ComponentNode(name, directory, sourceFiles(directory), contracts.get(name)));
                log.debug("Loaded component: {} (contract: {})", name, contracts.containsKey(name));
            }
        } catch (IOException e) {
            log.warn("Failed to list components in {}: {}", componentsRoot, e.getMessage());
        }
        log.info("Loaded {} components, {} contracts", components.size(), contracts.size());
        return components;
    }

    private List<Path> sourceFiles(Path directory) {
        try {
            return scanner.scanSourceFiles(directory, false);
        } catch (IOException e) {
            log.warn("Failed to scan component {}: {}", directory.getFileName(), e.getMessage());
            return List.of();
        }
    }

    private Map<String, ComponentContract> loadContracts(Path root, Path contractsRoot, List<AnalysisNote> notes) {
        Map<String, ComponentContract> contracts = new HashMap<>();
        if (!Files.isDirectory(contractsRoot)) {
            return contracts;
        }
        try (Stream<Path> files = Files.list(contractsRoot)) {
            for (Path file : files.filter(Files::isRegularFile).sorted().toList()) {
                contractName(file).ifPresent(name -> {
                    String displayPath = SyntaxTree.displayPath(file, root);
                    try {
                        JsonNode document = mapperFor(file).readTree(file.toFile());
                        contracts.put(name, toContract(name, document, message -> notes.add(
                                new AnalysisNote(displayPath, AnalysisNote.Kind.CONTRACT_ERROR, message))));
                    } catch (IOException | RuntimeException e) {
                        log.warn("Failed to load contract {}: {}", file.getFileName(), e.getMessage());
                        notes.add(new AnalysisNote(displayPath, AnalysisNote.Kind.CONTRACT_ERROR,
                                "contract not loaded: " + e.getMessage()));
                    }
                });
            }
        } catch (IOException e) {
            log.warn("Failed to list contracts in {}: {}", contractsRoot, e.getMessage());
        }
        return contracts;
    }

    private Optional<String> contractName(Path file) {
        String fileName = file.getFileName().toString();
        return CONTRACT_EXTENSIONS.stream()
                .filter(fileName::endsWith)
                .findFirst()
                .map(ext -> fileName.substring(0, fileName.length() - ext.length()))
                .map(FileSystemComponentRepository::stripApiSuffix);
    }

    static String stripApiSuffix(String stem) {
        for (String suffix : API_SUFFIXES) {
            if (stem.endsWith(suffix) && stem.length() > suffix.length()) {
                return stem.substring(0, stem.length() - suffix.length());
            }
        }
        return stem;
    }

    private ObjectMapper mapperFor(Path file) {
        return file.toString().endsWith(".json") ? objectMapper : yamlMapper;
    }

    ComponentContract toContract(String name, JsonNode document, Consumer<String> problems) {
        if (document == null || document.isMissingNode() || document.isNull()) {
            return new ComponentContract(name, null, null, null, Map.of(), Map.of());
        }
        String text = document.toString().toLowerCase(Locale.ROOT);
        Map<String, List<Object>> enums = new HashMap<>();
        Map<String, Boolean> nullables = new HashMap<>();
        collect(document, "", enums, nullables);
        return new ComponentContract(name, timeout(document, problems), datetimeFormat(document, text),
                idFormat(document, text), enums, nullables);
    }

    /**
     * Timeout in seconds, or null when absent or not a usable whole number.
     */
    private Integer timeout(JsonNode document, Consumer<String> problems) {
        JsonNode timeout = document.path("x-timeout");
        if (timeout.isMissingNode()) {
            timeout = document.path("info").path("x-timeout");
        }
        if (timeout.isMissingNode() || timeout.isNull()) {
            return null;
        }
        if (timeout.isIntegralNumber() && timeout.canConvertToInt() && timeout.intValue() >= 0) {
            return timeout.intValue();
        }
        if (timeout.isTextual()) {
            String text = timeout.asText().strip();
            if (text.matches("\\d{1,9}")) {
                return Integer.parseInt(text);
            }
        }
        problems.accept("x-timeout '" + timeout.asText() + "' is not a whole number of seconds in range; ignored");
        return null;
    }

    private String datetimeFormat(JsonNode document, String text) {
        if (text.contains("iso8601") || text.contains("iso-8601")) {
            return "ISO8601";
        }
        if (text.contains("unix") || text.contains("epoch")) {
            return "Unix timestamp";
        }
        if (text.contains("rfc3339")) {
            return "RFC3339";
        }
        return containsPair(document, "format", "date-time") ? "ISO8601" : null;
    }

    private String idFormat(JsonNode document, String text) {
        if (text.contains("uuid")) {
            return "UUID";
        }
        if (containsPair(document, "type", "integer")) {
            return "integer";
        }
        return containsPair(document, "type", "string") ? "string" : null;
    }

    private boolean containsPair(JsonNode node, String key, String value) {
        if (node.isObject()) {
            if (value.equals(node.path(key).asText(null))) {
                return true;
            }
            for (JsonNode child : node) {
                if (containsPair(child, key, value)) return true;
            }
        } else if (node.isArray()) {
            for (JsonNode child : node) {
                if (containsPair(child, key, value)) return true;
            }
        }
        return false;
    }

    private void collect(JsonNode node, String path, Map<String, List<Object>> enums, Map<String, Boolean> nullables) {
        if (node.isObject()) {
            JsonNode values = node.get("enum");
            if (values != null && values.isArray()) {
                List<Object> items = new ArrayList<>();
                values.forEach(v -> items.add(v.isNumber() ? v.numberValue() : v.asText()));
                enums.put(path, items);
            }
            JsonNode nullable = node.get("nullable");
            if (nullable != null && nullable.isBoolean()) {
                nullables.put(path, nullable.booleanValue());
            }
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                collect(field.getValue(), path.isEmpty() ? field.getKey() : path + "." + field.getKey(),
                        enums, nullables);
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                collect(node.get(i), path + "[" + i + "]", enums, nullables);
            }
        }
    }
}
