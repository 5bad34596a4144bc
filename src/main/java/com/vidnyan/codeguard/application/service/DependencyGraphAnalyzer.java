package com.vidnyan.codeguard.application.service;

import com.vidnyan.codeguard.application.port.out.ComponentRepository;
import com.vidnyan.codeguard.application.port.out.SyntaxTreeProvider;
import com.vidnyan.codeguard.domain.context.ContextWindow;
import com.vidnyan.codeguard.domain.context.GuardKind;
import com.vidnyan.codeguard.domain.graph.ComponentContract;
import com.vidnyan.codeguard.domain.graph.ComponentEdge;
import com.vidnyan.codeguard.domain.graph.ComponentGraph;
import com.vidnyan.codeguard.domain.graph.ComponentNode;
import com.vidnyan.codeguard.domain.graph.DependencyAnalysis;
import com.vidnyan.codeguard.domain.model.AnalysisNote;
import com.vidnyan.codeguard.domain.model.FailureType;
import com.vidnyan.codeguard.domain.model.Location;
import com.vidnyan.codeguard.domain.model.PredictedFailure;
import com.vidnyan.codeguard.domain.model.Severity;
import com.vidnyan.codeguard.domain.pattern.IntegrationSettings;
import com.vidnyan.codeguard.domain.pattern.PatternLibrary;
import com.vidnyan.codeguard.domain.pattern.PatternRule;
import com.vidnyan.codeguard.domain.syntax.NodeKind;
import com.vidnyan.codeguard.domain.syntax.ParseResult;
import com.vidnyan.codeguard.domain.syntax.SyntaxNode;
import com.vidnyan.codeguard.domain.syntax.SyntaxTree;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the component dependency graph and predicts failures at its edges:
 * circular dependencies, timeout cascades, unhandled or un-retried calls and
 * data-format disagreements between contracts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DependencyGraphAnalyzer {

    private final ComponentRepository componentRepository;
    private final SyntaxTreeProvider syntaxTreeProvider;

    public DependencyAnalysis analyze(Path root, String componentsDir, String contractsDir,
                                      PatternLibrary library, ContextWindow window) {
        List<AnalysisNote> notes = new ArrayList<>();
        List<ComponentNode> components = componentRepository.findComponents(root, componentsDir, contractsDir, notes);
        if (components.isEmpty()) {
            return DependencyAnalysis.withoutComponents(notes);
        }
        ComponentGraph graph = buildGraph(root, components, library.integration(), window, notes);
        ComponentGraph.Stats stats = graph.stats();
        log.info("Component graph: {} components, {} edges", stats.componentCount(), stats.edgeCount());

        List<PredictedFailure> failures = predictFailures(graph, library);
        log.info("Predicted {} integration failures", failures.size());
        return new DependencyAnalysis(graph, failures, notes);
    }

    // ============ Graph construction ============

    ComponentGraph buildGraph(Path root, List<ComponentNode> components, IntegrationSettings settings,
                              ContextWindow window, List<AnalysisNote> notes) {
        List<ComponentEdge> edges = new ArrayList<>();
        for (ComponentNode caller : components) {
            List<SyntaxTree> trees = parseAll(root, caller, notes);
            for (ComponentNode callee : components) {
                if (callee.name().equals(caller.name())) {
                    continue;
                }
                ComponentEdge edge = edgeBetween(caller, callee, trees, settings, window);
                if (edge != null) {
                    log.debug("Dependency {} -> {} ({} references)", caller.name(), callee.name(),
                            edge.references().size());
                    edges.add(edge);
                }
            }
        }
        return ComponentGraph.of(components, edges);
    }

    private List<SyntaxTree> parseAll(Path root, ComponentNode component, List<AnalysisNote> notes) {
        List<SyntaxTree> trees = new ArrayList<>();
        for (Path file : component.sourceFiles()) {
            ParseResult result = syntaxTreeProvider.parse(file, root);
            if (result.isSuccess()) {
                trees.add(result.tree());
            } else {
                log.warn("Skipping {} in component {}: {}", file, component.name(), result.error().describe());
                notes.add(AnalysisNote.of(result.error(), root));
            }
        }
        return trees;
    }

    private ComponentEdge edgeBetween(ComponentNode caller, ComponentNode callee, List<SyntaxTree> trees,
                                      IntegrationSettings settings, ContextWindow window) {
        List<Location> references = new ArrayList<>();
        boolean errorHandled = false;
        boolean retried = false;

        for (SyntaxTree tree : trees) {
            List<SyntaxNode> refs = referencesTo(tree, callee);
            if (refs.isEmpty()) {
                continue;
            }
            refs.stream().filter(n -> n.is(NodeKind.IMPORT, NodeKind.STRING_LITERAL))
                    .map(SyntaxNode::location)
                    .forEach(references::add);
            String text = tree.source().toLowerCase(Locale.ROOT);
            errorHandled |= refs.stream().anyMatch(n -> window.isInsideGuardedBlock(tree, n, GuardKind.EXCEPTION))
                    || settings.errorHandlingKeywords().stream().anyMatch(text::contains);
            retried |= settings.retryKeywords().stream().anyMatch(text::contains);
        }
        if (references.isEmpty()) {
            return null;
        }
        return new ComponentEdge(caller.name(), callee.name(), references, errorHandled, retried);
    }

    /**
     * Imports of the callee's packages, string literals naming the callee, and uses of
     * the types imported from it.
     */
    List<SyntaxNode> referencesTo(SyntaxTree tree, ComponentNode callee) {
        String normalized = callee.normalizedName();
        List<SyntaxNode> refs = new ArrayList<>();
        Set<String> importedNames = new HashSet<>();

        for (SyntaxNode imp : tree.findAll(NodeKind.IMPORT)) {
            String[] segments = imp.name().split("\\.");
            boolean matches = false;
            for (int i = 0; i < segments.length - 1; i++) {
                if (ComponentNode.normalize(segments[i]).equals(normalized)) {
                    matches = true;
                    break;
                }
            }
            if (matches) {
                refs.add(imp);
                String simple = segments[segments.length - 1];
                if (!simple.equals("*")) {
                    importedNames.add(simple);
                    importedNames.add(Character.toLowerCase(simple.charAt(0)) + simple.substring(1));
                }
            }
        }
        for (SyntaxNode node : tree.nodes()) {
            if (node.is(NodeKind.STRING_LITERAL) && node.name().equals(callee.name())) {
                refs.add(node);
            } else if (node.is(NodeKind.NAME, NodeKind.NEW_INSTANCE) && importedNames.contains(node.name())) {
                refs.add(node);
            }
        }
        return refs;
    }

    // ============ Failure prediction ============

    public List<PredictedFailure> predictFailures(ComponentGraph graph, PatternLibrary library) {
        List<PredictedFailure> failures = new ArrayList<>();
        failures.addAll(checkDataFormats(graph, library));
        failures.addAll(checkEdges(graph, library));
        failures.addAll(checkCycles(graph, library));
        return failures;
    }

    private List<PredictedFailure> checkEdges(ComponentGraph graph, PatternLibrary library) {
        int overhead = library.integration().timeoutOverheadSeconds();
        List<PredictedFailure> failures = new ArrayList<>();
        for (ComponentEdge edge : graph.edges()) {
            String a = edge.from();
            String b = edge.to();
            if (!edge.errorHandled()) {
                failures.add(failure(library, FailureType.MISSING_ERROR_HANDLING, a, b,
                        a + " calls " + b + " but doesn't handle errors", null));
            }
            if (!edge.retried()) {
                failures.add(failure(library, FailureType.MISSING_RETRY_LOGIC, a, b,
                        a + " calls " + b + " but doesn't implement retry logic", null));
            }
            Integer timeoutA = graph.node(a).flatMap(ComponentNode::timeoutSeconds).orElse(null);
            Integer timeoutB = graph.node(b).flatMap(ComponentNode::timeoutSeconds).orElse(null);
            if (timeoutA != null && timeoutB != null && timeoutA <= timeoutB + overhead) {
                failures.add(failure(library, FailureType.TIMEOUT_CASCADE, a, b,
                        "Timeout cascade risk: " + a + " timeout (" + timeoutA + "s) too close to "
                                + b + " timeout (" + timeoutB + "s)",
                        "Increase " + a + " timeout to at least " + (timeoutB + overhead + 10) + "s"));
            }
        }
        return failures;
    }

    private List<PredictedFailure> checkCycles(ComponentGraph graph, PatternLibrary library) {
        List<PredictedFailure> failures = new ArrayList<>();
        for (List<String> cycle : graph.findCycles()) {
            failures.add(failure(library, FailureType.CIRCULAR_DEPENDENCY,
                    cycle.get(0), cycle.get(cycle.size() - 2),
                    "Circular dependency detected: " + String.join(" -> ", cycle), null));
        }
        return failures;
    }

    private List<PredictedFailure> checkDataFormats(ComponentGraph graph, PatternLibrary library) {
        List<ComponentContract> contracts = graph.nodes().stream()
                .map(ComponentNode::contract)
                .filter(Objects::nonNull)
                .toList();
        List<PredictedFailure> failures = new ArrayList<>();
        for (int i = 0; i < contracts.size(); i++) {
            for (int j = i + 1; j < contracts.size(); j++) {
                failures.addAll(compareContracts(contracts.get(i), contracts.get(j), library));
            }
        }
        return failures;
    }

    List<PredictedFailure> compareContracts(ComponentContract a, ComponentContract b, PatternLibrary library) {
        List<PredictedFailure> failures = new ArrayList<>();
        String nameA = a.component();
        String nameB = b.component();

        if (a.datetimeFormat() != null && b.datetimeFormat() != null
                && !a.datetimeFormat().equals(b.datetimeFormat())) {
            failures.add(failure(library, FailureType.DATA_FORMAT_MISMATCH, nameA, nameB,
                    "Date/time format mismatch: " + nameA + " uses " + a.datetimeFormat()
                            + ", " + nameB + " uses " + b.datetimeFormat(), null));
        }
        if (a.idFormat() != null && b.idFormat() != null && !a.idFormat().equals(b.idFormat())) {
            failures.add(new PredictedFailure(FailureType.DATA_FORMAT_MISMATCH, nameA, nameB,
                    "ID format mismatch: " + nameA + " uses " + a.idFormat() + ", " + nameB + " uses " + b.idFormat(),
                    Severity.CRITICAL, "Standardize on UUID format for all IDs",
                    "Create ID format validation tests"));
        }
        for (String path : commonKeys(a.enums(), b.enums())) {
            if (!a.enums().get(path).equals(b.enums().get(path))) {
                failures.add(new PredictedFailure(FailureType.DATA_FORMAT_MISMATCH, nameA, nameB,
                        "Enum '" + path + "' has different values: " + nameA + "=" + a.enums().get(path)
                                + ", " + nameB + "=" + b.enums().get(path),
                        Severity.CRITICAL, "Standardize enum '" + path + "' values across all components",
                        "Create enum validation tests"));
            }
        }
        for (String path : commonKeys(a.nullables(), b.nullables())) {
            if (!a.nullables().get(path).equals(b.nullables().get(path))) {
                failures.add(new PredictedFailure(FailureType.DATA_FORMAT_MISMATCH, nameA, nameB,
                        "Field '" + path + "' nullable mismatch: " + nameA + "=" + a.nullables().get(path)
                                + ", " + nameB + "=" + b.nullables().get(path),
                        Severity.WARNING, "Standardize null handling for field '" + path + "'",
                        "Create null handling tests"));
            }
        }
        return failures;
    }

    private static Set<String> commonKeys(Map<String, ?> a, Map<String, ?> b) {
        Set<String> common = new TreeSet<>(a.keySet());
        common.retainAll(b.keySet());
        return common;
    }

    private PredictedFailure failure(PatternLibrary library, FailureType type, String a, String b,
                                     String description, String fix) {
        PatternRule rule = library.integrationRule(type);
        return new PredictedFailure(type, a, b, description, rule.severity(),
                fix != null ? fix : rule.fixStrategy(), rule.testGeneration());
    }
}
