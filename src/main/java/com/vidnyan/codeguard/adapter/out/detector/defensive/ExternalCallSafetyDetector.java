package com.vidnyan.codeguard.adapter.out.detector.defensive;

import com.vidnyan.codeguard.domain.detector.DetectionContext;
import com.vidnyan.codeguard.domain.detector.ViolationDetector;
import com.vidnyan.codeguard.domain.model.Severity;
import com.vidnyan.codeguard.domain.model.Violation;
import com.vidnyan.codeguard.domain.pattern.CallMatcher;
import com.vidnyan.codeguard.domain.pattern.ExternalCallSpec;
import com.vidnyan.codeguard.domain.syntax.NodeKind;
import com.vidnyan.codeguard.domain.syntax.SyntaxNode;
import com.vidnyan.codeguard.domain.syntax.SyntaxTree;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Network and process calls made without a timeout.
 * <p>
 * A call is safe when it passes enough arguments to carry a timeout, or when one
 * of its timeout markers is called in the same method (or, outside methods,
 * the same class).
 */
@Component
@Order(30)
public class ExternalCallSafetyDetector implements ViolationDetector {

    @Override
    public List<Violation> detect(DetectionContext context) {
        SyntaxTree tree = context.tree();
        List<Violation> violations = new ArrayList<>();

        for (SyntaxNode node : tree.findAll(NodeKind.CALL, NodeKind.NEW_INSTANCE)) {
            for (ExternalCallSpec spec : context.patterns().defensive().externalCalls()) {
                if (!spec.matches(node) || hasTimeout(tree, node, spec)) {
                    continue;
                }
                violations.add(context.violation(node, spec.type(), Severity.CRITICAL,
                        spec.description() + ": '" + spec.call() + "'",
                        suggestion(spec)));
                break;
            }
        }
        return violations;
    }

    private boolean hasTimeout(SyntaxTree tree, SyntaxNode node, ExternalCallSpec spec) {
        if (spec.minArgs() > 0 && node.arguments().size() >= spec.minArgs()) {
            return true;
        }
        if (spec.timeoutMarkers().isEmpty()) {
            return false;
        }
        SyntaxNode scope = tree.enclosingCallable(node)
                .or(() -> tree.enclosing(node, NodeKind.CLASS_DEF))
                .orElse(tree.root());
        return scope.descendantsAndSelf().stream()
                .filter(n -> n.is(NodeKind.CALL))
                .anyMatch(call -> spec.timeoutMarkers().stream()
                        .anyMatch(marker -> CallMatcher.nameMatches(marker, call.qualifiedName())));
    }

    private String suggestion(ExternalCallSpec spec) {
        if (!spec.timeoutMarkers().isEmpty()) {
            return "Configure a timeout with " + String.join(" / ", spec.timeoutMarkers())
                    + ", e.g. Duration.ofSeconds(10)";
        }
        if (spec.minArgs() > 0) {
            return "Pass an explicit timeout to " + spec.call() + ", e.g. waitFor(30, TimeUnit.SECONDS)";
        }
        return "Use a builder that sets an explicit timeout instead of " + spec.call();
    }
}
