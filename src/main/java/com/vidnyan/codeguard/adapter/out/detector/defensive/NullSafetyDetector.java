package com.vidnyan.codeguard.adapter.out.detector.defensive;

import com.vidnyan.codeguard.domain.context.CheckKind;
import com.vidnyan.codeguard.domain.context.ContextWindow;
import com.vidnyan.codeguard.domain.detector.DetectionContext;
import com.vidnyan.codeguard.domain.detector.ViolationDetector;
import com.vidnyan.codeguard.domain.model.Severity;
import com.vidnyan.codeguard.domain.model.Violation;
import com.vidnyan.codeguard.domain.model.ViolationType;
import com.vidnyan.codeguard.domain.pattern.DefensivePatterns;
import com.vidnyan.codeguard.domain.syntax.NodeKind;
import com.vidnyan.codeguard.domain.syntax.SyntaxNode;
import com.vidnyan.codeguard.domain.syntax.SyntaxTree;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Dereferences of variables that were never null-checked nearby, and
 * dereferences of {@code map.get("key")} without a {@code containsKey} check.
 */
@Component
@Order(10)
public class NullSafetyDetector implements ViolationDetector {

    @Override
    public List<Violation> detect(DetectionContext context) {
        SyntaxTree tree = context.tree();
        ContextWindow window = context.window();
        DefensivePatterns patterns = context.patterns().defensive();
        List<Violation> violations = new ArrayList<>();

        for (SyntaxNode access : tree.findAll(NodeKind.ATTRIBUTE_ACCESS)) {
            if (patterns.safeAccessors().contains(access.name())) {
                continue;
            }
            Optional<String> variable = Receivers.variableOf(access, patterns);
            if (variable.isEmpty()) {
                continue;
            }
            String name = variable.get();
            if (window.hasPriorCheck(tree, access.line(), name, CheckKind.NONE_CHECK)
                    || window.isShortCircuitGuarded(tree, access, name)) {
                continue;
            }
            violations.add(context.violation(access, ViolationType.NULL_SAFETY, Severity.CRITICAL,
                    "Attribute access on '" + name + "' without null check",
                    "if (" + name + " != null) { " + tree.snippet(access) + " }"));
        }

        for (SyntaxNode lookup : tree.findAll(NodeKind.CALL)) {
            checkKeyedLookup(context, lookup).ifPresent(violations::add);
        }
        return violations;
    }

    private Optional<Violation> checkKeyedLookup(DetectionContext context, SyntaxNode call) {
        if (!call.name().equals("get") || call.arguments().size() != 1
                || !call.arguments().get(0).is(NodeKind.STRING_LITERAL)) {
            return Optional.empty();
        }
        Optional<String> map = Receivers.variableOf(call, context.patterns().defensive());
        if (map.isEmpty() || !isDereferenced(context.tree(), call)) {
            return Optional.empty();
        }
        String key = call.arguments().get(0).name();
        if (context.window().hasPriorCheck(context.tree(), call.line(), map.get(), CheckKind.KEY_CHECK)) {
            return Optional.empty();
        }
        return Optional.of(context.violation(call, ViolationType.NULL_SAFETY, Severity.CRITICAL,
                "Map lookup '" + map.get() + ".get(\"" + key + "\")' dereferenced without key check",
                map.get() + ".getOrDefault(\"" + key + "\", defaultValue)"));
    }

    private boolean isDereferenced(SyntaxTree tree, SyntaxNode call) {
        return tree.parentOf(call)
                .filter(parent -> parent.is(NodeKind.ATTRIBUTE_ACCESS))
                .flatMap(parent -> parent.child(0))
                .filter(receiver -> receiver == call)
                .isPresent();
    }
}
