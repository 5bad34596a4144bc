package com.vidnyan.codeguard.adapter.out.detector.defensive;

import com.vidnyan.codeguard.domain.context.CheckKind;
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
 * Fixed-index reads and removals from collections that may be too short or empty.
 */
@Component
@Order(20)
public class CollectionSafetyDetector implements ViolationDetector {

    @Override
    public List<Violation> detect(DetectionContext context) {
        SyntaxTree tree = context.tree();
        DefensivePatterns patterns = context.patterns().defensive();
        List<Violation> violations = new ArrayList<>();

        for (SyntaxNode subscript : tree.findAll(NodeKind.SUBSCRIPT)) {
            SyntaxNode base = subscript.children().get(0);
            int index = Receivers.intLiteral(subscript.children().get(1));
            if (index < 0 || !base.is(NodeKind.NAME) || !Receivers.isVariable(base.name(), patterns)) {
                continue;
            }
            if (!context.window().hasPriorCheck(tree, subscript.line(), base.name(), CheckKind.BOUNDS_CHECK, index)) {
                violations.add(context.violation(subscript, ViolationType.COLLECTION_SAFETY, Severity.WARNING,
                        "Array access '" + base.name() + "[" + index + "]' without bounds check",
                        "if (" + base.name() + ".length > " + index + ") { " + tree.snippet(subscript) + " }"));
            }
        }

        for (SyntaxNode call : tree.findAll(NodeKind.CALL)) {
            Optional<String> receiver = Receivers.variableOf(call, patterns);
            if (receiver.isEmpty()) {
                continue;
            }
            String name = receiver.get();
            if (call.name().equals("get") && call.arguments().size() == 1) {
                int index = Receivers.intLiteral(call.arguments().get(0));
                if (index >= 0 && !context.window().hasPriorCheck(tree, call.line(), name, CheckKind.BOUNDS_CHECK, index)) {
                    violations.add(context.violation(call, ViolationType.COLLECTION_SAFETY, Severity.WARNING,
                            "List access '" + name + ".get(" + index + ")' without bounds check",
                            "if (" + name + ".size() > " + index + ") { " + tree.snippet(call) + " }"));
                }
            } else if (call.arguments().isEmpty() && patterns.emptyUnsafeCalls().contains(call.name())
                    && !context.window().hasPriorCheck(tree, call.line(), name, CheckKind.EMPTY_CHECK)) {
                violations.add(context.violation(call, ViolationType.COLLECTION_SAFETY, Severity.WARNING,
                        "Call to '" + name + "." + call.name() + "()' without empty check",
                        "if (!" + name + ".isEmpty()) { " + tree.snippet(call) + " }"));
            }
        }
        return violations;
    }
}
