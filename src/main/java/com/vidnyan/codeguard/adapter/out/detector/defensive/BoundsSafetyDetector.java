package com.vidnyan.codeguard.adapter.out.detector.defensive;

import com.vidnyan.codeguard.domain.context.CheckKind;
import com.vidnyan.codeguard.domain.detector.DetectionContext;
import com.vidnyan.codeguard.domain.detector.ViolationDetector;
import com.vidnyan.codeguard.domain.model.Severity;
import com.vidnyan.codeguard.domain.model.Violation;
import com.vidnyan.codeguard.domain.model.ViolationType;
import com.vidnyan.codeguard.domain.syntax.NodeKind;
import com.vidnyan.codeguard.domain.syntax.SyntaxNode;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Division and modulo by a variable with no zero check in the lines above.
 */
@Component
@Order(50)
public class BoundsSafetyDetector implements ViolationDetector {

    private static final Set<String> OPERATORS = Set.of("/", "%", "/=", "%=");

    @Override
    public List<Violation> detect(DetectionContext context) {
        List<Violation> violations = new ArrayList<>();
        for (SyntaxNode op : context.tree().findAll(NodeKind.BINARY_OP, NodeKind.AUGMENTED_ASSIGNMENT)) {
            if (!OPERATORS.contains(op.name()) || op.children().size() != 2) {
                continue;
            }
            SyntaxNode divisor = op.children().get(1);
            if (!divisor.is(NodeKind.NAME)
                    || !Receivers.isVariable(divisor.name(), context.patterns().defensive())) {
                continue;
            }
            String name = divisor.name();
            if (context.window().hasPriorCheck(context.tree(), op.line(), name, CheckKind.ZERO_CHECK)) {
                continue;
            }
            violations.add(context.violation(op, ViolationType.BOUNDS_SAFETY, Severity.WARNING,
                    "Division/modulo operation without zero check on '" + name + "'",
                    "if (" + name + " != 0) { " + context.snippet(op) + " }"));
        }
        return violations;
    }
}
