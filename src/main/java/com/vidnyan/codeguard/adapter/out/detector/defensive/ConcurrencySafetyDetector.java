package com.vidnyan.codeguard.adapter.out.detector.defensive;

import com.vidnyan.codeguard.domain.context.GuardKind;
import com.vidnyan.codeguard.domain.detector.DetectionContext;
import com.vidnyan.codeguard.domain.detector.ViolationDetector;
import com.vidnyan.codeguard.domain.model.Severity;
import com.vidnyan.codeguard.domain.model.Violation;
import com.vidnyan.codeguard.domain.model.ViolationType;
import com.vidnyan.codeguard.domain.syntax.NodeKind;
import com.vidnyan.codeguard.domain.syntax.SyntaxNode;
import com.vidnyan.codeguard.domain.syntax.SyntaxTree;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes to {@code this.field} outside constructors and outside any lock.
 */
@Component
@Order(70)
public class ConcurrencySafetyDetector implements ViolationDetector {

    @Override
    public List<Violation> detect(DetectionContext context) {
        SyntaxTree tree = context.tree();
        List<Violation> violations = new ArrayList<>();

        for (SyntaxNode write : tree.findAll(NodeKind.ASSIGNMENT, NodeKind.AUGMENTED_ASSIGNMENT)) {
            SyntaxNode target = write.child(0).orElse(null);
            if (target == null || !isInstanceField(target)) {
                continue;
            }
            boolean inConstructor = tree.enclosingCallable(write)
                    .map(c -> c.is(NodeKind.CONSTRUCTOR_DEF))
                    .orElse(true);
            if (inConstructor || context.window().isInsideGuardedBlock(tree, write, GuardKind.LOCK)) {
                continue;
            }
            violations.add(context.violation(write, ViolationType.CONCURRENCY_SAFETY, Severity.WARNING,
                    "Shared field '" + target.name() + "' modified without synchronization",
                    "synchronized (lock) { " + context.snippet(write) + " }"));
        }
        return violations;
    }

    private boolean isInstanceField(SyntaxNode target) {
        return target.is(NodeKind.ATTRIBUTE_ACCESS)
                && target.receiver().filter(r -> r.is(NodeKind.NAME) && r.name().equals("this")).isPresent();
    }
}
