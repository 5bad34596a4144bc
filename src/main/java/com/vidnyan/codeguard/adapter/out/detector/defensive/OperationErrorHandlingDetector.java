package com.vidnyan.codeguard.adapter.out.detector.defensive;

import com.vidnyan.codeguard.domain.context.GuardKind;
import com.vidnyan.codeguard.domain.detector.DetectionContext;
import com.vidnyan.codeguard.domain.detector.ViolationDetector;
import com.vidnyan.codeguard.domain.model.Violation;
import com.vidnyan.codeguard.domain.model.ViolationType;
import com.vidnyan.codeguard.domain.pattern.OperationRequirement;
import com.vidnyan.codeguard.domain.syntax.NodeKind;
import com.vidnyan.codeguard.domain.syntax.SyntaxNode;
import com.vidnyan.codeguard.domain.syntax.SyntaxTree;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Database, remote API and file operations that neither run inside a try/catch nor
 * propagate through a {@code throws} clause. File operations opened as a
 * try-with-resources resource, or used inside its body, count as handled.
 */
@Component
@Order(80)
public class OperationErrorHandlingDetector implements ViolationDetector {

    @Override
    public List<Violation> detect(DetectionContext context) {
        SyntaxTree tree = context.tree();
        List<Violation> violations = new ArrayList<>();

        for (SyntaxNode call : tree.findAll(NodeKind.CALL)) {
            Optional<String> receiver = call.receiver()
                    .filter(r -> r.is(NodeKind.NAME, NodeKind.ATTRIBUTE_ACCESS))
                    .map(SyntaxNode::name);
            if (receiver.isEmpty()) {
                continue;
            }
            Optional<OperationRequirement> requirement = context.patterns().errorHandlingRequirements().stream()
                    .filter(r -> r.matches(receiver.get(), call.name()))
                    .findFirst();
            if (requirement.isEmpty() || isHandled(context, call, requirement.get())) {
                continue;
            }
            OperationRequirement op = requirement.get();
            violations.add(context.violation(call, ViolationType.ERROR_HANDLING_MISSING, op.severity(),
                    "Missing error handling for " + op.label() + ": '" + receiver.get() + "." + call.name() + "'",
                    op.fixStrategy()));
        }

        for (SyntaxNode creation : tree.findAll(NodeKind.NEW_INSTANCE)) {
            Optional<OperationRequirement> requirement = context.patterns().errorHandlingRequirements().stream()
                    .filter(r -> r.matchesConstruction(creation.name()))
                    .findFirst();
            if (requirement.isEmpty() || isHandled(context, creation, requirement.get())) {
                continue;
            }
            OperationRequirement op = requirement.get();
            violations.add(context.violation(creation, ViolationType.ERROR_HANDLING_MISSING, op.severity(),
                    "Missing error handling for " + op.label() + ": 'new " + creation.name() + "'",
                    op.fixStrategy()));
        }
        return violations;
    }

    private boolean isHandled(DetectionContext context, SyntaxNode node, OperationRequirement requirement) {
        SyntaxTree tree = context.tree();
        if (context.window().isInsideGuardedBlock(tree, node, GuardKind.EXCEPTION)
                || tree.enclosingCallable(node).map(SyntaxNode::declaresThrows).orElse(false)) {
            return true;
        }
        return requirement.acceptResources()
                && (isTryResource(tree, node) || context.window().isInsideGuardedBlock(tree, node, GuardKind.RESOURCE));
    }

    /**
     * Whether the node is part of a resource declaration of the nearest try statement.
     */
    private boolean isTryResource(SyntaxTree tree, SyntaxNode node) {
        SyntaxNode previous = node;
        for (SyntaxNode ancestor : tree.ancestorsOf(node)) {
            if (ancestor.kind().isCallable() || ancestor.is(NodeKind.CLASS_DEF)) {
                return false;
            }
            if (ancestor.is(NodeKind.TRY)) {
                return ancestor.hasAttribute("resources")
                        && !previous.is(NodeKind.TRY_BODY, NodeKind.EXCEPTION_HANDLER, NodeKind.FINALLY_BODY);
            }
            previous = ancestor;
        }
        return false;
    }
}
