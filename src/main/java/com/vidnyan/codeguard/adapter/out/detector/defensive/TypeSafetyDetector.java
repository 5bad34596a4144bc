package com.vidnyan.codeguard.adapter.out.detector.defensive;

import com.vidnyan.codeguard.domain.context.GuardKind;
import com.vidnyan.codeguard.domain.detector.DetectionContext;
import com.vidnyan.codeguard.domain.detector.ViolationDetector;
import com.vidnyan.codeguard.domain.model.Severity;
import com.vidnyan.codeguard.domain.model.Violation;
import com.vidnyan.codeguard.domain.model.ViolationType;
import com.vidnyan.codeguard.domain.pattern.CallMatcher;
import com.vidnyan.codeguard.domain.syntax.NodeKind;
import com.vidnyan.codeguard.domain.syntax.SyntaxNode;
import com.vidnyan.codeguard.domain.syntax.SyntaxTree;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parsing and conversion calls that can throw on malformed input but are not
 * wrapped in a try/catch. Conversions of constants are skipped.
 */
@Component
@Order(40)
public class TypeSafetyDetector implements ViolationDetector {

    @Override
    public List<Violation> detect(DetectionContext context) {
        SyntaxTree tree = context.tree();
        List<Violation> violations = new ArrayList<>();

        for (SyntaxNode node : tree.findAll(NodeKind.CALL, NodeKind.NEW_INSTANCE)) {
            Optional<String> conversion = context.patterns().defensive().conversions().stream()
                    .filter(pattern -> CallMatcher.matches(pattern, node))
                    .findFirst();
            if (conversion.isEmpty() || onlyLiterals(node.arguments())) {
                continue;
            }
            if (context.window().isInsideGuardedBlock(tree, node, GuardKind.EXCEPTION)
                    || propagatesCheckedFailure(tree, node, conversion.get())) {
                continue;
            }
            String exception = expectedException(conversion.get());
            violations.add(context.violation(node, ViolationType.TYPE_SAFETY, Severity.WARNING,
                    "Type conversion '" + conversion.get() + "' without error handling",
                    "try { " + tree.snippet(node) + " } catch (" + exception + " e) { /* handle invalid input */ }"));
        }
        return violations;
    }

    private boolean onlyLiterals(List<SyntaxNode> arguments) {
        return !arguments.isEmpty() && arguments.stream()
                .allMatch(a -> a.is(NodeKind.STRING_LITERAL, NodeKind.NUMBER_LITERAL, NodeKind.LITERAL));
    }

    // Checked parse failures in a method that declares throws are handled by the caller.
    private boolean propagatesCheckedFailure(SyntaxTree tree, SyntaxNode node, String conversion) {
        return isJson(conversion) && tree.enclosingCallable(node)
                .map(SyntaxNode::declaresThrows)
                .orElse(false);
    }

    static String expectedException(String conversion) {
        if (isJson(conversion)) {
            return "JsonProcessingException";
        }
        if (conversion.endsWith(".parse")) {
            return "DateTimeParseException";
        }
        if (conversion.startsWith("UUID.")) {
            return "IllegalArgumentException";
        }
        return "NumberFormatException";
    }

    private static boolean isJson(String conversion) {
        return conversion.equals("readValue") || conversion.equals("readTree")
                || conversion.startsWith("JsonParser.");
    }
}
