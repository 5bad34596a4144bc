package com.vidnyan.codeguard.adapter.out.detector.defensive;

import com.vidnyan.codeguard.domain.pattern.DefensivePatterns;
import com.vidnyan.codeguard.domain.syntax.NodeKind;
import com.vidnyan.codeguard.domain.syntax.SyntaxNode;

import java.util.Optional;

/**
 * Receiver classification shared by the defensive detectors.
 */
final class Receivers {

    private Receivers() {
    }

    /**
     * The simple variable a call or attribute access is made on, if any.
     * Type names, allow-listed receivers and package roots are not variables.
     */
    static Optional<String> variableOf(SyntaxNode node, DefensivePatterns patterns) {
        return node.receiver()
                .filter(r -> r.is(NodeKind.NAME))
                .map(SyntaxNode::name)
                .filter(name -> isVariable(name, patterns));
    }

    static boolean isVariable(String name, DefensivePatterns patterns) {
        return !name.isEmpty()
                && !Character.isUpperCase(name.charAt(0))
                && !patterns.safeReceivers().contains(name)
                && !patterns.allowedPackages().contains(name);
    }

    /**
     * Integer value of a literal, or -1 when the node is not a plain int literal.
     */
    static int intLiteral(SyntaxNode node) {
        if (!node.is(NodeKind.NUMBER_LITERAL)) return -1;
        String digits = node.name().replace("_", "");
        if (digits.endsWith("L") || digits.endsWith("l")) {
            digits = digits.substring(0, digits.length() - 1);
        }
        if (!digits.chars().allMatch(Character::isDigit) || digits.isEmpty() || digits.length() > 9) {
            return -1;
        }
        return Integer.parseInt(digits);
    }
}
