package com.vidnyan.codeguard.domain.pattern;

import com.vidnyan.codeguard.domain.syntax.NodeKind;
import com.vidnyan.codeguard.domain.syntax.SyntaxNode;

/**
 * Matches configured call patterns against call nodes.
 * <p>
 * {@code parseInt} matches any call named so, {@code Integer.parseInt} matches
 * a dotted suffix of the callee chain and {@code new BigDecimal} matches a
 * constructor call.
 */
public final class CallMatcher {

    private CallMatcher() {
    }

    public static boolean matches(String pattern, SyntaxNode node) {
        if (pattern.startsWith("new ")) {
            if (!node.is(NodeKind.NEW_INSTANCE)) return false;
            String type = pattern.substring(4).trim();
            return node.name().equals(type.substring(type.lastIndexOf('.') + 1));
        }
        return node.is(NodeKind.CALL) && nameMatches(pattern, node.qualifiedName());
    }

    public static boolean nameMatches(String pattern, String qualifiedName) {
        if (pattern.contains(".")) {
            return qualifiedName.equals(pattern) || qualifiedName.endsWith("." + pattern);
        }
        return qualifiedName.substring(qualifiedName.lastIndexOf('.') + 1).equals(pattern);
    }
}
