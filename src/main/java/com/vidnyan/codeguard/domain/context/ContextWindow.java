package com.vidnyan.codeguard.domain.context;

import com.vidnyan.codeguard.domain.syntax.NodeKind;
import com.vidnyan.codeguard.domain.syntax.SyntaxNode;
import com.vidnyan.codeguard.domain.syntax.SyntaxTree;

import java.util.List;

/**
 * Answers "was this already checked?" for a line of a parsed file.
 * <p>
 * Prior checks are a textual heuristic over the lines above the target:
 * a missed guard costs a false positive, a guard in a comment a false negative.
 * Guarded blocks are structural and found by walking the parent index.
 * Stateless apart from the lookback length, so one instance serves all workers.
 */
public final class ContextWindow {

    public static final int DEFAULT_LOOKBACK_LINES = 5;

    private final int lookbackLines;

    public ContextWindow(int lookbackLines) {
        if (lookbackLines < 0) {
            throw new IllegalArgumentException("lookbackLines must not be negative: " + lookbackLines);
        }
        this.lookbackLines = lookbackLines;
    }

    public static ContextWindow withDefaults() {
        return new ContextWindow(DEFAULT_LOOKBACK_LINES);
    }

    public int lookbackLines() {
        return lookbackLines;
    }

    public boolean hasPriorCheck(SyntaxTree tree, int line, String variable, CheckKind kind) {
        return hasPriorCheck(tree, line, variable, kind, 0);
    }

    /**
     * Whether one of the {@code lookbackLines} lines above {@code line} holds a check of the given kind.
     *
     * @param index accessed index, only used by {@link CheckKind#BOUNDS_CHECK}
     */
    public boolean hasPriorCheck(SyntaxTree tree, int line, String variable, CheckKind kind, int index) {
        if (variable == null || variable.isEmpty()) {
            return false;
        }
        int from = Math.max(1, line - lookbackLines);
        for (int n = line - 1; n >= from; n--) {
            if (kind.matches(tree.line(n), variable, index)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Walks up the parent index until a guard of the given kind or a class boundary is reached.
     */
    public boolean isInsideGuardedBlock(SyntaxTree tree, SyntaxNode node, GuardKind guardKind) {
        SyntaxNode previous = node;
        for (SyntaxNode ancestor : tree.ancestorsOf(node)) {
            if (ancestor.is(NodeKind.CLASS_DEF)) {
                return false;
            }
            switch (guardKind) {
                case EXCEPTION -> {
                    if (previous.is(NodeKind.TRY_BODY) && hasHandler(ancestor)) return true;
                }
                case RESOURCE -> {
                    if (previous.is(NodeKind.TRY_BODY) && ancestor.hasAttribute("resources")) return true;
                }
                case LOCK -> {
                    if (ancestor.is(NodeKind.LOCK_BLOCK)) return true;
                    if (ancestor.is(NodeKind.FUNCTION_DEF) && ancestor.hasAttribute("synchronized")) return true;
                    if (previous.is(NodeKind.TRY_BODY) && unlocksInFinally(ancestor)) return true;
                }
            }
            previous = ancestor;
        }
        return false;
    }

    /**
     * Whether the node sits on the right of a {@code &&} whose left side null-checks the variable,
     * as in {@code v != null && v.isValid()}.
     */
    public boolean isShortCircuitGuarded(SyntaxTree tree, SyntaxNode node, String variable) {
        SyntaxNode previous = node;
        for (SyntaxNode ancestor : tree.ancestorsOf(node)) {
            if (ancestor.is(NodeKind.BINARY_OP) && ancestor.name().equals("&&")
                    && ancestor.children().size() == 2
                    && ancestor.children().get(1) == previous
                    && nullChecks(ancestor.children().get(0), variable)) {
                return true;
            }
            if (ancestor.kind().isCallable() || ancestor.is(NodeKind.CLASS_DEF)) {
                return false;
            }
            previous = ancestor;
        }
        return false;
    }

    private static boolean hasHandler(SyntaxNode tryNode) {
        return tryNode.is(NodeKind.TRY)
                && tryNode.children().stream().anyMatch(c -> c.is(NodeKind.EXCEPTION_HANDLER));
    }

    private static boolean unlocksInFinally(SyntaxNode tryNode) {
        return tryNode.is(NodeKind.TRY) && tryNode.children().stream()
                .filter(c -> c.is(NodeKind.FINALLY_BODY))
                .flatMap(c -> c.descendantsAndSelf().stream())
                .anyMatch(n -> n.is(NodeKind.CALL) && n.name().equals("unlock"));
    }

    private static boolean nullChecks(SyntaxNode condition, String variable) {
        return condition.descendantsAndSelf().stream()
                .filter(n -> n.is(NodeKind.BINARY_OP) && n.name().equals("!="))
                .map(SyntaxNode::children)
                .anyMatch(operands -> isNullComparison(operands, variable));
    }

    private static boolean isNullComparison(List<SyntaxNode> operands, String variable) {
        if (operands.size() != 2) return false;
        SyntaxNode left = operands.get(0);
        SyntaxNode right = operands.get(1);
        return (isName(left, variable) && isNull(right)) || (isNull(left) && isName(right, variable));
    }

    private static boolean isName(SyntaxNode node, String variable) {
        return node.is(NodeKind.NAME) && node.name().equals(variable);
    }

    private static boolean isNull(SyntaxNode node) {
        return node.is(NodeKind.LITERAL) && node.name().equals("null");
    }
}
