package com.vidnyan.codeguard.domain.context;

import com.vidnyan.codeguard.domain.syntax.NodeKind;
import com.vidnyan.codeguard.domain.syntax.SyntaxNode;
import com.vidnyan.codeguard.domain.syntax.SyntaxTree;
import com.vidnyan.codeguard.support.SyntaxTrees;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContextWindowTest {

    private final ContextWindow window = ContextWindow.withDefaults();

    @Test
    void hasPriorCheck_ShouldSeeNullCheckWithinLookback() {
        // Arrange
        SyntaxTree tree = SyntaxTrees.parse("""
                class Sample {
                    String name(User user) {
                        if (user == null) {
                            return "";
                        }
                        return user.getName();
                    }
                }
                """);

        // Act & Assert
        assertTrue(window.hasPriorCheck(tree, 6, "user", CheckKind.NONE_CHECK));
        assertFalse(window.hasPriorCheck(tree, 6, "account", CheckKind.NONE_CHECK));
    }

    @Test
    void hasPriorCheck_ShouldIgnoreChecksBeyondLookback() {
        // Arrange
        SyntaxTree tree = SyntaxTrees.parse("""
                class Sample {
                    String name(User user) {
                        Objects.requireNonNull(user);
                        int a = 1;
                        int b = 2;
                        int c = 3;
                        int d = 4;
                        int e = 5;
                        return user.getName();
                    }
                }
                """);

        // Act & Assert
        assertFalse(window.hasPriorCheck(tree, 9, "user", CheckKind.NONE_CHECK));
        assertTrue(new ContextWindow(6).hasPriorCheck(tree, 9, "user", CheckKind.NONE_CHECK));
    }

    @Test
    void hasPriorCheck_ShouldNotLookAtTheTargetLineItself() {
        // Arrange
        SyntaxTree tree = SyntaxTrees.parse("""
                class Sample {
                    boolean active(User user) { return user != null && user.isActive(); }
                }
                """);

        // Act & Assert
        assertFalse(window.hasPriorCheck(tree, 2, "user", CheckKind.NONE_CHECK));
    }

    @Test
    void boundsCheck_ShouldRequireBoundCoveringIndex() {
        // Arrange
        SyntaxTree tree = SyntaxTrees.parse("""
                class Sample {
                    String third(List<String> items) {
                        if (items.size() > 2) {
                            return items.get(2);
                        }
                        return null;
                    }
                }
                """);

        // Act & Assert
        assertTrue(window.hasPriorCheck(tree, 4, "items", CheckKind.BOUNDS_CHECK, 2));
        assertFalse(window.hasPriorCheck(tree, 4, "items", CheckKind.BOUNDS_CHECK, 3));
    }

    @Test
    void boundsCheck_ShouldHandleBoundsBeyondIntRange() {
        // Arrange
        SyntaxTree tree = SyntaxTrees.parse("""
                class Sample {
                    long pick(long[] values) {
                        if (values.length > 10000000000L) {
                            return values[3];
                        }
                        return 0;
                    }
                }
                """);

        // Act & Assert
        assertTrue(window.hasPriorCheck(tree, 4, "values", CheckKind.BOUNDS_CHECK, 3));
        assertEquals(10_000_000_000L, CheckKind.bound("10000000000"));
        assertEquals(Long.MAX_VALUE, CheckKind.bound("99999999999999999999"));
        assertEquals(7L, CheckKind.bound("007"));
    }

    @Test
    void isInsideGuardedBlock_ShouldDetectTryBodyWithHandler() {
        // Arrange
        SyntaxTree tree = SyntaxTrees.parse("""
                class Sample {
                    int parse(String raw) {
                        try {
                            return Integer.parseInt(raw);
                        } catch (NumberFormatException e) {
                            return 0;
                        }
                    }
                    int parseUnsafe(String raw) {
                        return Integer.parseInt(raw);
                    }
                }
                """);
        SyntaxNode guarded = call(tree, 4);
        SyntaxNode unguarded = call(tree, 10);

        // Act & Assert
        assertTrue(window.isInsideGuardedBlock(tree, guarded, GuardKind.EXCEPTION));
        assertFalse(window.isInsideGuardedBlock(tree, unguarded, GuardKind.EXCEPTION));
    }

    @Test
    void isInsideGuardedBlock_ShouldDetectLocks() {
        // Arrange
        SyntaxTree tree = SyntaxTrees.parse("""
                class Sample {
                    private final Object lock = new Object();
                    private int count;
                    void increment() {
                        synchronized (lock) {
                            this.count++;
                        }
                    }
                    synchronized void reset() {
                        this.count = 0;
                    }
                    void bump() {
                        this.count += 2;
                    }
                }
                """);

        // Act & Assert
        assertTrue(window.isInsideGuardedBlock(tree, write(tree, 6), GuardKind.LOCK));
        assertTrue(window.isInsideGuardedBlock(tree, write(tree, 10), GuardKind.LOCK));
        assertFalse(window.isInsideGuardedBlock(tree, write(tree, 13), GuardKind.LOCK));
    }

    @Test
    void isShortCircuitGuarded_ShouldAcceptNullCheckOnLeftOfAnd() {
        // Arrange
        SyntaxTree tree = SyntaxTrees.parse("""
                class Sample {
                    boolean active(User user) { return user != null && user.isActive(); }
                }
                """);
        SyntaxNode access = tree.findAll(NodeKind.ATTRIBUTE_ACCESS).get(0);

        // Act & Assert
        assertTrue(window.isShortCircuitGuarded(tree, access, "user"));
        assertFalse(window.isShortCircuitGuarded(tree, access, "other"));
    }

    @Test
    void constructor_ShouldRejectNegativeLookback() {
        assertThrows(IllegalArgumentException.class, () -> new ContextWindow(-1));
    }

    private static SyntaxNode call(SyntaxTree tree, int line) {
        return tree.findAll(n -> n.is(NodeKind.CALL) && n.line() == line).get(0);
    }

    private static SyntaxNode write(SyntaxTree tree, int line) {
        return tree.findAll(n -> n.is(NodeKind.ASSIGNMENT, NodeKind.AUGMENTED_ASSIGNMENT) && n.line() == line).get(0);
    }
}
