package com.vidnyan.codeguard.domain.syntax;

import com.vidnyan.codeguard.domain.model.Location;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Node of a parsed source file.
 * <p>
 * Nodes are immutable and owned by the {@link SyntaxTree} that produced them.
 * The id is the node's pre-order index inside that tree. Shapes produced by the
 * parser adapter:
 * <ul>
 *   <li>{@code CALL(name)}: child 0 is the callee ({@code ATTRIBUTE_ACCESS} or {@code NAME}), the rest are arguments</li>
 *   <li>{@code ATTRIBUTE_ACCESS(name)}: child 0 is the receiver</li>
 *   <li>{@code NEW_INSTANCE(type)}: arguments, then an optional anonymous {@code CLASS_DEF}</li>
 *   <li>{@code ASSIGNMENT} / {@code AUGMENTED_ASSIGNMENT(op)}: target, then value</li>
 *   <li>{@code BINARY_OP(op)}: left, right</li>
 *   <li>{@code SUBSCRIPT}: base, index</li>
 *   <li>{@code EXCEPTION_HANDLER(types)}: handler body statements</li>
 * </ul>
 */
public final class SyntaxNode {

    private final int id;
    private final NodeKind kind;
    private final String name;
    private final Location location;
    private final Set<String> attributes;
    private final String comment;
    private final List<SyntaxNode> children;

    public SyntaxNode(int id, NodeKind kind, String name, Location location,
                      Set<String> attributes, String comment, List<SyntaxNode> children) {
        this.id = id;
        this.kind = kind;
        this.name = name == null ? "" : name;
        this.location = location;
        this.attributes = Set.copyOf(attributes);
        this.comment = comment == null ? "" : comment;
        this.children = List.copyOf(children);
    }

    public int id() {
        return id;
    }

    public NodeKind kind() {
        return kind;
    }

    /**
     * Identifier, method name, operator, literal value or caught types, depending on the kind.
     */
    public String name() {
        return name;
    }

    public Location location() {
        return location;
    }

    public int line() {
        return location.line();
    }

    /**
     * Modifiers ({@code synchronized}), annotations ({@code @GetMapping}) and
     * thrown types ({@code throws IOException}).
     */
    public Set<String> attributes() {
        return attributes;
    }

    public String comment() {
        return comment;
    }

    public List<SyntaxNode> children() {
        return children;
    }

    public boolean is(NodeKind... kinds) {
        for (NodeKind k : kinds) {
            if (k == kind) return true;
        }
        return false;
    }

    public boolean hasAttribute(String attribute) {
        return attributes.contains(attribute);
    }

    public boolean hasAnnotation(String simpleName) {
        return attributes.contains("@" + simpleName);
    }

    public boolean declaresThrows() {
        return attributes.stream().anyMatch(a -> a.startsWith("throws "));
    }

    public Optional<SyntaxNode> child(int index) {
        return index < children.size() ? Optional.of(children.get(index)) : Optional.empty();
    }

    /**
     * Callee of a call node.
     */
    public Optional<SyntaxNode> callee() {
        return kind == NodeKind.CALL ? child(0) : Optional.empty();
    }

    /**
     * Receiver of a call or attribute access: {@code x} in {@code x.foo()} and {@code x.foo}.
     */
    public Optional<SyntaxNode> receiver() {
        if (kind == NodeKind.ATTRIBUTE_ACCESS) {
            return child(0);
        }
        if (kind == NodeKind.CALL) {
            return callee().filter(c -> c.kind == NodeKind.ATTRIBUTE_ACCESS).flatMap(c -> c.child(0));
        }
        return Optional.empty();
    }

    public List<SyntaxNode> arguments() {
        return switch (kind) {
            case CALL -> children.subList(Math.min(1, children.size()), children.size());
            case NEW_INSTANCE -> children.stream().filter(c -> c.kind != NodeKind.CLASS_DEF).toList();
            default -> List.of();
        };
    }

    /**
     * Dotted name of a reference chain, e.g. {@code HttpClient.newBuilder} for
     * the callee of {@code HttpClient.newBuilder()}. Unnamed links are skipped.
     */
    public String qualifiedName() {
        return switch (kind) {
            case NAME, NEW_INSTANCE -> name;
            case CALL -> callee().map(SyntaxNode::qualifiedName).orElse(name);
            case ATTRIBUTE_ACCESS -> {
                String prefix = child(0).map(SyntaxNode::qualifiedName).orElse("");
                yield prefix.isEmpty() ? name : prefix + "." + name;
            }
            default -> "";
        };
    }

    /**
     * This node and its descendants in pre-order.
     */
    public List<SyntaxNode> descendantsAndSelf() {
        List<SyntaxNode> out = new ArrayList<>();
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            out.add(node);
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.children.get(i));
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return kind + (name.isEmpty() ? "" : "(" + name + ")") + "@" + location.line();
    }
}
