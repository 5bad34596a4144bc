package com.vidnyan.codeguard.domain.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Upward links for a syntax tree, keyed by node id.
 * Built once per tree in a single traversal; read-only afterwards.
 */
public final class ParentIndex {

    private final Map<Integer, SyntaxNode> parents;

    private ParentIndex(Map<Integer, SyntaxNode> parents) {
        this.parents = parents;
    }

    public static ParentIndex build(SyntaxNode root) {
        Map<Integer, SyntaxNode> parents = new HashMap<>();
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            for (SyntaxNode child : node.children()) {
                parents.put(child.id(), node);
                stack.push(child);
            }
        }
        return new ParentIndex(Map.copyOf(parents));
    }

    public Optional<SyntaxNode> parentOf(SyntaxNode node) {
        return Optional.ofNullable(parents.get(node.id()));
    }

    /**
     * Ancestors from the direct parent up to the root.
     */
    public List<SyntaxNode> ancestorsOf(SyntaxNode node) {
        List<SyntaxNode> ancestors = new ArrayList<>();
        SyntaxNode current = parents.get(node.id());
        while (current != null) {
            ancestors.add(current);
            current = parents.get(current.id());
        }
        return ancestors;
    }

    public int size() {
        return parents.size();
    }
}
