package com.vidnyan.codeguard.domain.syntax;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Immutable parse of one source file: text, node arena and parent index.
 */
public final class SyntaxTree {

    private final Path file;
    private final String path;
    private final String source;
    private final List<String> lines;
    private final SyntaxNode root;
    private final List<SyntaxNode> nodes;
    private final ParentIndex parents;

    private SyntaxTree(Path file, String path, String source, SyntaxNode root) {
        this.file = file;
        this.path = path;
        this.source = source;
        this.lines = source.lines().toList();
        this.root = root;
        this.nodes = root.descendantsAndSelf();
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).id() != i) {
                throw new IllegalArgumentException("Node ids must follow pre-order, got "
                        + nodes.get(i).id() + " at position " + i);
            }
        }
        this.parents = ParentIndex.build(root);
    }

    public static SyntaxTree of(Path file, String displayPath, String source, SyntaxNode root) {
        return new SyntaxTree(file, displayPath, source, root);
    }

    /**
     * Path of a file relative to the analysis root, {@code /}-separated.
     */
    public static String displayPath(Path file, Path root) {
        Path relative = root != null && file.startsWith(root) ? root.relativize(file) : file;
        return relative.toString().replace('\\', '/');
    }

    public Path file() {
        return file;
    }

    /**
     * Path relative to the analysis root, as reported.
     */
    public String path() {
        return path;
    }

    public String source() {
        return source;
    }

    public SyntaxNode root() {
        return root;
    }

    public List<SyntaxNode> nodes() {
        return nodes;
    }

    public SyntaxNode node(int id) {
        return nodes.get(id);
    }

    public ParentIndex parents() {
        return parents;
    }

    public int lineCount() {
        return lines.size();
    }

    public boolean containsLine(int line) {
        return line >= 1 && line <= lines.size();
    }

    /**
     * Text of a 1-based line, empty when out of range.
     */
    public String line(int line) {
        return containsLine(line) ? lines.get(line - 1) : "";
    }

    /**
     * Source text spanned by a node, whole lines.
     */
    public String textOf(SyntaxNode node) {
        int from = Math.max(1, node.location().line());
        int to = Math.min(lines.size(), Math.max(from, node.location().endLine()));
        if (!containsLine(from)) return "";
        return String.join("\n", lines.subList(from - 1, to));
    }

    public String snippet(SyntaxNode node) {
        return line(node.line()).strip();
    }

    public List<SyntaxNode> findAll(NodeKind... kinds) {
        return nodes.stream().filter(n -> n.is(kinds)).toList();
    }

    public List<SyntaxNode> findAll(Predicate<SyntaxNode> predicate) {
        return nodes.stream().filter(predicate).toList();
    }

    public Optional<SyntaxNode> parentOf(SyntaxNode node) {
        return parents.parentOf(node);
    }

    public List<SyntaxNode> ancestorsOf(SyntaxNode node) {
        return parents.ancestorsOf(node);
    }

    /**
     * Nearest ancestor of one of the given kinds.
     */
    public Optional<SyntaxNode> enclosing(SyntaxNode node, NodeKind... kinds) {
        List<NodeKind> wanted = Arrays.asList(kinds);
        return parents.ancestorsOf(node).stream()
                .filter(a -> wanted.contains(a.kind()))
                .findFirst();
    }

    /**
     * Nearest enclosing method, constructor or lambda.
     */
    public Optional<SyntaxNode> enclosingCallable(SyntaxNode node) {
        return enclosing(node, NodeKind.FUNCTION_DEF, NodeKind.CONSTRUCTOR_DEF, NodeKind.LAMBDA);
    }
}
