package com.vidnyan.codeguard.domain.detector;

import com.vidnyan.codeguard.domain.context.ContextWindow;
import com.vidnyan.codeguard.domain.model.Severity;
import com.vidnyan.codeguard.domain.model.Violation;
import com.vidnyan.codeguard.domain.model.ViolationType;
import com.vidnyan.codeguard.domain.pattern.PatternLibrary;
import com.vidnyan.codeguard.domain.syntax.SyntaxNode;
import com.vidnyan.codeguard.domain.syntax.SyntaxTree;

/**
 * Everything a detector may look at for one file.
 */
public record DetectionContext(
    SyntaxTree tree,
    ContextWindow window,
    PatternLibrary patterns
) {

    public static DetectionContext of(SyntaxTree tree, ContextWindow window, PatternLibrary patterns) {
        return new DetectionContext(tree, window, patterns);
    }

    public String snippet(SyntaxNode node) {
        return tree.snippet(node);
    }

    /**
     * Finding anchored at a node, with the node's source line as snippet.
     */
    public Violation violation(SyntaxNode node, ViolationType type, Severity severity,
                               String description, String suggestion) {
        return Violation.builder()
                .location(node.location())
                .type(type)
                .severity(severity)
                .description(description)
                .snippet(tree.snippet(node))
                .suggestion(suggestion)
                .build();
    }
}
