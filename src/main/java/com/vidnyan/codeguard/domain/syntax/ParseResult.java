package com.vidnyan.codeguard.domain.syntax;

import java.util.Optional;

/**
 * Either a parsed tree or the reason parsing failed.
 */
public record ParseResult(SyntaxTree tree, ParseError error) {

    public static ParseResult success(SyntaxTree tree) {
        return new ParseResult(tree, null);
    }

    public static ParseResult failure(ParseError error) {
        return new ParseResult(null, error);
    }

    public boolean isSuccess() {
        return tree != null;
    }

    public Optional<SyntaxTree> treeIfPresent() {
        return Optional.ofNullable(tree);
    }
}
