package com.vidnyan.codeguard.domain.syntax;

import java.nio.file.Path;

/**
 * Why a file could not be turned into a syntax tree.
 * Callers skip the file and keep going.
 *
 * @param line first problem line, 0 when unknown
 */
public record ParseError(Path file, Kind kind, int line, String message) {

    public enum Kind {
        SYNTAX,
        IO
    }

    public static ParseError syntax(Path file, int line, String message) {
        return new ParseError(file, Kind.SYNTAX, line, message);
    }

    public static ParseError io(Path file, String message) {
        return new ParseError(file, Kind.IO, 0, message);
    }

    public String describe() {
        return switch (kind) {
            case SYNTAX -> line > 0
                    ? "Could not analyze: syntax error at line " + line + ": " + message
                    : "Could not analyze: syntax error: " + message;
            case IO -> "Could not read file: " + message;
        };
    }
}
