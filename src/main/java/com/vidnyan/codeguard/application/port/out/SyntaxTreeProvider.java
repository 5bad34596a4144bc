package com.vidnyan.codeguard.application.port.out;

import com.vidnyan.codeguard.domain.syntax.ParseResult;

import java.nio.file.Path;

/**
 * Port for turning source files into syntax trees.
 * Implemented by adapters (e.g., JavaParser adapter).
 */
public interface SyntaxTreeProvider {

    /**
     * Parse a file. Syntax and read errors come back as a failed result, never as an exception.
     * @param file file to parse
     * @param root analysis root; reported paths are relative to it
     */
    ParseResult parse(Path file, Path root);

    /**
     * Parse in-memory source text.
     * @param displayPath path reported in findings
     */
    ParseResult parseSource(Path file, String displayPath, String source);

    /**
     * Whether this provider understands the file.
     */
    boolean supports(Path file);
}
