package com.vidnyan.codeguard.domain.model;

import com.vidnyan.codeguard.domain.syntax.ParseError;
import com.vidnyan.codeguard.domain.syntax.SyntaxTree;

import java.nio.file.Path;

/**
 * A file that could not be analyzed, in whole or in part. Not a finding.
 */
public record AnalysisNote(String file, Kind kind, String message) {

    public static AnalysisNote of(ParseError error, Path root) {
        Kind kind = error.kind() == ParseError.Kind.IO ? Kind.IO_ERROR : Kind.PARSE_ERROR;
        return new AnalysisNote(SyntaxTree.displayPath(error.file(), root), kind, error.describe());
    }

    public enum Kind {
        PARSE_ERROR,
        IO_ERROR,
        CONTRACT_ERROR
    }
}
