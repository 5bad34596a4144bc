package com.vidnyan.codeguard.domain.model;

/**
 * Source code location. File paths are relative to the analysis root.
 */
public record Location(
    String filePath,
    int line,
    int column,
    int endLine,
    int endColumn
) {

    /**
     * Create a location with just line information.
     */
    public static Location at(String filePath, int line, int column) {
        return new Location(filePath, line, column, line, column);
    }

    /**
     * Same span in another file.
     */
    public Location inFile(String otherPath) {
        return new Location(otherPath, line, column, endLine, endColumn);
    }

    /**
     * Format as readable string.
     */
    public String format() {
        return filePath + ":" + line + ":" + column;
    }
}
