package com.vidnyan.semtree.domain.model;

/**
 * Source code location.
 */
public record Location(
    String filePath,
    int line,
    int column,
    int endLine,
    int endColumn
) {

    /**
     * Format as readable string.
     */
    public String format() {
        return filePath + ":" + line + ":" + column;
    }
}
