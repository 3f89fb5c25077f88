package com.vidnyan.semtree.domain.model;

import java.util.List;

/**
 * One query result inside a file. Scalar results (counts, strings, booleans) have no
 * location and report line 0.
 */
public record QueryMatch(
    String file,
    int line,
    int column,
    int endLine,
    int endColumn,
    String value,
    List<String> sourceLines
) {

    public QueryMatch {
        sourceLines = sourceLines == null ? List.of() : List.copyOf(sourceLines);
    }

    public static QueryMatch at(String file, Span span, String value, List<String> sourceLines) {
        return new QueryMatch(file, span.start().line(), span.start().column(),
                span.end().line(), span.end().column(), value, sourceLines);
    }

    public static QueryMatch scalar(String file, String value) {
        return new QueryMatch(file, 0, 0, 0, 0, value, List.of());
    }

    public boolean hasLocation() {
        return line > 0;
    }

    public Location location() {
        return new Location(file, line, column, endLine, endColumn);
    }

    public String format() {
        return hasLocation() ? location().format() + " " + value : file + " " + value;
    }
}
