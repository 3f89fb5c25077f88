package com.vidnyan.semtree.domain.model;

/**
 * Source extent of a semantic node.
 */
public record Span(Point start, Point end) {

    public static Span of(Position start, Position end) {
        return new Span(Point.of(start), Point.of(end));
    }

    public static Span of(RawNode node) {
        return of(node.startPosition(), node.endPosition());
    }

    public Location toLocation(String filePath) {
        return new Location(filePath, start.line(), start.column(), end.line(), end.column());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
