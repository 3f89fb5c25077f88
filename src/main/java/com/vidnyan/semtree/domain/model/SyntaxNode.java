package com.vidnyan.semtree.domain.model;

import java.util.List;

/**
 * Immutable {@link RawNode} used by the bundled parser adapters.
 */
public record SyntaxNode(
    String kind,
    boolean named,
    String fieldName,
    Position startPosition,
    Position endPosition,
    List<SyntaxNode> children
) implements RawNode {

    public SyntaxNode {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static SyntaxNode named(String kind, Position start, Position end, List<SyntaxNode> children) {
        return new SyntaxNode(kind, true, null, start, end, children);
    }

    public static SyntaxNode leaf(String kind, Position start, Position end) {
        return new SyntaxNode(kind, true, null, start, end, List.of());
    }

    public static SyntaxNode token(String text, Position start, Position end) {
        return new SyntaxNode(text, false, null, start, end, List.of());
    }

    @Override
    public boolean isNamed() {
        return named;
    }

    public SyntaxNode withField(String field) {
        return new SyntaxNode(kind, named, field, startPosition, endPosition, children);
    }
}
