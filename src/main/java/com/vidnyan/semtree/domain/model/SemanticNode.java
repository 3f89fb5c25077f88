package com.vidnyan.semtree.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only handle on a node of a {@link NodeArena}: an element with ordered attributes and
 * children, or a text leaf.
 */
public final class SemanticNode {

    private final NodeArena arena;
    private final int id;

    SemanticNode(NodeArena arena, int id) {
        this.arena = arena;
        this.id = id;
    }

    public int id() {
        return id;
    }

    public NodeArena arena() {
        return arena;
    }

    public NodeType type() {
        return arena.type(id);
    }

    public boolean isElement() {
        return type() == NodeType.ELEMENT;
    }

    public boolean isText() {
        return type() == NodeType.TEXT;
    }

    /**
     * Element name, or {@code null} for text leaves.
     */
    public String elementName() {
        return arena.name(id);
    }

    /**
     * Content of a text leaf, or {@code null} for elements.
     */
    public String text() {
        return arena.text(id);
    }

    public Map<String, String> attributes() {
        return arena.attributes(id);
    }

    public String attribute(String key) {
        return arena.attribute(id, key);
    }

    public boolean hasAttribute(String key) {
        return arena.attribute(id, key) != null;
    }

    public List<SemanticNode> children() {
        List<SemanticNode> nodes = new ArrayList<>();
        for (int child : arena.children(id)) {
            nodes.add(new SemanticNode(arena, child));
        }
        return nodes;
    }

    public List<SemanticNode> elements() {
        return children().stream().filter(SemanticNode::isElement).toList();
    }

    public List<SemanticNode> elements(String name) {
        return children().stream()
                .filter(child -> child.isElement() && name.equals(child.elementName()))
                .toList();
    }

    public Optional<SemanticNode> element(String name) {
        return elements(name).stream().findFirst();
    }

    public boolean hasElement(String name) {
        return element(name).isPresent();
    }

    /**
     * All element descendants with the given name, in document order.
     */
    public List<SemanticNode> descendants(String name) {
        List<SemanticNode> found = new ArrayList<>();
        collect(this, name, found);
        return found;
    }

    public boolean isEmptyMarker() {
        return isElement() && arena.children(id).isEmpty() && attributes().isEmpty();
    }

    public Optional<SemanticNode> parent() {
        int parent = arena.parent(id);
        return parent < 0 ? Optional.empty() : Optional.of(new SemanticNode(arena, parent));
    }

    /**
     * Concatenated text of every text leaf below this node.
     */
    public String stringValue() {
        if (isText()) {
            return text();
        }
        StringBuilder value = new StringBuilder();
        appendText(id, value);
        return value.toString();
    }

    public Optional<Span> span() {
        return Optional.ofNullable(arena.span(id));
    }

    /**
     * Own span, else the first descendant span in document order, else the nearest
     * ancestor span. Empty only when no node in the tree carries one.
     */
    public Optional<Span> resolveSpan() {
        Span own = arena.span(id);
        if (own != null) {
            return Optional.of(own);
        }
        Span below = firstDescendantSpan(id);
        if (below != null) {
            return Optional.of(below);
        }
        for (int current = arena.parent(id); current >= 0; current = arena.parent(current)) {
            Span above = arena.span(current);
            if (above != null) {
                return Optional.of(above);
            }
        }
        return Optional.empty();
    }

    private Span firstDescendantSpan(int node) {
        for (int child : arena.children(node)) {
            if (arena.type(child) != NodeType.ELEMENT) {
                continue;
            }
            Span span = arena.span(child);
            if (span != null) {
                return span;
            }
            Span nested = firstDescendantSpan(child);
            if (nested != null) {
                return nested;
            }
        }
        return null;
    }

    private void appendText(int node, StringBuilder value) {
        for (int child : arena.children(node)) {
            if (arena.type(child) == NodeType.TEXT) {
                value.append(arena.text(child));
            } else {
                appendText(child, value);
            }
        }
    }

    private static void collect(SemanticNode node, String name, List<SemanticNode> found) {
        for (SemanticNode child : node.elements()) {
            if (name.equals(child.elementName())) {
                found.add(child);
            }
            collect(child, name, found);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SemanticNode that)) {
            return false;
        }
        return arena == that.arena && id == that.id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(arena), id);
    }

    @Override
    public String toString() {
        return isText() ? "text(" + text() + ")" : "<" + elementName() + "#" + id + ">";
    }
}
