package com.vidnyan.semtree.domain.rule;

import com.vidnyan.semtree.domain.model.RawNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent list of the raw ancestors of a node, nearest first. Pushing shares the tail,
 * so siblings reuse their parent's chain.
 */
public final class AncestorChain {

    private static final AncestorChain EMPTY = new AncestorChain(null, null, 0);

    private final RawNode node;
    private final AncestorChain tail;
    private final int depth;

    private AncestorChain(RawNode node, AncestorChain tail, int depth) {
        this.node = node;
        this.tail = tail;
        this.depth = depth;
    }

    public static AncestorChain empty() {
        return EMPTY;
    }

    public static AncestorChain of(RawNode... outermostFirst) {
        AncestorChain chain = EMPTY;
        for (RawNode ancestor : outermostFirst) {
            chain = chain.push(ancestor);
        }
        return chain;
    }

    public AncestorChain push(RawNode ancestor) {
        return new AncestorChain(ancestor, this, depth + 1);
    }

    public boolean isEmpty() {
        return depth == 0;
    }

    public int depth() {
        return depth;
    }

    /**
     * The direct parent, if any.
     */
    public Optional<RawNode> parent() {
        return Optional.ofNullable(node);
    }

    public String parentKind() {
        return node == null ? null : node.kind();
    }

    /**
     * The chain of the parent, i.e. this chain without its nearest entry.
     */
    public AncestorChain tail() {
        return tail == null ? EMPTY : tail;
    }

    public List<RawNode> nodes() {
        List<RawNode> nodes = new ArrayList<>(depth);
        for (AncestorChain current = this; current.node != null; current = current.tail) {
            nodes.add(current.node);
        }
        return nodes;
    }

    public List<String> kinds() {
        return nodes().stream().map(RawNode::kind).toList();
    }

    /**
     * Nearest ancestor whose kind is in {@code kinds}.
     */
    public Optional<RawNode> nearest(Set<String> kinds) {
        for (AncestorChain current = this; current.node != null; current = current.tail) {
            if (kinds.contains(current.node.kind())) {
                return Optional.of(current.node);
            }
        }
        return Optional.empty();
    }

    public boolean contains(String kind) {
        return nearest(Set.of(kind)).isPresent();
    }

    @Override
    public String toString() {
        return String.join(" < ", kinds());
    }
}
