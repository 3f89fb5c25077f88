package com.vidnyan.semtree.domain.build;

import com.vidnyan.semtree.domain.model.NodeArena;
import com.vidnyan.semtree.domain.model.NodeArena.RawInfo;
import com.vidnyan.semtree.domain.model.Position;
import com.vidnyan.semtree.domain.model.RawNode;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link RawNode} view of a subtree produced by {@link RawTreeCapture}. Nodes without parser
 * metadata (leaf text, inserted spaces) are not part of the view.
 */
public final class ArenaRawNode implements RawNode {

    private final NodeArena arena;
    private final int id;
    private final RawInfo info;

    public ArenaRawNode(NodeArena arena, int id) {
        this.arena = arena;
        this.id = id;
        this.info = arena.raw(id);
        if (info == null) {
            throw new IllegalArgumentException("Node " + id + " was not captured from a parser tree");
        }
    }

    public int id() {
        return id;
    }

    @Override
    public String kind() {
        return info.kind();
    }

    @Override
    public boolean isNamed() {
        return info.named();
    }

    @Override
    public String fieldName() {
        return info.fieldName();
    }

    @Override
    public Position startPosition() {
        return info.start();
    }

    @Override
    public Position endPosition() {
        return info.end();
    }

    @Override
    public List<ArenaRawNode> children() {
        List<ArenaRawNode> children = new ArrayList<>();
        for (int child : arena.children(id)) {
            if (arena.raw(child) != null) {
                children.add(new ArenaRawNode(arena, child));
            }
        }
        return children;
    }
}
