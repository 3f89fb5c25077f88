package com.vidnyan.semtree.domain.model;

import java.util.List;

/**
 * Read-only view of one node of a concrete syntax tree produced by an external parser.
 * Named nodes are semantic constructs; unnamed nodes are punctuation and keyword tokens.
 */
public interface RawNode {

    String ERROR_KIND = "ERROR";

    String kind();

    boolean isNamed();

    /**
     * Grammar-assigned slot of this node inside its parent, or {@code null}.
     */
    String fieldName();

    Position startPosition();

    Position endPosition();

    List<? extends RawNode> children();

    default int startByte() {
        return startPosition().byteOffset();
    }

    default int endByte() {
        return endPosition().byteOffset();
    }

    default boolean isError() {
        return ERROR_KIND.equals(kind());
    }

    default boolean hasNamedChildren() {
        for (RawNode child : children()) {
            if (child.isNamed()) {
                return true;
            }
        }
        return false;
    }
}
