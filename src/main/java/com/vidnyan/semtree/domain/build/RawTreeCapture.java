package com.vidnyan.semtree.domain.build;

import com.vidnyan.semtree.domain.model.NodeArena;
import com.vidnyan.semtree.domain.model.NodeArena.RawInfo;
import com.vidnyan.semtree.domain.model.RawNode;
import com.vidnyan.semtree.domain.model.SourceText;
import com.vidnyan.semtree.domain.model.Span;

/**
 * Copies a CST into an arena without applying any rule: one element per named node (named
 * after its kind, with a {@code field} attribute), one text node per token. Every copied node
 * keeps its parser metadata, so the copy can be walked again through {@link ArenaRawNode}.
 */
public class RawTreeCapture {

    public int capture(RawNode node, SourceText source, NodeArena arena) {
        if (!node.isNamed()) {
            int text = arena.createText(source.slice(node.startByte(), node.endByte()));
            arena.setRaw(text, info(node));
            return text;
        }
        int element = arena.createElement(node.kind());
        arena.setSpan(element, Span.of(node));
        arena.setRaw(element, info(node));
        if (node.fieldName() != null) {
            arena.setAttribute(element, RewritingWalker.FIELD, node.fieldName());
        }
        if (node.children().isEmpty()) {
            arena.appendText(element, source.slice(node.startByte(), node.endByte()));
            return element;
        }
        int cursor = node.startByte();
        for (RawNode child : node.children()) {
            if (child.startByte() > cursor && source.hasWhitespace(cursor, child.startByte())) {
                arena.appendChild(element, arena.createText(" "));
            }
            arena.appendChild(element, capture(child, source, arena));
            cursor = Math.max(cursor, child.endByte());
        }
        return element;
    }

    private static RawInfo info(RawNode node) {
        return new RawInfo(node.kind(), node.isNamed(), node.fieldName(), node.startPosition(), node.endPosition());
    }
}
