package com.vidnyan.semtree.domain.rule;

import com.vidnyan.semtree.domain.model.RawNode;

/**
 * Decides whether an identifier declares a name or references a type.
 * Implementations are pure functions of their arguments.
 */
@FunctionalInterface
public interface IdentifierClassifier {

    /**
     * @param node the identifier
     * @param ancestors its raw ancestors, nearest first
     * @param inSpecialContext result of the table's {@link IdentifierContext} for the same chain
     */
    IdentifierRole classify(RawNode node, AncestorChain ancestors, boolean inSpecialContext);
}
