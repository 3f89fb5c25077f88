package com.vidnyan.semtree.domain.rule;

/**
 * Flags ancestor chains in which a grammar reuses one node kind for a different role,
 * such as a qualified name inside a namespace declaration.
 */
@FunctionalInterface
public interface IdentifierContext {

    IdentifierContext NONE = ancestors -> false;

    boolean compute(AncestorChain ancestors);
}
