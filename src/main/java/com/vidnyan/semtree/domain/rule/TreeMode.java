package com.vidnyan.semtree.domain.rule;

/**
 * How a table shapes its output. {@code DATA} turns mapping keys into element names
 * and scalars into plain text content.
 */
public enum TreeMode {
    SYNTAX,
    DATA
}
