package com.vidnyan.semtree.domain.rule;

/**
 * Quoting convention of a scalar node kind, used to strip delimiters and decode escapes.
 */
public enum ScalarStyle {
    PLAIN,
    JSON_STRING,
    DOUBLE_QUOTED,
    SINGLE_QUOTED,
    BLOCK,
    ALIAS
}
