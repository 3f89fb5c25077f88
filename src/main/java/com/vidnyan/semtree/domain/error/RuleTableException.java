package com.vidnyan.semtree.domain.error;

/**
 * A rule table is broken: it failed to load or one of its classifier callbacks threw.
 * Never converted into a per-file error.
 */
public class RuleTableException extends SemanticTreeException {

    public RuleTableException(String message) {
        super(message);
    }

    public RuleTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
