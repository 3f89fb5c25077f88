package com.vidnyan.semtree.domain.error;

/**
 * Base class for failures raised while building or querying semantic trees.
 */
public class SemanticTreeException extends RuntimeException {

    public SemanticTreeException(String message) {
        super(message);
    }

    public SemanticTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
