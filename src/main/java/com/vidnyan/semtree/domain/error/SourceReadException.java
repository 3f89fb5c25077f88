package com.vidnyan.semtree.domain.error;

/**
 * The source file could not be read.
 */
public class SourceReadException extends SemanticTreeException {

    public SourceReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
