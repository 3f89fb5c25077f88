package com.vidnyan.semtree.domain.error;

/**
 * The upstream parser produced no tree at all for a file.
 */
public class CstParseException extends SemanticTreeException {

    public CstParseException(String message) {
        super(message);
    }

    public CstParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
