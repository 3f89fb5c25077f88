package com.vidnyan.semtree.domain.error;

public class QueryException extends SemanticTreeException {

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
