package com.vidnyan.semtree.domain.error;

public class UnsupportedLanguageException extends SemanticTreeException {

    public UnsupportedLanguageException(String message) {
        super(message);
    }
}
