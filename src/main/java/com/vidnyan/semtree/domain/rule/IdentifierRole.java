package com.vidnyan.semtree.domain.rule;

/**
 * Semantic role of a bare identifier; the constant's element name is what the walker emits.
 */
public enum IdentifierRole {
    NAME("name"),
    TYPE("type");

    private final String elementName;

    IdentifierRole(String elementName) {
        this.elementName = elementName;
    }

    public String elementName() {
        return elementName;
    }
}
