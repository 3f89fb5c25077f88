package com.vidnyan.semtree.domain.model;

public enum NodeType {
    ELEMENT,
    TEXT
}
