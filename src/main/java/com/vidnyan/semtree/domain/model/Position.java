package com.vidnyan.semtree.domain.model;

/**
 * A point in raw source as reported by a parser: zero-based row and column
 * plus the UTF-8 byte offset from the start of the file.
 */
public record Position(int row, int column, int byteOffset) {

    public static final Position ORIGIN = new Position(0, 0, 0);
}
