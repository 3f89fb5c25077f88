package com.vidnyan.semtree.domain.model;

/**
 * A 1-based line and column, rendered {@code line:col}.
 */
public record Point(int line, int column) implements Comparable<Point> {

    public static Point of(Position position) {
        return new Point(position.row() + 1, position.column() + 1);
    }

    public static Point parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Position is null");
        }
        int colon = value.indexOf(':');
        if (colon <= 0 || colon == value.length() - 1) {
            throw new IllegalArgumentException("Position must be line:col, got '" + value + "'");
        }
        try {
            return new Point(Integer.parseInt(value.substring(0, colon)),
                    Integer.parseInt(value.substring(colon + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Position must be line:col, got '" + value + "'", e);
        }
    }

    @Override
    public int compareTo(Point other) {
        int byLine = Integer.compare(line, other.line);
        return byLine != 0 ? byLine : Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
