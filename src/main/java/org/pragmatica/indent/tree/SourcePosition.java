package org.pragmatica.indent.tree;

/**
 * A position in source text (row and column, both 0-based).
 */
public record SourcePosition(int row, int column) implements Comparable<SourcePosition> {

    public static final SourcePosition START = new SourcePosition(0, 0);

    public static SourcePosition at(int row, int column) {
        return new SourcePosition(row, column);
    }

    public boolean isBefore(SourcePosition other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(SourcePosition other) {
        return row != other.row
               ? Integer.compare(row, other.row)
               : Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return row + ":" + column;
    }
}
