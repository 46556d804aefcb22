package org.pragmatica.indent.tree;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourcePosition start, SourcePosition end) {

    public static SourceSpan of(SourcePosition start, SourcePosition end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourcePosition position) {
        return new SourceSpan(position, position);
    }

    /**
     * Empty spans contain nothing, including their own start.
     */
    public boolean contains(SourcePosition position) {
        return !position.isBefore(start) && position.isBefore(end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
