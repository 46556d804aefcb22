package org.pragmatica.indent.engine;

/**
 * Replacement of a line's leading whitespace.
 *
 * @param row          Row to edit
 * @param currentWidth Number of leading whitespace characters to replace
 * @param targetColumn Column the line should start at
 */
public record LineEdit(int row, int currentWidth, int targetColumn) {

    /**
     * New leading whitespace, spaces only.
     */
    public String replacement() {
        return " ".repeat(targetColumn);
    }

    /**
     * Apply the edit to the text of the line.
     */
    public String apply(String line) {
        return replacement() + line.substring(Math.min(currentWidth, line.length()));
    }
}
