package org.pragmatica.indent.engine;

import org.pragmatica.indent.rule.IndentContext;
import org.pragmatica.indent.tree.SourcePosition;
import org.pragmatica.indent.tree.SyntaxNode;
import org.pragmatica.indent.tree.SyntaxTree;

import java.util.Optional;

/**
 * Selects the node an indentation query is about.
 *
 * <p>The target is the largest non-root node that starts at the row's first non-blank column.
 * When nothing starts there (blank line, comment, inside a multi-line token) there is no target
 * and the smallest node covering that column becomes the parent.
 */
public final class LineLocator {
    private LineLocator() {}

    public static IndentContext locate(SyntaxTree tree, int row) {
        if (row < 0) {
            throw new IllegalArgumentException("Row must not be negative: " + row);
        }
        var line = tree.line(row);
        var position = SourcePosition.at(row, IndentContext.leadingWhitespace(line));
        var covering = tree.descendantCovering(position);
        if (line.isBlank() || covering.isEmpty() || !covering.get().start().equals(position)) {
            return IndentContext.of(tree, row, Optional.empty(), covering);
        }
        var node = widen(covering.get(), position);
        if (node.isRoot()) {
            return IndentContext.of(tree, row, Optional.empty(), Optional.of(node));
        }
        return IndentContext.of(tree, row, Optional.of(node), node.parent());
    }

    /**
     * Climb while the parent starts at the same position, stopping below the root.
     */
    private static SyntaxNode widen(SyntaxNode node, SourcePosition position) {
        var current = node;
        while (true) {
            var parent = current.parent();
            if (parent.isEmpty() || parent.get().isRoot() || !parent.get().start().equals(position)) {
                return current;
            }
            current = parent.get();
        }
    }
}
