package org.pragmatica.indent.tree;

import java.util.Optional;

/**
 * A materialized syntax tree together with the source lines it was parsed from.
 */
public interface SyntaxTree {

    SyntaxNode root();

    int lineCount();

    /**
     * Text of the given row without its line terminator, empty for rows outside the source.
     */
    String line(int row);

    /**
     * Smallest node whose span contains the position.
     * Empty when the position lies outside the root, e.g. in trailing blank lines.
     */
    default Optional<SyntaxNode> descendantCovering(SourcePosition position) {
        var current = root();
        if (!current.span().contains(position)) {
            return Optional.empty();
        }
        var descended = true;
        while (descended) {
            descended = false;
            for (int i = 0; i < current.childCount(); i++) {
                var child = current.child(i);
                if (child.isPresent() && child.get().span().contains(position)) {
                    current = child.get();
                    descended = true;
                    break;
                }
            }
        }
        return Optional.of(current);
    }
}
