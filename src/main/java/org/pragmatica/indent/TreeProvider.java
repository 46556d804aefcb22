package org.pragmatica.indent;

import org.pragmatica.indent.tree.SyntaxTree;

import java.util.Objects;
import java.util.Optional;

/**
 * Source of the current syntax tree, owned by the host's incremental parser.
 */
public interface TreeProvider {

    /**
     * The most recent tree, empty while no parse is available.
     */
    Optional<SyntaxTree> currentTree();

    /**
     * Whether the parser has been initialized. Checked once, when an engine is attached.
     */
    default boolean isReady() {
        return true;
    }

    /**
     * Reason reported when {@link #isReady()} is false.
     */
    default String notReadyReason() {
        return "parser not initialized";
    }

    /**
     * Provider for a tree that never changes.
     */
    static TreeProvider of(SyntaxTree tree) {
        Objects.requireNonNull(tree, "tree");
        return () -> Optional.of(tree);
    }
}
