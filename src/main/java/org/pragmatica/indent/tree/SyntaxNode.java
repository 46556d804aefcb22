package org.pragmatica.indent.tree;

import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Handle to a node of an externally owned syntax tree.
 *
 * <p>Handles are borrowed for the duration of one indentation query. The tree may be
 * re-parsed between queries, so callers must not keep handles after the query returns.
 */
public interface SyntaxNode {
    /**
     * Raw node type as produced by the grammar.
     */
    String type();

    /**
     * Node kind, {@link NodeKind#UNKNOWN} for types the engine does not know.
     */
    default NodeKind kind() {
        return NodeKind.of(type());
    }

    /**
     * Whether the node is a named production rather than an anonymous token.
     */
    boolean isNamed();

    SourceSpan span();

    default SourcePosition start() {
        return span().start();
    }

    Optional<SyntaxNode> parent();

    int childCount();

    Optional<SyntaxNode> child(int index);

    /**
     * Child labelled with the given field name.
     */
    Optional<SyntaxNode> field(String name);

    default List<SyntaxNode> children() {
        return IntStream.range(0, childCount())
                        .mapToObj(this::child)
                        .flatMap(Optional::stream)
                        .toList();
    }

    default List<SyntaxNode> namedChildren() {
        return children().stream()
                         .filter(SyntaxNode::isNamed)
                         .toList();
    }

    default Optional<SyntaxNode> firstNamedChild() {
        for (int i = 0; i < childCount(); i++) {
            var candidate = child(i).filter(SyntaxNode::isNamed);
            if (candidate.isPresent()) {
                return candidate;
            }
        }
        return Optional.empty();
    }

    default boolean isRoot() {
        return parent().isEmpty();
    }
}
