package org.pragmatica.indent.rule;

import org.pragmatica.indent.tree.NodeKind;
import org.pragmatica.indent.tree.SyntaxNode;
import org.pragmatica.indent.tree.SyntaxTree;

import java.util.Optional;

/**
 * What one indentation query sees: the line, the node that starts it and that node's parent.
 *
 * <p>On a line where no node starts at the first non-blank column, {@link #node()} is empty and
 * {@link #parent()} is the smallest node covering that column (if any). Instances hold borrowed
 * tree handles and must not outlive the query.
 *
 * @param tree   Tree being queried
 * @param row    Row being indented
 * @param node   Largest non-root node starting at the row's first non-blank column
 * @param parent Parent of {@code node}, or the covering node when {@code node} is empty
 */
public record IndentContext(
 SyntaxTree tree,
 int row,
 Optional<SyntaxNode> node,
 Optional<SyntaxNode> parent) {

    public static IndentContext of(SyntaxTree tree, int row, Optional<SyntaxNode> node, Optional<SyntaxNode> parent) {
        return new IndentContext(tree, row, node, parent);
    }

    public boolean hasNode() {
        return node.isPresent();
    }

    public Optional<SyntaxNode> grandparent() {
        return parent.flatMap(SyntaxNode::parent);
    }

    /**
     * Nearest node of the given kind, starting at the parent and walking towards the root.
     */
    public Optional<SyntaxNode> ancestor(NodeKind kind) {
        var current = parent;
        while (current.isPresent()) {
            if (current.get().kind() == kind) {
                return current;
            }
            current = current.get().parent();
        }
        return Optional.empty();
    }

    /**
     * Column of the first non-blank character on the row where the node starts.
     */
    public int bol(SyntaxNode anchor) {
        return leadingWhitespace(tree.line(anchor.start()
                                                 .row()));
    }

    /**
     * Number of leading spaces and tabs.
     */
    public static int leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }
}
