package org.pragmatica.indent.tree;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link SyntaxTree} over an immutable {@link CstNode} tree and its source text.
 *
 * <p>Example usage:
 * <pre>{@code
 * var builder = CstBuilder.over("f(a,\n  b)\n");
 * var tree = builder.root("source_file",
 *                         builder.node("call_expression",
 *                                      builder.token("identifier", "f"),
 *                                      builder.node("argument_list",
 *                                                   builder.literal("("),
 *                                                   builder.token("identifier", "a"),
 *                                                   builder.literal(","),
 *                                                   builder.token("identifier", "b"),
 *                                                   builder.literal(")"))));
 * }</pre>
 */
public final class CstSyntaxTree implements SyntaxTree {
    private final List<String> lines;
    private final CstNode root;

    private CstSyntaxTree(String source, CstNode root) {
        this.lines = List.of(source.split("\r?\n", -1));
        this.root = root;
    }

    public static CstSyntaxTree of(String source, CstNode root) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(root, "root");
        return new CstSyntaxTree(source, root);
    }

    public CstNode cst() {
        return root;
    }

    @Override
    public SyntaxNode root() {
        return new Handle(this, root, null);
    }

    @Override
    public int lineCount() {
        return lines.size();
    }

    @Override
    public String line(int row) {
        return row >= 0 && row < lines.size()
               ? lines.get(row)
               : "";
    }

    /**
     * Node handle carrying the parent chain that {@link CstNode} records do not store.
     */
    private static final class Handle implements SyntaxNode {
        private final CstSyntaxTree tree;
        private final CstNode node;
        private final Handle parent;

        private Handle(CstSyntaxTree tree, CstNode node, Handle parent) {
            this.tree = tree;
            this.node = node;
            this.parent = parent;
        }

        @Override
        public String type() {
            return node.type();
        }

        @Override
        public boolean isNamed() {
            return node.named();
        }

        @Override
        public SourceSpan span() {
            return node.span();
        }

        @Override
        public Optional<SyntaxNode> parent() {
            return Optional.ofNullable(parent);
        }

        @Override
        public int childCount() {
            return node.children()
                       .size();
        }

        @Override
        public Optional<SyntaxNode> child(int index) {
            var children = node.children();
            if (index < 0 || index >= children.size()) {
                return Optional.empty();
            }
            return Optional.of(new Handle(tree, children.get(index), this));
        }

        @Override
        public Optional<SyntaxNode> field(String name) {
            if (node instanceof CstNode.NonTerminal nonTerminal) {
                return Optional.ofNullable(nonTerminal.fields()
                                                      .get(name))
                               .flatMap(this::child);
            }
            return Optional.empty();
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Handle handle
                   && handle.tree == tree
                   && handle.node == node
                   && Objects.equals(handle.parent, parent);
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(node);
        }

        @Override
        public String toString() {
            return node.type() + "@" + node.span();
        }
    }
}
