package org.pragmatica.indent.rule;

import org.pragmatica.indent.tree.NodeKind;
import org.pragmatica.indent.tree.SyntaxNode;

import java.util.OptionalInt;

/**
 * Column an {@link IndentRule}'s offset is measured from.
 *
 * <p>Resolution is empty when the node the anchor refers to does not exist; the evaluator then
 * falls back to the parent's beginning of line.
 */
public sealed interface Anchor {

    OptionalInt column(IndentContext context);

    /**
     * Start column of the parent node.
     */
    record ParentStart() implements Anchor {
        @Override
        public OptionalInt column(IndentContext context) {
            return columnOf(context.parent()
                                   .map(parent -> parent.start()
                                                        .column())
                                   .orElse(-1));
        }
    }

    /**
     * First non-blank column of the row the parent starts on. A parent that starts mid-line still
     * anchors to the visual start of that line.
     */
    record ParentBol() implements Anchor {
        @Override
        public OptionalInt column(IndentContext context) {
            return columnOf(context.parent()
                                   .map(context::bol)
                                   .orElse(-1));
        }
    }

    /**
     * Start column of the parent's first named child.
     */
    record FirstSibling() implements Anchor {
        @Override
        public OptionalInt column(IndentContext context) {
            return columnOf(context.parent()
                                   .flatMap(SyntaxNode::firstNamedChild)
                                   .map(sibling -> sibling.start()
                                                          .column())
                                   .orElse(-1));
        }
    }

    /**
     * Start column of the grandparent's first named child.
     */
    record GrandparentFirstSibling() implements Anchor {
        @Override
        public OptionalInt column(IndentContext context) {
            return columnOf(context.grandparent()
                                   .flatMap(SyntaxNode::firstNamedChild)
                                   .map(sibling -> sibling.start()
                                                          .column())
                                   .orElse(-1));
        }
    }

    record GrandparentBol() implements Anchor {
        @Override
        public OptionalInt column(IndentContext context) {
            return columnOf(context.grandparent()
                                   .map(context::bol)
                                   .orElse(-1));
        }
    }

    /**
     * Beginning of line of the nearest node of the given kind, searching from the parent up.
     */
    record AncestorBol(NodeKind kind) implements Anchor {
        @Override
        public OptionalInt column(IndentContext context) {
            return columnOf(context.ancestor(kind)
                                   .map(context::bol)
                                   .orElse(-1));
        }
    }

    record ColumnZero() implements Anchor {
        @Override
        public OptionalInt column(IndentContext context) {
            return OptionalInt.of(0);
        }
    }

    private static OptionalInt columnOf(int column) {
        return column < 0
               ? OptionalInt.empty()
               : OptionalInt.of(column);
    }

    // === Factories ===

    static Anchor parentStart() {
        return new ParentStart();
    }

    static Anchor parentBol() {
        return new ParentBol();
    }

    static Anchor firstSibling() {
        return new FirstSibling();
    }

    static Anchor grandparentFirstSibling() {
        return new GrandparentFirstSibling();
    }

    static Anchor grandparentBol() {
        return new GrandparentBol();
    }

    static Anchor ancestorBol(NodeKind kind) {
        return new AncestorBol(kind);
    }

    static Anchor columnZero() {
        return new ColumnZero();
    }
}
