package org.pragmatica.indent.rule;

import org.pragmatica.indent.tree.NodeKind;
import org.pragmatica.indent.tree.SyntaxNode;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Condition under which an {@link IndentRule} applies to a line.
 *
 * <p>Matchers are pure and bounded: they look at the target node, walk up its ancestors or
 * inspect one child by index. A structure the matcher needs but the tree lacks (no parent, no
 * such ancestor, no such sibling) makes it return {@code false}. On lines without a target node
 * only {@link NoNode}, {@link Any} and the parent matchers can hold; the parent matchers then look
 * at the node covering the line, so a blank line inside a construct indents like its body.
 */
public sealed interface NodeMatcher {

    boolean test(IndentContext context);

    // === Node ===

    /**
     * Target node has the given kind. Never matches {@link NodeKind#UNKNOWN}; use {@link TypeIs} for those.
     */
    record KindIs(NodeKind kind) implements NodeMatcher {
        @Override
        public boolean test(IndentContext context) {
            return kind != NodeKind.UNKNOWN && context.node()
                                                     .map(SyntaxNode::kind)
                                                     .filter(kind::equals)
                                                     .isPresent();
        }
    }

    /**
     * Target node has one of the given kinds.
     */
    record KindIn(Set<NodeKind> kinds) implements NodeMatcher {
        public KindIn {
            kinds = Set.copyOf(kinds);
        }

        @Override
        public boolean test(IndentContext context) {
            return context.node()
                          .map(SyntaxNode::kind)
                          .filter(kind -> kind != NodeKind.UNKNOWN && kinds.contains(kind))
                          .isPresent();
        }
    }

    /**
     * Target node has the given raw grammar type; covers types {@link NodeKind} does not list.
     */
    record TypeIs(String type) implements NodeMatcher {
        @Override
        public boolean test(IndentContext context) {
            return context.node()
                          .map(SyntaxNode::type)
                          .filter(type::equals)
                          .isPresent();
        }
    }

    // === Parent chain ===

    /**
     * Parent of the target node, or the covering node on a line without one.
     */
    record ParentIs(NodeKind kind) implements NodeMatcher {
        @Override
        public boolean test(IndentContext context) {
            return context.parent()
                          .map(SyntaxNode::kind)
                          .filter(kind::equals)
                          .isPresent();
        }
    }

    record ParentIn(Set<NodeKind> kinds) implements NodeMatcher {
        public ParentIn {
            kinds = Set.copyOf(kinds);
        }

        @Override
        public boolean test(IndentContext context) {
            return context.parent()
                          .map(SyntaxNode::kind)
                          .filter(kinds::contains)
                          .isPresent();
        }
    }

    record GrandparentIs(NodeKind kind) implements NodeMatcher {
        @Override
        public boolean test(IndentContext context) {
            return context.hasNode() && context.grandparent()
                                               .map(SyntaxNode::kind)
                                               .filter(kind::equals)
                                               .isPresent();
        }
    }

    /**
     * Some strict ancestor of the target node has the given kind.
     */
    record AncestorIs(NodeKind kind) implements NodeMatcher {
        @Override
        public boolean test(IndentContext context) {
            return context.hasNode() && context.ancestor(kind)
                                               .isPresent();
        }
    }

    /**
     * The child at {@code index} of the nearest ancestor of {@code ancestorKind} starts on the same
     * row as that ancestor. Distinguishes lists whose first element hugs the opening delimiter from
     * lists that open with a line break.
     */
    record SiblingOnSameLine(NodeKind ancestorKind, int index) implements NodeMatcher {
        @Override
        public boolean test(IndentContext context) {
            if (!context.hasNode()) {
                return false;
            }
            return context.ancestor(ancestorKind)
                          .flatMap(ancestor -> ancestor.child(index)
                                                       .filter(sibling -> sibling.start()
                                                                                 .row() == ancestor.start()
                                                                                                   .row()))
                          .isPresent();
        }
    }

    /**
     * The target node starts inside the given field of the nearest ancestor of {@code ancestorKind},
     * e.g. a continuation line of an {@code if} condition.
     */
    record WithinField(NodeKind ancestorKind, String field) implements NodeMatcher {
        @Override
        public boolean test(IndentContext context) {
            if (context.node()
                       .isEmpty()) {
                return false;
            }
            var start = context.node()
                               .get()
                               .start();
            return context.ancestor(ancestorKind)
                          .flatMap(ancestor -> ancestor.field(field))
                          .filter(labelled -> labelled.span()
                                                      .contains(start))
                          .isPresent();
        }
    }

    // === Line ===

    /**
     * No node starts on the line: blank, whitespace-only or comment line.
     */
    record NoNode() implements NodeMatcher {
        @Override
        public boolean test(IndentContext context) {
            return !context.hasNode();
        }
    }

    /**
     * Matches every line. Reserved for the last rule of a table.
     */
    record Any() implements NodeMatcher {
        @Override
        public boolean test(IndentContext context) {
            return true;
        }
    }

    // === Combinators ===

    record All(List<NodeMatcher> matchers) implements NodeMatcher {
        public All {
            matchers = List.copyOf(matchers);
        }

        @Override
        public boolean test(IndentContext context) {
            for (var matcher : matchers) {
                if (!matcher.test(context)) {
                    return false;
                }
            }
            return true;
        }
    }

    record Not(NodeMatcher matcher) implements NodeMatcher {
        @Override
        public boolean test(IndentContext context) {
            return context.hasNode() && !matcher.test(context);
        }
    }

    // === Factories ===

    static NodeMatcher kindIs(NodeKind kind) {
        return new KindIs(kind);
    }

    static NodeMatcher kindIn(NodeKind first, NodeKind... rest) {
        return new KindIn(EnumSet.of(first, rest));
    }

    static NodeMatcher typeIs(String type) {
        return new TypeIs(type);
    }

    static NodeMatcher parentIs(NodeKind kind) {
        return new ParentIs(kind);
    }

    static NodeMatcher parentIn(Set<NodeKind> kinds) {
        return new ParentIn(kinds);
    }

    static NodeMatcher grandparentIs(NodeKind kind) {
        return new GrandparentIs(kind);
    }

    static NodeMatcher ancestorIs(NodeKind kind) {
        return new AncestorIs(kind);
    }

    static NodeMatcher siblingOnSameLine(NodeKind ancestorKind, int index) {
        return new SiblingOnSameLine(ancestorKind, index);
    }

    static NodeMatcher withinField(NodeKind ancestorKind, String field) {
        return new WithinField(ancestorKind, field);
    }

    static NodeMatcher noNode() {
        return new NoNode();
    }

    static NodeMatcher any() {
        return new Any();
    }

    static NodeMatcher all(NodeMatcher... matchers) {
        return new All(List.of(matchers));
    }

    static NodeMatcher not(NodeMatcher matcher) {
        return new Not(matcher);
    }
}
