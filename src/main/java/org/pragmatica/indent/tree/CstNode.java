package org.pragmatica.indent.tree;

import java.util.List;
import java.util.Map;

/**
 * Concrete Syntax Tree node - immutable data behind {@link CstSyntaxTree} handles.
 * Parent links are supplied by the handles, so the same record can be shared between trees.
 */
public sealed interface CstNode {
    /**
     * The source span covered by this node.
     */
    SourceSpan span();

    /**
     * The grammar type that produced this node.
     */
    String type();

    /**
     * Whether this is a named production rather than an anonymous token.
     */
    boolean named();

    List<CstNode> children();

    /**
     * Anonymous token - keyword or punctuation, its type is the matched text.
     */
    record Terminal(SourceSpan span, String text) implements CstNode {
        @Override
        public String type() {
            return text;
        }

        @Override
        public boolean named() {
            return false;
        }

        @Override
        public List<CstNode> children() {
            return List.of();
        }
    }

    /**
     * Named leaf - identifier, literal or other captured token.
     */
    record Token(SourceSpan span, String type, String text) implements CstNode {
        @Override
        public boolean named() {
            return true;
        }

        @Override
        public List<CstNode> children() {
            return List.of();
        }
    }

    /**
     * Named interior node.
     *
     * @param span     Source span from the first child's start to the last child's end
     * @param type     Production name
     * @param children Children in source order
     * @param fields   Field name to child index
     */
    record NonTerminal(
    SourceSpan span,
    String type,
    List<CstNode> children,
    Map<String, Integer> fields) implements CstNode {
        public NonTerminal {
            children = List.copyOf(children);
            fields = Map.copyOf(fields);
        }

        @Override
        public boolean named() {
            return true;
        }
    }

    /**
     * Error node - region the parser could not match during error recovery.
     * Whatever it did recognize inside the region is kept as children.
     */
    record Error(SourceSpan span, List<CstNode> children) implements CstNode {
        public Error {
            children = List.copyOf(children);
        }

        @Override
        public String type() {
            return NodeKind.ERROR.grammarName();
        }

        @Override
        public boolean named() {
            return true;
        }
    }
}
