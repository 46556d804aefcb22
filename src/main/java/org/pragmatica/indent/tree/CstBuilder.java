package org.pragmatica.indent.tree;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles a {@link CstSyntaxTree} from explicit structure over a source text.
 *
 * <p>Leaves are matched against the text in call order, so arguments written left to right
 * consume the source left to right. Whitespace and {@code #} line comments between leaves are
 * skipped unless the leaf itself is a comment; anything else is a mismatch. Interior nodes span
 * from their first child's start to their last child's end. This lets a host adapt a parse tree
 * it already has (or a test describe one) without supplying positions by hand.
 */
public final class CstBuilder {
    private final String source;
    private final Map<CstNode, String> fieldLabels = new IdentityHashMap<>();

    private int pos;
    private int row;
    private int column;

    private CstBuilder(String source) {
        this.source = source;
    }

    public static CstBuilder over(String source) {
        return new CstBuilder(source);
    }

    // === Leaves ===

    /**
     * Anonymous token: keyword or punctuation.
     */
    public CstNode literal(String text) {
        var span = consume(text);
        return new CstNode.Terminal(span, text);
    }

    /**
     * Named leaf: identifier, number, string.
     */
    public CstNode token(String type, String text) {
        var span = consume(text);
        return new CstNode.Token(span, type, text);
    }

    // === Interior nodes ===

    public CstNode node(String type, CstNode... children) {
        var list = List.of(children);
        return new CstNode.NonTerminal(spanOf(list), type, list, fieldsOf(list));
    }

    public CstNode error(CstNode... children) {
        var list = List.of(children);
        return new CstNode.Error(spanOf(list), list);
    }

    /**
     * Label a child with a field name; the label applies when the child is passed to {@link #node}.
     */
    public CstNode field(String name, CstNode child) {
        fieldLabels.put(child, name);
        return child;
    }

    /**
     * Finish with a root node spanning the whole source.
     */
    public CstSyntaxTree root(String type, CstNode... children) {
        skipTrivia(true);
        if (pos < source.length()) {
            throw new IllegalArgumentException("Unconsumed input at " + location() + ": '" + preview() + "'");
        }
        var list = List.of(children);
        var span = SourceSpan.of(SourcePosition.START, location());
        return CstSyntaxTree.of(source, new CstNode.NonTerminal(span, type, list, fieldsOf(list)));
    }

    // === Scanning ===

    private SourceSpan consume(String text) {
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Empty leaf text at " + location());
        }
        skipTrivia(!text.startsWith("#"));
        if (!source.startsWith(text, pos)) {
            throw new IllegalArgumentException("Expected '" + text + "' at " + location() + ", found '" + preview() + "'");
        }
        var start = location();
        for (int i = 0; i < text.length(); i++) {
            advance();
        }
        return SourceSpan.of(start, location());
    }

    private void skipTrivia(boolean comments) {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                advance();
            } else if (comments && c == '#') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    advance();
                }
            } else {
                return;
            }
        }
    }

    private void advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            row++;
            column = 0;
        } else {
            column++;
        }
    }

    private SourcePosition location() {
        return SourcePosition.at(row, column);
    }

    private String preview() {
        var end = Math.min(source.length(), pos + 16);
        return source.substring(pos, end)
                     .replace("\n", "\\n");
    }

    private SourceSpan spanOf(List<CstNode> children) {
        if (children.isEmpty()) {
            return SourceSpan.at(location());
        }
        return SourceSpan.of(children.get(0)
                                     .span()
                                     .start(),
                             children.get(children.size() - 1)
                                     .span()
                                     .end());
    }

    private Map<String, Integer> fieldsOf(List<CstNode> children) {
        var fields = new HashMap<String, Integer>();
        for (int i = 0; i < children.size(); i++) {
            var label = fieldLabels.remove(children.get(i));
            if (label != null) {
                fields.put(label, i);
            }
        }
        return fields;
    }
}
