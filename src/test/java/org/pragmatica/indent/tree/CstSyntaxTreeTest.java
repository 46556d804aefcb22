package org.pragmatica.indent.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.indent.JuliaFixtures;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CstSyntaxTreeTest {

    // === Lines ===

    @Test
    void line_returnsTextWithoutTerminator() {
        var tree = JuliaFixtures.functionBody();

        assertEquals("function area(r)", tree.line(0));
        assertEquals("    s = r * r", tree.line(1));
        assertEquals("end", tree.line(3));
    }

    @Test
    void line_outsideSource_isEmpty() {
        var tree = JuliaFixtures.functionBody();

        assertEquals("", tree.line(-1));
        assertEquals("", tree.line(4));
        assertEquals("", tree.line(100));
    }

    @Test
    void lines_splitOnCrLf() {
        var b = CstBuilder.over("a\r\nb\r\n");
        var tree = b.root("source_file", b.token("identifier", "a"), b.token("identifier", "b"));

        assertEquals("a", tree.line(0));
        assertEquals("b", tree.line(1));
    }

    // === Handles ===

    @Test
    void handles_exposeParentChain() {
        var tree = JuliaFixtures.functionBody();
        var root = tree.root();
        var function = root.child(0).orElseThrow();
        var block = function.child(2).orElseThrow();

        assertThat(root.isRoot()).isTrue();
        assertThat(root.kind()).isEqualTo(NodeKind.SOURCE_FILE);
        assertThat(function.kind()).isEqualTo(NodeKind.FUNCTION_DEFINITION);
        assertThat(block.kind()).isEqualTo(NodeKind.BLOCK);
        assertThat(block.parent()).contains(function);
        assertThat(function.parent()).contains(root);
    }

    @Test
    void child_outOfRange_isEmpty() {
        var root = JuliaFixtures.functionBody().root();

        assertThat(root.child(-1)).isEmpty();
        assertThat(root.child(1)).isEmpty();
    }

    @Test
    void namedChildren_skipAnonymousTokens() {
        var call = JuliaFixtures.simpleCall()
                                .root()
                                .child(0)
                                .orElseThrow();
        var arguments = call.child(1).orElseThrow();

        assertThat(arguments.childCount()).isEqualTo(5);
        assertThat(arguments.namedChildren()).extracting(SyntaxNode::type)
                                             .containsExactly("identifier", "identifier");
        assertThat(arguments.firstNamedChild()
                            .map(SyntaxNode::start)).contains(SourcePosition.at(0, 2));
    }

    @Test
    void field_resolvesLabelledChild() {
        var tree = JuliaFixtures.conditional();
        var ifStatement = tree.descendantCovering(SourcePosition.at(1, 4))
                              .flatMap(SyntaxNode::parent)
                              .orElseThrow();

        assertThat(ifStatement.kind()).isEqualTo(NodeKind.IF_STATEMENT);
        assertThat(ifStatement.field("condition")
                              .map(SyntaxNode::kind)).contains(NodeKind.BINARY_EXPRESSION);
        assertThat(ifStatement.field("body")).isEmpty();
    }

    @Test
    void unknownType_keepsRawType() {
        var tree = JuliaFixtures.functionBody();
        var statement = tree.descendantCovering(SourcePosition.at(2, 4))
                            .flatMap(SyntaxNode::parent)
                            .orElseThrow();

        assertThat(statement.type()).isEqualTo("return_statement");
        assertThat(statement.kind()).isEqualTo(NodeKind.UNKNOWN);
    }

    // === Covering ===

    @Test
    void descendantCovering_findsSmallestNode() {
        var tree = JuliaFixtures.simpleCall();
        var covering = tree.descendantCovering(SourcePosition.at(1, 2)).orElseThrow();

        assertThat(covering.type()).isEqualTo("identifier");
        assertThat(covering.parent()
                           .map(SyntaxNode::kind)).contains(NodeKind.ARGUMENT_LIST);
    }

    @Test
    void descendantCovering_inGap_returnsEnclosingNode() {
        var tree = JuliaFixtures.blankLineInBlock();
        var covering = tree.descendantCovering(SourcePosition.at(2, 0)).orElseThrow();

        assertThat(covering.kind()).isEqualTo(NodeKind.BLOCK);
    }

    @Test
    void descendantCovering_pastEnd_isEmpty() {
        var tree = JuliaFixtures.functionBody();

        assertThat(tree.descendantCovering(SourcePosition.at(4, 0))).isEmpty();
        assertThat(tree.descendantCovering(SourcePosition.at(9, 0))).isEmpty();
    }
}
