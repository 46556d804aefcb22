package org.pragmatica.indent.tree;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Grammar productions and tokens known to the indentation rules.
 *
 * <p>Node types the grammar produces but this enum does not list map to {@link #UNKNOWN};
 * the raw type string stays available through {@link SyntaxNode#type()}.
 */
public enum NodeKind {
    // === Top level ===
    SOURCE_FILE("source_file"),
    MODULE_DEFINITION("module_definition"),

    // === Definitions ===
    FUNCTION_DEFINITION("function_definition"),
    MACRO_DEFINITION("macro_definition"),
    STRUCT_DEFINITION("struct_definition"),
    SIGNATURE("signature"),

    // === Statements and clauses ===
    LET_STATEMENT("let_statement"),
    IF_STATEMENT("if_statement"),
    ELSEIF_CLAUSE("elseif_clause"),
    ELSE_CLAUSE("else_clause"),
    FOR_STATEMENT("for_statement"),
    WHILE_STATEMENT("while_statement"),
    TRY_STATEMENT("try_statement"),
    CATCH_CLAUSE("catch_clause"),
    FINALLY_CLAUSE("finally_clause"),
    DO_CLAUSE("do_clause"),
    QUOTE_STATEMENT("quote_statement"),
    COMPOUND_STATEMENT("compound_statement"),
    BLOCK("block"),
    ASSIGNMENT("assignment"),

    // === Lists ===
    ARGUMENT_LIST("argument_list"),
    KEYWORD_ARGUMENTS("keyword_arguments"),
    PARAMETER_LIST("parameter_list"),
    KEYWORD_PARAMETERS("keyword_parameters"),
    TYPE_PARAMETER_LIST("type_parameter_list"),

    // === Expressions ===
    CURLY_EXPRESSION("curly_expression"),
    TUPLE_EXPRESSION("tuple_expression"),
    VECTOR_EXPRESSION("vector_expression"),
    MATRIX_EXPRESSION("matrix_expression"),
    MATRIX_ROW("matrix_row"),
    COMPREHENSION_EXPRESSION("comprehension_expression"),
    PARENTHESIZED_EXPRESSION("parenthesized_expression"),
    CALL_EXPRESSION("call_expression"),
    BINARY_EXPRESSION("binary_expression"),
    TERNARY_EXPRESSION("ternary_expression"),
    FIELD_EXPRESSION("field_expression"),
    PARAMETRIZED_TYPE_EXPRESSION("parametrized_type_expression"),

    // === Leaves ===
    IDENTIFIER("identifier"),
    INTEGER_LITERAL("integer_literal"),
    FLOAT_LITERAL("float_literal"),
    STRING_LITERAL("string_literal"),
    END("end"),
    LEFT_PAREN("("),
    RIGHT_PAREN(")"),
    LEFT_BRACKET("["),
    RIGHT_BRACKET("]"),
    LEFT_BRACE("{"),
    RIGHT_BRACE("}"),

    // === Recovery ===
    ERROR("ERROR"),
    UNKNOWN("");

    private static final Map<String, NodeKind> BY_GRAMMAR_NAME =
        Arrays.stream(values())
              .filter(kind -> kind != UNKNOWN)
              .collect(Collectors.toUnmodifiableMap(NodeKind::grammarName, Function.identity()));

    private static final Set<NodeKind> EXPRESSIONS =
        Collections.unmodifiableSet(Arrays.stream(values())
                                          .filter(NodeKind::isExpression)
                                          .collect(Collectors.toCollection(() -> EnumSet.noneOf(NodeKind.class))));

    private final String grammarName;

    NodeKind(String grammarName) {
        this.grammarName = grammarName;
    }

    /**
     * Name of the production or token in the grammar.
     */
    public String grammarName() {
        return grammarName;
    }

    public boolean isExpression() {
        return grammarName.endsWith("_expression");
    }

    /**
     * Map a raw node type to its kind, {@link #UNKNOWN} when the engine does not know it.
     */
    public static NodeKind of(String type) {
        return BY_GRAMMAR_NAME.getOrDefault(type, UNKNOWN);
    }

    /**
     * All kinds whose grammar name ends in {@code _expression}.
     */
    public static Set<NodeKind> expressions() {
        return EXPRESSIONS;
    }
}
