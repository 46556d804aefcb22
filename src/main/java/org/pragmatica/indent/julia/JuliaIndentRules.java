package org.pragmatica.indent.julia;

import org.pragmatica.indent.config.AlignmentFlag;
import org.pragmatica.indent.config.IndentConfig;
import org.pragmatica.indent.rule.IndentRule;
import org.pragmatica.indent.rule.RuleSegment;
import org.pragmatica.indent.rule.RuleTable;
import org.pragmatica.indent.tree.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.pragmatica.indent.rule.Anchor.ancestorBol;
import static org.pragmatica.indent.rule.Anchor.columnZero;
import static org.pragmatica.indent.rule.Anchor.firstSibling;
import static org.pragmatica.indent.rule.Anchor.grandparentBol;
import static org.pragmatica.indent.rule.Anchor.grandparentFirstSibling;
import static org.pragmatica.indent.rule.Anchor.parentBol;
import static org.pragmatica.indent.rule.IndentRule.rule;
import static org.pragmatica.indent.rule.NodeMatcher.all;
import static org.pragmatica.indent.rule.NodeMatcher.ancestorIs;
import static org.pragmatica.indent.rule.NodeMatcher.any;
import static org.pragmatica.indent.rule.NodeMatcher.grandparentIs;
import static org.pragmatica.indent.rule.NodeMatcher.kindIn;
import static org.pragmatica.indent.rule.NodeMatcher.kindIs;
import static org.pragmatica.indent.rule.NodeMatcher.noNode;
import static org.pragmatica.indent.rule.NodeMatcher.parentIn;
import static org.pragmatica.indent.rule.NodeMatcher.parentIs;
import static org.pragmatica.indent.rule.NodeMatcher.siblingOnSameLine;
import static org.pragmatica.indent.rule.NodeMatcher.withinField;
import static org.pragmatica.indent.tree.NodeKind.*;

/**
 * Indentation rules for Julia syntax trees.
 *
 * <p>The table is assembled from fixed segments and one slot per {@link AlignmentFlag}. A flag
 * only decides which variant fills its own slot, so the relative order of all other rules is the
 * same for every configuration:
 * <ol>
 *   <li>closers: {@code end}, clause keywords, closing brackets</li>
 *   <li>top-level</li>
 *   <li>slots: argument list, parameter list, type parameter list, curly braces</li>
 *   <li>collections: tuples, vectors, matrices, comprehensions, parentheses</li>
 *   <li>slot: assignment continuation, then the assignment itself</li>
 *   <li>conditions, generic expressions, blocks</li>
 *   <li>fallback: blank lines, then anything else</li>
 * </ol>
 */
public final class JuliaIndentRules {
    private static final Logger log = LoggerFactory.getLogger(JuliaIndentRules.class);

    /**
     * Constructs whose body is indented one step from the construct's line.
     */
    public static final Set<NodeKind> BLOCK_CONSTRUCTS = EnumSet.of(LET_STATEMENT,
                                                                    IF_STATEMENT,
                                                                    ELSEIF_CLAUSE,
                                                                    ELSE_CLAUSE,
                                                                    FOR_STATEMENT,
                                                                    WHILE_STATEMENT,
                                                                    TRY_STATEMENT,
                                                                    CATCH_CLAUSE,
                                                                    FINALLY_CLAUSE,
                                                                    DO_CLAUSE,
                                                                    QUOTE_STATEMENT,
                                                                    FUNCTION_DEFINITION,
                                                                    MACRO_DEFINITION,
                                                                    STRUCT_DEFINITION,
                                                                    COMPOUND_STATEMENT);

    private static final String CONDITION = "condition";

    private JuliaIndentRules() {}

    /**
     * Build the rule table for a configuration. Pure: equal configurations give equal tables.
     */
    public static RuleTable build(IndentConfig config) {
        var step = config.indentOffset();
        var segments = List.of(closers(),
                               topLevel(),
                               delimitedList(AlignmentFlag.ARGUMENT_LIST, ARGUMENT_LIST, KEYWORD_ARGUMENTS, config),
                               delimitedList(AlignmentFlag.PARAMETER_LIST, PARAMETER_LIST, KEYWORD_PARAMETERS, config),
                               bracketed(AlignmentFlag.TYPE_PARAMETER_LIST, TYPE_PARAMETER_LIST, config),
                               bracketed(AlignmentFlag.CURLY_BRACE, CURLY_EXPRESSION, config),
                               collections(step),
                               assignmentContinuation(config),
                               assignment(step),
                               conditions(step),
                               expressions(),
                               blocks(step),
                               fallback());
        var table = RuleTable.of(segments);
        log.debug("Built {} indentation rules for {}", table.size(), config);
        return table;
    }

    // === Fixed segments ===

    private static RuleSegment closers() {
        return RuleSegment.fixed("closers",
                                 rule("end", kindIs(END), parentBol(), 0),
                                 rule("clause",
                                      kindIn(ELSEIF_CLAUSE, ELSE_CLAUSE, CATCH_CLAUSE, FINALLY_CLAUSE),
                                      parentBol(),
                                      0),
                                 rule("closing-bracket",
                                      kindIn(RIGHT_PAREN, RIGHT_BRACKET, RIGHT_BRACE),
                                      parentBol(),
                                      0));
    }

    private static RuleSegment topLevel() {
        return RuleSegment.fixed("top-level",
                                 rule("source-file", parentIs(SOURCE_FILE), columnZero(), 0),
                                 rule("module-body", parentIs(MODULE_DEFINITION), parentBol(), 0));
    }

    private static RuleSegment collections(int step) {
        var rules = new ArrayList<IndentRule>();
        for (var kind : List.of(TUPLE_EXPRESSION, VECTOR_EXPRESSION, MATRIX_EXPRESSION, COMPREHENSION_EXPRESSION)) {
            rules.add(rule(kind.grammarName() + "/aligned",
                           all(parentIs(kind), siblingOnSameLine(kind, 1)),
                           firstSibling(),
                           0));
            rules.add(rule(kind.grammarName(), parentIs(kind), parentBol(), step));
        }
        rules.add(rule("parenthesized_expression", parentIs(PARENTHESIZED_EXPRESSION), parentBol(), step));
        return RuleSegment.fixed("collections", rules);
    }

    private static RuleSegment assignment(int step) {
        return RuleSegment.fixed("assignment", rule("assignment", parentIs(ASSIGNMENT), parentBol(), step));
    }

    private static RuleSegment conditions(int step) {
        return RuleSegment.fixed("conditions",
                                 conditionContinuation(IF_STATEMENT, step),
                                 conditionContinuation(ELSEIF_CLAUSE, step),
                                 conditionContinuation(WHILE_STATEMENT, step),
                                 rule("ternary-continuation",
                                      all(parentIn(NodeKind.expressions()), ancestorIs(TERNARY_EXPRESSION)),
                                      ancestorBol(TERNARY_EXPRESSION),
                                      step));
    }

    private static IndentRule conditionContinuation(NodeKind construct, int step) {
        return rule(construct.grammarName() + "/condition",
                    all(parentIn(NodeKind.expressions()), withinField(construct, CONDITION)),
                    ancestorBol(construct),
                    step);
    }

    private static RuleSegment expressions() {
        return RuleSegment.fixed("expressions",
                                 rule("expression", parentIn(NodeKind.expressions()), parentBol(), 0));
    }

    private static RuleSegment blocks(int step) {
        return RuleSegment.fixed("blocks",
                                 rule("block-statement", parentIs(BLOCK), parentBol(), 0),
                                 rule("block-body", parentIn(BLOCK_CONSTRUCTS), parentBol(), step));
    }

    private static RuleSegment fallback() {
        return RuleSegment.fixed("fallback",
                                 rule("blank-line", noNode(), parentBol(), 0),
                                 rule("catch-all", any(), parentBol(), 0));
    }

    // === Slots ===

    /**
     * Argument and parameter lists: {@code (a, b; key = c)}. Entries after {@code ;} sit in a
     * keyword group one level below the list.
     */
    private static RuleSegment delimitedList(AlignmentFlag flag, NodeKind list, NodeKind keywordGroup, IndentConfig config) {
        var name = list.grammarName();
        var rules = new ArrayList<IndentRule>();
        if (config.aligned(flag)) {
            rules.add(rule(name + "/aligned",
                           all(parentIs(list), siblingOnSameLine(list, 1)),
                           firstSibling(),
                           0));
            rules.add(rule(keywordGroup.grammarName() + "/aligned",
                           all(parentIs(keywordGroup), grandparentIs(list), siblingOnSameLine(list, 1)),
                           grandparentFirstSibling(),
                           0));
        }
        rules.add(rule(name, parentIs(list), parentBol(), config.indentOffset()));
        rules.add(rule(keywordGroup.grammarName(),
                       all(parentIs(keywordGroup), grandparentIs(list)),
                       grandparentBol(),
                       config.indentOffset()));
        return RuleSegment.slot(flag, rules);
    }

    /**
     * Brace-delimited lists: {@code {A, B}}.
     */
    private static RuleSegment bracketed(AlignmentFlag flag, NodeKind list, IndentConfig config) {
        var name = list.grammarName();
        var rules = new ArrayList<IndentRule>();
        if (config.aligned(flag)) {
            rules.add(rule(name + "/aligned",
                           all(parentIs(list), siblingOnSameLine(list, 1)),
                           firstSibling(),
                           0));
        }
        rules.add(rule(name, parentIs(list), parentBol(), config.indentOffset()));
        return RuleSegment.slot(flag, rules);
    }

    /**
     * Continuation lines of the right-hand side, {@code x = a +\n b}: aligned under the start of
     * the right-hand side, or one step from the assignment's line.
     */
    private static RuleSegment assignmentContinuation(IndentConfig config) {
        var matcher = all(parentIn(NodeKind.expressions()), grandparentIs(ASSIGNMENT));
        var continuation = config.aligned(AlignmentFlag.ASSIGNMENT)
                           ? rule("assignment-continuation/aligned", matcher, firstSibling(), 0)
                           : rule("assignment-continuation", matcher, grandparentBol(), config.indentOffset());
        return RuleSegment.slot(AlignmentFlag.ASSIGNMENT, List.of(continuation));
    }
}
