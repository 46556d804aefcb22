package org.pragmatica.indent.engine;

import org.junit.jupiter.api.Test;
import org.pragmatica.indent.JuliaFixtures;
import org.pragmatica.indent.rule.RuleSegment;
import org.pragmatica.indent.rule.RuleTable;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.indent.rule.Anchor.ancestorBol;
import static org.pragmatica.indent.rule.Anchor.parentBol;
import static org.pragmatica.indent.rule.IndentRule.rule;
import static org.pragmatica.indent.rule.NodeMatcher.any;
import static org.pragmatica.indent.rule.NodeMatcher.kindIs;
import static org.pragmatica.indent.rule.NodeMatcher.noNode;
import static org.pragmatica.indent.rule.NodeMatcher.parentIs;
import static org.pragmatica.indent.tree.NodeKind.ARGUMENT_LIST;
import static org.pragmatica.indent.tree.NodeKind.END;
import static org.pragmatica.indent.tree.NodeKind.TERNARY_EXPRESSION;

class IndentEvaluatorTest {

    private static RuleTable table(RuleSegment... segments) {
        return RuleTable.of(List.of(segments));
    }

    private static RuleSegment fallback() {
        return RuleSegment.fixed("fallback", rule("blank-line", noNode(), parentBol(), 0));
    }

    @Test
    void evaluate_firstMatchingRuleWins() {
        var table = table(RuleSegment.fixed("lists",
                                            rule("first", parentIs(ARGUMENT_LIST), parentBol(), 2),
                                            rule("second", parentIs(ARGUMENT_LIST), parentBol(), 8)),
                          fallback());
        var decision = IndentEvaluator.evaluate(LineLocator.locate(JuliaFixtures.simpleCall(), 1), table);

        assertEquals(2, decision.column());
        assertEquals("first", decision.ruleLabel());
        assertEquals(0, decision.match().orElseThrow().index());
    }

    @Test
    void evaluate_noMatch_isColumnZero() {
        var table = table(RuleSegment.fixed("closers", rule("end", kindIs(END), parentBol(), 0)), fallback());
        var decision = IndentEvaluator.evaluate(LineLocator.locate(JuliaFixtures.simpleCall(), 1), table);

        assertFalse(decision.isMatched());
        assertEquals(0, decision.column());
        assertEquals("none", decision.ruleLabel());
    }

    @Test
    void evaluate_negativeResult_isClampedToZero() {
        var table = table(RuleSegment.fixed("lists", rule("dedent", parentIs(ARGUMENT_LIST), parentBol(), -8)), fallback());
        var decision = IndentEvaluator.evaluate(LineLocator.locate(JuliaFixtures.simpleCall(), 1), table);

        assertTrue(decision.isMatched());
        assertEquals(0, decision.column());
    }

    @Test
    void evaluate_unresolvedAnchor_fallsBackToParentBol() {
        var table = table(RuleSegment.fixed("odd", rule("missing-ternary", any(), ancestorBol(TERNARY_EXPRESSION), 2)),
                          fallback());
        var decision = IndentEvaluator.evaluate(LineLocator.locate(JuliaFixtures.callInFunction(), 2), table);

        assertEquals("missing-ternary", decision.ruleLabel());
        assertEquals(6, decision.column());
    }

    @Test
    void evaluate_unresolvedAnchorWithoutParent_usesColumnZero() {
        var decision = IndentEvaluator.evaluate(LineLocator.locate(JuliaFixtures.functionBody(), 9),
                                                table(fallback()));

        assertEquals("blank-line", decision.ruleLabel());
        assertEquals(0, decision.column());
    }
}
