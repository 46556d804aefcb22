package org.pragmatica.indent.engine;

import org.pragmatica.indent.rule.IndentRule;

import java.util.Optional;

/**
 * Outcome of evaluating a rule table for one line.
 *
 * @param row    Row that was evaluated
 * @param column Resulting indentation column, never negative
 * @param match  Rule that decided the line, empty when no rule matched
 */
public record IndentDecision(
 int row,
 int column,
 Optional<Match> match) {

    /**
     * A fired rule and its position in the table.
     */
    public record Match(int index, IndentRule rule) {}

    public static IndentDecision matched(int row, int column, int index, IndentRule rule) {
        return new IndentDecision(row, column, Optional.of(new Match(index, rule)));
    }

    public static IndentDecision unmatched(int row) {
        return new IndentDecision(row, 0, Optional.empty());
    }

    public boolean isMatched() {
        return match.isPresent();
    }

    /**
     * Label of the rule that fired, {@code "none"} when nothing matched.
     */
    public String ruleLabel() {
        return match.map(m -> m.rule()
                               .label())
                    .orElse("none");
    }
}
