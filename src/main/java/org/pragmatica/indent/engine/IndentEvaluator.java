package org.pragmatica.indent.engine;

import org.pragmatica.indent.rule.IndentContext;
import org.pragmatica.indent.rule.RuleTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First-match evaluation of a {@link RuleTable}.
 */
public final class IndentEvaluator {
    private static final Logger log = LoggerFactory.getLogger(IndentEvaluator.class);

    private IndentEvaluator() {}

    /**
     * Evaluate rules in order; the first rule whose matcher holds yields
     * {@code anchor + offset}, clamped to zero. An anchor that cannot be resolved falls back to
     * the parent's beginning of line, then to column zero. Never throws.
     */
    public static IndentDecision evaluate(IndentContext context, RuleTable table) {
        var rules = table.rules();
        for (int i = 0; i < rules.size(); i++) {
            var rule = rules.get(i);
            if (!rule.matcher()
                     .test(context)) {
                continue;
            }
            var anchor = rule.anchor()
                             .column(context);
            int base;
            if (anchor.isPresent()) {
                base = anchor.getAsInt();
            } else {
                base = fallbackColumn(context);
                log.debug("Rule '{}' has no anchor on row {}, using column {}", rule.label(), context.row(), base);
            }
            return IndentDecision.matched(context.row(), Math.max(0, base + rule.offset()), i, rule);
        }
        return IndentDecision.unmatched(context.row());
    }

    private static int fallbackColumn(IndentContext context) {
        return context.parent()
                      .map(context::bol)
                      .orElse(0);
    }
}
