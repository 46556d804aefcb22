package org.pragmatica.indent.rule;

import org.pragmatica.indent.config.AlignmentFlag;

import java.util.List;
import java.util.Optional;

/**
 * Contiguous run of rules in a {@link RuleTable}.
 *
 * @param name  Segment name
 * @param slot  Alignment flag whose variant this segment is, empty for fixed segments
 * @param rules Rules in priority order
 */
public record RuleSegment(
 String name,
 Optional<AlignmentFlag> slot,
 List<IndentRule> rules) {

    public RuleSegment {
        rules = List.copyOf(rules);
    }

    public static RuleSegment fixed(String name, IndentRule... rules) {
        return new RuleSegment(name, Optional.empty(), List.of(rules));
    }

    public static RuleSegment fixed(String name, List<IndentRule> rules) {
        return new RuleSegment(name, Optional.empty(), rules);
    }

    public static RuleSegment slot(AlignmentFlag flag, List<IndentRule> rules) {
        return new RuleSegment(flag.optionKey(), Optional.of(flag), rules);
    }
}
