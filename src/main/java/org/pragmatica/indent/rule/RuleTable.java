package org.pragmatica.indent.rule;

import org.pragmatica.indent.config.AlignmentFlag;
import org.pragmatica.indent.error.IndentError;
import org.pragmatica.indent.error.IndentSetupException;

import java.util.List;
import java.util.Optional;

/**
 * Ordered, immutable list of indentation rules. Earlier rules take priority; the first rule
 * whose matcher holds decides the line.
 *
 * <p>A table must contain the blank-line fallback ({@code NoNode -> parent bol + 0}), so that
 * every line resolves to some column.
 */
public final class RuleTable {
    private final List<RuleSegment> segments;
    private final List<IndentRule> rules;

    private RuleTable(List<RuleSegment> segments) {
        this.segments = List.copyOf(segments);
        this.rules = this.segments.stream()
                                  .flatMap(segment -> segment.rules()
                                                             .stream())
                                  .toList();
    }

    /**
     * @throws IndentSetupException with {@link IndentError.IncompleteRuleTable} when the fallback is missing
     */
    public static RuleTable of(List<RuleSegment> segments) {
        var table = new RuleTable(segments);
        if (!table.hasBlankLineFallback()) {
            throw new IndentSetupException(new IndentError.IncompleteRuleTable("no 'NoNode -> parent bol + 0' rule"));
        }
        return table;
    }

    public List<IndentRule> rules() {
        return rules;
    }

    public List<RuleSegment> segments() {
        return segments;
    }

    public int size() {
        return rules.size();
    }

    public IndentRule get(int index) {
        return rules.get(index);
    }

    public Optional<RuleSegment> segment(String name) {
        return segments.stream()
                       .filter(segment -> segment.name()
                                                 .equals(name))
                       .findFirst();
    }

    public Optional<RuleSegment> slot(AlignmentFlag flag) {
        return segments.stream()
                       .filter(segment -> segment.slot()
                                                 .filter(flag::equals)
                                                 .isPresent())
                       .findFirst();
    }

    private boolean hasBlankLineFallback() {
        return rules.stream()
                    .anyMatch(rule -> rule.matcher() instanceof NodeMatcher.NoNode
                                      && rule.anchor() instanceof Anchor.ParentBol
                                      && rule.offset() == 0);
    }

    @Override
    public String toString() {
        return "RuleTable" + rules;
    }
}
