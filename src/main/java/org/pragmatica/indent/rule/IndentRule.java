package org.pragmatica.indent.rule;

/**
 * One line of a rule table: when {@code matcher} holds, indent to {@code anchor + offset}.
 *
 * @param label   Name used in logs and when auditing a table
 * @param matcher Condition on the line's node and its surroundings
 * @param anchor  Column the offset is measured from
 * @param offset  Columns added to the anchor
 */
public record IndentRule(
 String label,
 NodeMatcher matcher,
 Anchor anchor,
 int offset) {

    public static IndentRule rule(String label, NodeMatcher matcher, Anchor anchor, int offset) {
        return new IndentRule(label, matcher, anchor, offset);
    }

    @Override
    public String toString() {
        return label;
    }
}
