package org.pragmatica.indent;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;
import org.pragmatica.indent.JuliaFixtures.Fixture;
import org.pragmatica.indent.config.AlignmentFlag;
import org.pragmatica.indent.config.IndentConfig;
import org.pragmatica.indent.engine.IndentEvaluator;
import org.pragmatica.indent.engine.LineLocator;
import org.pragmatica.indent.julia.JuliaIndentRules;
import org.pragmatica.indent.rule.IndentContext;
import org.pragmatica.indent.rule.IndentRule;
import org.pragmatica.indent.rule.RuleTable;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IndentPropertiesTest {

    @Provide
    Arbitrary<Fixture> fixtures() {
        return Arbitraries.of(JuliaFixtures.all());
    }

    @Provide
    Arbitrary<Fixture> canonicalFixtures() {
        return Arbitraries.of(JuliaFixtures.all()
                                           .stream()
                                           .filter(Fixture::canonical)
                                           .toList());
    }

    @Provide
    Arbitrary<IndentConfig> configs() {
        var flag = Arbitraries.of(true, false);
        return Combinators.combine(Arbitraries.integers()
                                              .between(0, 8),
                                   flag,
                                   flag,
                                   flag,
                                   flag,
                                   flag)
                          .as(IndentConfig::new);
    }

    // === Totality ===

    @Property
    void everyRow_resolvesToNonNegativeColumn(@ForAll("fixtures") Fixture fixture,
                                              @ForAll("configs") IndentConfig config,
                                              @ForAll @IntRange(min = 0, max = 3) int extraRows) {
        var engine = IndentEngine.attach(TreeProvider.of(fixture.tree()), config);

        for (int row = 0; row < fixture.tree().lineCount() + extraRows; row++) {
            var decision = engine.decide(row);

            assertThat(decision.isMatched()).as("%s row %d", fixture, row)
                                            .isTrue();
            assertThat(decision.column()).isNotNegative();
        }
    }

    @Property
    void decisions_areDeterministic(@ForAll("fixtures") Fixture fixture,
                                    @ForAll("configs") IndentConfig config,
                                    @ForAll @IntRange(min = 0, max = 12) int row) {
        var first = IndentEngine.attach(TreeProvider.of(fixture.tree()), config);
        var second = IndentEngine.attach(TreeProvider.of(fixture.tree()), config);

        assertThat(first.decide(row)).isEqualTo(first.decide(row))
                                     .isEqualTo(second.decide(row));
    }

    @Property
    void firingRule_isFirstMatchInTable(@ForAll("fixtures") Fixture fixture,
                                        @ForAll("configs") IndentConfig config,
                                        @ForAll @IntRange(min = 0, max = 12) int row) {
        var table = JuliaIndentRules.build(config);
        var context = LineLocator.locate(fixture.tree(), row);
        var index = IndentEvaluator.evaluate(context, table)
                                   .match()
                                   .orElseThrow()
                                   .index();

        for (int earlier = 0; earlier < index; earlier++) {
            assertThat(table.get(earlier).matcher().test(context)).as("%s row %d shadowed by %s",
                                                                     fixture,
                                                                     row,
                                                                     table.get(earlier).label())
                                                                 .isFalse();
        }
    }

    // === Table layout ===

    @Property
    void fixedRules_keepTheirOrderUnderAnyConfig(@ForAll("configs") IndentConfig config) {
        assertThat(fixedLabels(JuliaIndentRules.build(config))).isEqualTo(fixedLabels(JuliaIndentRules.build(IndentConfig.DEFAULT)));
    }

    @Property
    void togglingFlag_leavesOtherSegmentsIntact(@ForAll("configs") IndentConfig config, @ForAll AlignmentFlag flag) {
        var before = JuliaIndentRules.build(config);
        var after = JuliaIndentRules.build(config.withAligned(flag, !config.aligned(flag)));

        for (int i = 0; i < before.segments().size(); i++) {
            var segment = before.segments().get(i);
            if (segment.slot().filter(flag::equals).isEmpty()) {
                assertThat(after.segments().get(i)).isEqualTo(segment);
            }
        }
    }

    // === Reindent ===

    @Property
    void canonicalFixtures_needNoEdits(@ForAll("canonicalFixtures") Fixture fixture) {
        var engine = IndentEngine.attach(TreeProvider.of(fixture.tree()));

        for (int row = 0; row < fixture.tree().lineCount(); row++) {
            assertThat(engine.reindent(row)).as("%s row %d", fixture, row)
                                            .isEmpty();
        }
    }

    @Property
    void edits_bringLineToTargetColumn(@ForAll("fixtures") Fixture fixture, @ForAll("configs") IndentConfig config) {
        var engine = IndentEngine.attach(TreeProvider.of(fixture.tree()), config);

        for (int row = 0; row < fixture.tree().lineCount(); row++) {
            var line = fixture.tree().line(row);
            var target = engine.computeIndent(row);
            engine.reindent(row)
                  .ifPresent(edit -> {
                      var edited = edit.apply(line);

                      assertThat(IndentContext.leadingWhitespace(edited)).isEqualTo(target);
                      assertThat(edited.strip()).isEqualTo(line.strip());
                  });
        }
    }

    private static List<String> fixedLabels(RuleTable table) {
        return table.segments()
                    .stream()
                    .filter(segment -> segment.slot().isEmpty())
                    .flatMap(segment -> segment.rules().stream())
                    .map(IndentRule::label)
                    .toList();
    }
}
