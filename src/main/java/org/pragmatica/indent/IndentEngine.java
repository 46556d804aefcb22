package org.pragmatica.indent;

import org.pragmatica.indent.config.IndentConfig;
import org.pragmatica.indent.engine.IndentDecision;
import org.pragmatica.indent.engine.IndentEvaluator;
import org.pragmatica.indent.engine.LineEdit;
import org.pragmatica.indent.engine.LineLocator;
import org.pragmatica.indent.error.IndentError;
import org.pragmatica.indent.error.IndentSetupException;
import org.pragmatica.indent.julia.JuliaIndentRules;
import org.pragmatica.indent.rule.IndentContext;
import org.pragmatica.indent.rule.RuleTable;
import org.pragmatica.indent.tree.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Entry point for computing indentation.
 *
 * <p>Example usage:
 * <pre>{@code
 * var engine = IndentEngine.builder(provider)
 *                          .indentOffset(2)
 *                          .alignArgumentList(true)
 *                          .attach();
 *
 * int column = engine.computeIndent(12);
 * }</pre>
 *
 * <p>The configuration and the rule table built from it are installed together and replaced
 * atomically by {@link #reconfigure(IndentConfig)}. A query reads the pair once, so it sees either
 * the old table or the new one in full.
 */
public final class IndentEngine {
    private static final Logger log = LoggerFactory.getLogger(IndentEngine.class);

    private final TreeProvider provider;
    private final Function<IndentConfig, RuleTable> tableFactory;
    private final AtomicReference<Installed> installed;

    private record Installed(IndentConfig config, RuleTable table) {}

    private IndentEngine(TreeProvider provider, Function<IndentConfig, RuleTable> tableFactory, IndentConfig config) {
        this.provider = provider;
        this.tableFactory = tableFactory;
        this.installed = new AtomicReference<>(new Installed(config, tableFactory.apply(config)));
    }

    /**
     * Attach to a tree provider with the default configuration.
     *
     * @throws IndentSetupException when the provider is missing or not ready
     */
    public static IndentEngine attach(TreeProvider provider) {
        return attach(provider, IndentConfig.DEFAULT);
    }

    /**
     * Attach to a tree provider with the given configuration.
     *
     * @throws IndentSetupException when the provider is missing or not ready
     */
    public static IndentEngine attach(TreeProvider provider, IndentConfig config) {
        return attach(provider, config, JuliaIndentRules::build);
    }

    /**
     * Attach with a custom rule table factory, for grammars other than Julia.
     */
    public static IndentEngine attach(TreeProvider provider,
                                      IndentConfig config,
                                      Function<IndentConfig, RuleTable> tableFactory) {
        if (provider == null) {
            throw new IndentSetupException(new IndentError.TreeProviderMissing());
        }
        if (!provider.isReady()) {
            throw new IndentSetupException(new IndentError.TreeNotReady(provider.notReadyReason()));
        }
        var engine = new IndentEngine(provider, tableFactory, config);
        log.info("Indentation engine attached: {} rules, offset {}",
                 engine.ruleTable()
                       .size(),
                 config.indentOffset());
        return engine;
    }

    public IndentConfig config() {
        return installed.get()
                        .config();
    }

    public RuleTable ruleTable() {
        return installed.get()
                        .table();
    }

    /**
     * Rebuild the rule table for a new configuration and install it atomically.
     */
    public void reconfigure(IndentConfig config) {
        var next = new Installed(config, tableFactory.apply(config));
        installed.set(next);
        log.info("Indentation engine reconfigured: {} rules for {}",
                 next.table()
                     .size(),
                 config);
    }

    /**
     * Indentation column for the row; never negative. Rows outside the buffer resolve to column 0.
     */
    public int computeIndent(int row) {
        return decide(row).column();
    }

    /**
     * Indentation column for the row along with the rule that produced it.
     */
    public IndentDecision decide(int row) {
        var tree = provider.currentTree();
        if (tree.isEmpty()) {
            log.warn("No syntax tree available for row {}, keeping column 0", row);
            return IndentDecision.unmatched(row);
        }
        return decide(tree.get(), row);
    }

    /**
     * Edit that brings the row to its computed indentation, empty when the row already starts at
     * that column with spaces only. Blank rows are left alone; use {@link #computeIndent(int)} to
     * place a cursor on them.
     */
    public Optional<LineEdit> reindent(int row) {
        var tree = provider.currentTree();
        if (tree.isEmpty()) {
            log.warn("No syntax tree available for row {}, leaving it unchanged", row);
            return Optional.empty();
        }
        var line = tree.get()
                       .line(row);
        if (line.isBlank()) {
            return Optional.empty();
        }
        var width = IndentContext.leadingWhitespace(line);
        var target = decide(tree.get(), row).column();
        if (width == target && line.substring(0, width)
                                   .chars()
                                   .allMatch(c -> c == ' ')) {
            return Optional.empty();
        }
        return Optional.of(new LineEdit(row, width, target));
    }

    private IndentDecision decide(SyntaxTree tree, int row) {
        if (row < 0) {
            log.debug("Row {} is before the buffer, keeping column 0", row);
            return IndentDecision.unmatched(row);
        }
        var decision = IndentEvaluator.evaluate(LineLocator.locate(tree, row),
                                                installed.get()
                                                         .table());
        log.debug("Row {} -> column {} ({})", row, decision.column(), decision.ruleLabel());
        return decision;
    }

    public static Builder builder(TreeProvider provider) {
        return new Builder(provider);
    }

    public static final class Builder {
        private final TreeProvider provider;
        private final IndentConfig.Builder config = IndentConfig.builder();

        private Builder(TreeProvider provider) {
            this.provider = provider;
        }

        public Builder indentOffset(int offset) {
            config.indentOffset(offset);
            return this;
        }

        public Builder alignArgumentList(boolean enabled) {
            config.alignArgumentList(enabled);
            return this;
        }

        public Builder alignParameterList(boolean enabled) {
            config.alignParameterList(enabled);
            return this;
        }

        public Builder alignTypeParameterList(boolean enabled) {
            config.alignTypeParameterList(enabled);
            return this;
        }

        public Builder alignCurlyBraces(boolean enabled) {
            config.alignCurlyBraces(enabled);
            return this;
        }

        public Builder alignAssignment(boolean enabled) {
            config.alignAssignment(enabled);
            return this;
        }

        public IndentEngine attach() {
            return IndentEngine.attach(provider, config.build());
        }
    }
}
