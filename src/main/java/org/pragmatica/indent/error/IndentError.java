package org.pragmatica.indent.error;

/**
 * Setup-time failure causes. Per-line queries never fail; everything that can go wrong is
 * detected once, when an engine is attached or reconfigured.
 */
public sealed interface IndentError {
    String message();

    /**
     * No tree provider was supplied.
     */
    record TreeProviderMissing() implements IndentError {
        @Override
        public String message() {
            return "No syntax tree provider supplied";
        }
    }

    /**
     * The provider exists but its parser has not produced a tree yet.
     */
    record TreeNotReady(String reason) implements IndentError {
        @Override
        public String message() {
            return "Syntax tree provider is not ready: " + reason;
        }
    }

    /**
     * A configuration option has a value that cannot be used.
     */
    record InvalidOption(
    String option,
    String value,
    String reason) implements IndentError {
        @Override
        public String message() {
            return "Invalid value '" + value + "' for option '" + option + "': " + reason;
        }
    }

    /**
     * A rule table lacks the blank-line fallback that makes every line resolvable.
     */
    record IncompleteRuleTable(String reason) implements IndentError {
        @Override
        public String message() {
            return "Incomplete rule table: " + reason;
        }
    }
}
