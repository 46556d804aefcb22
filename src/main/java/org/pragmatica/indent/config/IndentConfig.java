package org.pragmatica.indent.config;

import org.pragmatica.indent.error.IndentError;
import org.pragmatica.indent.error.IndentSetupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

/**
 * Indentation style options.
 *
 * <p>Each alignment flag chooses between aligning continuation lines to the first element of
 * the construct ({@code true}) and indenting them {@link #indentOffset()} columns from the
 * construct's line ({@code false}).
 */
public record IndentConfig(
    int indentOffset,
    boolean alignArgumentList,
    boolean alignParameterList,
    boolean alignTypeParameterList,
    boolean alignCurlyBraces,
    boolean alignAssignment
) {
    private static final Logger log = LoggerFactory.getLogger(IndentConfig.class);

    public static final String INDENT_OFFSET = "indent-offset";

    public static final IndentConfig DEFAULT = new IndentConfig(
        4,
        false,
        false,
        false,
        false,
        false
    );

    public IndentConfig {
        if (indentOffset < 0) {
            throw new IndentSetupException(new IndentError.InvalidOption(INDENT_OFFSET,
                                                                         String.valueOf(indentOffset),
                                                                         "must not be negative"));
        }
    }

    public boolean aligned(AlignmentFlag flag) {
        return switch (flag) {
            case ARGUMENT_LIST -> alignArgumentList;
            case PARAMETER_LIST -> alignParameterList;
            case TYPE_PARAMETER_LIST -> alignTypeParameterList;
            case CURLY_BRACE -> alignCurlyBraces;
            case ASSIGNMENT -> alignAssignment;
        };
    }

    public IndentConfig withAligned(AlignmentFlag flag, boolean value) {
        return new IndentConfig(indentOffset,
                                flag == AlignmentFlag.ARGUMENT_LIST ? value : alignArgumentList,
                                flag == AlignmentFlag.PARAMETER_LIST ? value : alignParameterList,
                                flag == AlignmentFlag.TYPE_PARAMETER_LIST ? value : alignTypeParameterList,
                                flag == AlignmentFlag.CURLY_BRACE ? value : alignCurlyBraces,
                                flag == AlignmentFlag.ASSIGNMENT ? value : alignAssignment);
    }

    public IndentConfig withIndentOffset(int offset) {
        return new IndentConfig(offset,
                                alignArgumentList,
                                alignParameterList,
                                alignTypeParameterList,
                                alignCurlyBraces,
                                alignAssignment);
    }

    /**
     * Read options from a key/value map, starting from {@link #DEFAULT}.
     * Unknown keys are logged and skipped.
     *
     * @throws IndentSetupException with {@link IndentError.InvalidOption} for malformed values
     */
    public static IndentConfig fromOptions(Map<String, String> options) {
        var config = DEFAULT;
        for (var entry : options.entrySet()) {
            var key = entry.getKey();
            var value = entry.getValue() == null ? "" : entry.getValue().trim();
            if (INDENT_OFFSET.equals(key)) {
                config = config.withIndentOffset(parseOffset(value));
                continue;
            }
            var flag = flagFor(key);
            if (flag.isPresent()) {
                config = config.withAligned(flag.get(), parseBoolean(key, value));
            } else {
                log.warn("Ignoring unknown indentation option '{}'", key);
            }
        }
        return config;
    }

    private static Optional<AlignmentFlag> flagFor(String key) {
        return Arrays.stream(AlignmentFlag.values())
                     .filter(flag -> flag.optionKey()
                                         .equals(key))
                     .findFirst();
    }

    private static int parseOffset(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IndentSetupException(new IndentError.InvalidOption(INDENT_OFFSET, value, "not an integer"));
        }
    }

    private static boolean parseBoolean(String key, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IndentSetupException(new IndentError.InvalidOption(key, value, "expected true or false"));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int indentOffset = DEFAULT.indentOffset();
        private boolean alignArgumentList;
        private boolean alignParameterList;
        private boolean alignTypeParameterList;
        private boolean alignCurlyBraces;
        private boolean alignAssignment;

        private Builder() {}

        public Builder indentOffset(int offset) {
            this.indentOffset = offset;
            return this;
        }

        public Builder alignArgumentList(boolean enabled) {
            this.alignArgumentList = enabled;
            return this;
        }

        public Builder alignParameterList(boolean enabled) {
            this.alignParameterList = enabled;
            return this;
        }

        public Builder alignTypeParameterList(boolean enabled) {
            this.alignTypeParameterList = enabled;
            return this;
        }

        public Builder alignCurlyBraces(boolean enabled) {
            this.alignCurlyBraces = enabled;
            return this;
        }

        public Builder alignAssignment(boolean enabled) {
            this.alignAssignment = enabled;
            return this;
        }

        public IndentConfig build() {
            return new IndentConfig(indentOffset,
                                    alignArgumentList,
                                    alignParameterList,
                                    alignTypeParameterList,
                                    alignCurlyBraces,
                                    alignAssignment);
        }
    }
}
