package org.pragmatica.indent.config;

/**
 * Constructs whose continuation lines can either align to the first element
 * or indent a fixed step from the construct's line.
 */
public enum AlignmentFlag {
    ARGUMENT_LIST("align-argument-list"),
    PARAMETER_LIST("align-parameter-list"),
    TYPE_PARAMETER_LIST("align-type-parameter-list"),
    CURLY_BRACE("align-curly-brace"),
    ASSIGNMENT("align-assignment");

    private final String optionKey;

    AlignmentFlag(String optionKey) {
        this.optionKey = optionKey;
    }

    /**
     * Key of this flag in an options map.
     */
    public String optionKey() {
        return optionKey;
    }
}
