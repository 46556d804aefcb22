package org.pragmatica.indent.error;

/**
 * Raised when an engine cannot be set up. Carries the structured cause.
 */
public final class IndentSetupException extends RuntimeException {
    private final IndentError error;

    public IndentSetupException(IndentError error) {
        super(error.message());
        this.error = error;
    }

    public IndentError error() {
        return error;
    }
}
