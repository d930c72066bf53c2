package io.schemarules.core.error;

/**
 * Thrown when a rule-set file cannot be read, names an unknown type or rule, or carries invalid
 * rule parameters.
 */
public final class RuleSetParseException extends RuleSetLoadException {

    private static final long serialVersionUID = 1L;

    public RuleSetParseException(String message, String typeName, String source) {
        super(message, typeName, source);
    }

    public RuleSetParseException(String message, Throwable cause, String typeName, String source) {
        super(message, cause, typeName, source);
    }
}
