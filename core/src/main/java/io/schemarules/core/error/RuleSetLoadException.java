package io.schemarules.core.error;

/**
 * Abstract parent for errors raised while loading rule-set files. Carries the file or resource
 * that caused the error.
 */
public abstract class RuleSetLoadException extends SchemaRulesException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected RuleSetLoadException(String message, String typeName, String source) {
        super(message, typeName, Phase.LOAD);
        this.source = source;
    }

    protected RuleSetLoadException(String message, Throwable cause, String typeName, String source) {
        super(message, cause, typeName, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
