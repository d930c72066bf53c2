package io.schemarules.core.error;

/**
 * Abstract base for all schema-rules exceptions. Never thrown directly; use the concrete
 * subclasses under {@link RuleSetLoadException} or {@link MaterializationException}.
 */
public abstract class SchemaRulesException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        GENERATION
    }

    private final String typeName;
    private final Phase phase;

    protected SchemaRulesException(String message, String typeName, Phase phase) {
        super(message);
        this.typeName = typeName;
        this.phase = phase;
    }

    protected SchemaRulesException(String message, Throwable cause, String typeName, Phase phase) {
        super(message, cause);
        this.typeName = typeName;
        this.phase = phase;
    }

    /** The validated type involved, or {@code null} if not yet identified. */
    public String typeName() {
        return typeName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    public Phase phase() {
        return phase;
    }
}
