package io.schemarules.core.error;

/**
 * Thrown when the snapshot/cleanup protocol is misused, e.g. cleanup without a snapshot. This is
 * a programming error in the calling hook, never a data problem.
 */
public final class MaterializationException extends SchemaRulesException {

    private static final long serialVersionUID = 1L;

    public MaterializationException(String message) {
        super(message, null, Phase.GENERATION);
    }
}
