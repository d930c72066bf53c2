package io.schemarules.core.error;

import java.util.List;

/** Thrown when a rule-set file does not match the rule-set JSON schema. */
public final class RuleSetSchemaException extends RuleSetLoadException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public RuleSetSchemaException(String message, List<String> violations, String typeName, String source) {
        super(message, typeName, source);
        this.violations = violations != null ? List.copyOf(violations) : List.of();
    }

    /** Individual schema violation messages. */
    public List<String> violations() {
        return violations;
    }
}
