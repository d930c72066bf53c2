package io.schemarules.core.model;

import java.util.List;
import java.util.Objects;

/**
 * The ordered rules declared for one property of a validated type. Later rules refine earlier
 * ones of the same kind.
 */
public record RuleChain(String propertyName, List<Rule> rules) {

    public RuleChain {
        Objects.requireNonNull(propertyName, "propertyName must not be null");
        rules = rules != null ? List.copyOf(rules) : List.of();
    }

    public static RuleChain of(String propertyName, Rule... rules) {
        return new RuleChain(propertyName, List.of(rules));
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }
}
