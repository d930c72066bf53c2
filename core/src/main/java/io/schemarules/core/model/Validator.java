package io.schemarules.core.model;

import java.util.List;

/**
 * A source of rule chains for one validated type. Implementations are usually {@link
 * RuleSetValidator} subclasses or validators declared in YAML rule sets.
 */
public interface Validator {

    /** The type whose properties the rule chains describe. */
    Class<?> validatedType();

    /** Rule chains in declaration order. A property may appear in more than one chain. */
    List<RuleChain> ruleChains();
}
