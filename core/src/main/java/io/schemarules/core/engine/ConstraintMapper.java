package io.schemarules.core.engine;

import io.schemarules.core.model.ConstraintSet;
import io.schemarules.core.model.Rule;
import io.schemarules.core.model.RuleChain;
import io.schemarules.core.spi.SchemaNode;

/**
 * Maps a property's rule chain to a {@link ConstraintSet}.
 *
 * <p>Rules are evaluated in chain order, each proposing values that the set merges under its
 * policy. Length rules target {@code minItems}/{@code maxItems} when the property is an array and
 * {@code minLength}/{@code maxLength} otherwise. Stateless and thread-safe.
 */
public final class ConstraintMapper {

    /** Pattern used for {@code emailAddress} rules. */
    public static final String EMAIL_PATTERN = "^[^@\\s]+@[^@\\s]+$";

    /**
     * Computes the constraints of {@code chain} for the given property node. The node is only
     * read for its schema type.
     */
    public ConstraintSet map(RuleChain chain, SchemaNode property) {
        ConstraintSet set = new ConstraintSet();
        mapInto(set, chain, property);
        return set;
    }

    /** Adds the constraints of {@code chain} to an existing set. */
    public void mapInto(ConstraintSet set, RuleChain chain, SchemaNode property) {
        String type = property.type().orElse(null);
        for (Rule rule : chain.rules()) {
            apply(set, rule, type);
        }
    }

    private void apply(ConstraintSet set, Rule rule, String type) {
        boolean array = "array".equals(type);
        switch (rule.kind()) {
            case NOT_NULL -> {
                set.markRequired();
                set.markNotNullable();
            }
            case NOT_EMPTY -> {
                set.markRequired();
                set.markNotNullable();
                if ("string".equals(type)) {
                    set.proposeMinLength(1);
                } else if (array) {
                    set.proposeMinItems(1);
                }
            }
            case MAXIMUM_LENGTH -> proposeMaxLength(set, rule.integer(Rule.MAX), array);
            case MINIMUM_LENGTH -> proposeMinLength(set, rule.integer(Rule.MIN), array);
            case LENGTH -> {
                proposeMinLength(set, rule.integer(Rule.MIN), array);
                proposeMaxLength(set, rule.integer(Rule.MAX), array);
            }
            case GREATER_THAN -> set.proposeMinimum(rule.decimal(Rule.VALUE), true);
            case GREATER_THAN_OR_EQUAL -> set.proposeMinimum(rule.decimal(Rule.VALUE), false);
            case LESS_THAN -> set.proposeMaximum(rule.decimal(Rule.VALUE), true);
            case LESS_THAN_OR_EQUAL -> set.proposeMaximum(rule.decimal(Rule.VALUE), false);
            case INCLUSIVE_BETWEEN -> {
                set.proposeMinimum(rule.decimal(Rule.FROM), false);
                set.proposeMaximum(rule.decimal(Rule.TO), false);
            }
            case EXCLUSIVE_BETWEEN -> {
                set.proposeMinimum(rule.decimal(Rule.FROM), true);
                set.proposeMaximum(rule.decimal(Rule.TO), true);
            }
            case MATCHES -> set.proposePattern(rule.text(Rule.REGEX));
            case EMAIL_ADDRESS -> set.proposePattern(EMAIL_PATTERN);
            case IS_IN_ENUM -> set.proposeEnumValues(rule.values());
        }
    }

    private static void proposeMinLength(ConstraintSet set, Integer value, boolean array) {
        if (array) {
            set.proposeMinItems(value);
        } else {
            set.proposeMinLength(value);
        }
    }

    private static void proposeMaxLength(ConstraintSet set, Integer value, boolean array) {
        if (array) {
            set.proposeMaxItems(value);
        } else {
            set.proposeMaxLength(value);
        }
    }
}
