package io.schemarules.core.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The validation rule kinds that translate into schema constraints. Every kind carries the
 * camelCase name used when rules are declared in YAML rule sets.
 */
public enum RuleKind {
    NOT_NULL("notNull"),
    NOT_EMPTY("notEmpty"),
    MAXIMUM_LENGTH("maximumLength"),
    MINIMUM_LENGTH("minimumLength"),
    LENGTH("length"),
    GREATER_THAN("greaterThan"),
    GREATER_THAN_OR_EQUAL("greaterThanOrEqual"),
    LESS_THAN("lessThan"),
    LESS_THAN_OR_EQUAL("lessThanOrEqual"),
    INCLUSIVE_BETWEEN("inclusiveBetween"),
    EXCLUSIVE_BETWEEN("exclusiveBetween"),
    MATCHES("matches"),
    EMAIL_ADDRESS("emailAddress"),
    IS_IN_ENUM("isInEnum");

    private static final Map<String, RuleKind> BY_NAME =
            Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(RuleKind::declaredName, Function.identity()));

    private final String declaredName;

    RuleKind(String declaredName) {
        this.declaredName = declaredName;
    }

    /** Name used in rule-set files, e.g. {@code maximumLength}. */
    public String declaredName() {
        return declaredName;
    }

    /** Looks up a kind by its declared name. */
    public static Optional<RuleKind> fromDeclaredName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }
}
