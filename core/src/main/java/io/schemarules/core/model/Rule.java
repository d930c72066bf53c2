package io.schemarules.core.model;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One validation rule: a {@link RuleKind} plus its parameters.
 *
 * <p>Numeric parameters are stored as {@link BigDecimal} (see {@link Decimals}); integer length
 * parameters as {@link Integer}. Use the static factories rather than the canonical constructor.
 */
public record Rule(RuleKind kind, Map<String, Object> parameters) {

    public static final String MIN = "min";
    public static final String MAX = "max";
    public static final String VALUE = "value";
    public static final String FROM = "from";
    public static final String TO = "to";
    public static final String REGEX = "regex";
    public static final String VALUES = "values";

    /** Canonical constructor with defensive copy. */
    public Rule {
        Objects.requireNonNull(kind, "kind must not be null");
        parameters = parameters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
    }

    public static Rule notNull() {
        return new Rule(RuleKind.NOT_NULL, Map.of());
    }

    public static Rule notEmpty() {
        return new Rule(RuleKind.NOT_EMPTY, Map.of());
    }

    public static Rule maximumLength(int max) {
        return new Rule(RuleKind.MAXIMUM_LENGTH, Map.of(MAX, requireNonNegative(max, MAX)));
    }

    public static Rule minimumLength(int min) {
        return new Rule(RuleKind.MINIMUM_LENGTH, Map.of(MIN, requireNonNegative(min, MIN)));
    }

    public static Rule length(int min, int max) {
        return new Rule(RuleKind.LENGTH, Map.of(MIN, requireNonNegative(min, MIN), MAX, requireNonNegative(max, MAX)));
    }

    public static Rule greaterThan(Number value) {
        return new Rule(RuleKind.GREATER_THAN, Map.of(VALUE, Decimals.of(value)));
    }

    public static Rule greaterThanOrEqual(Number value) {
        return new Rule(RuleKind.GREATER_THAN_OR_EQUAL, Map.of(VALUE, Decimals.of(value)));
    }

    public static Rule lessThan(Number value) {
        return new Rule(RuleKind.LESS_THAN, Map.of(VALUE, Decimals.of(value)));
    }

    public static Rule lessThanOrEqual(Number value) {
        return new Rule(RuleKind.LESS_THAN_OR_EQUAL, Map.of(VALUE, Decimals.of(value)));
    }

    public static Rule inclusiveBetween(Number from, Number to) {
        return new Rule(RuleKind.INCLUSIVE_BETWEEN, Map.of(FROM, Decimals.of(from), TO, Decimals.of(to)));
    }

    public static Rule exclusiveBetween(Number from, Number to) {
        return new Rule(RuleKind.EXCLUSIVE_BETWEEN, Map.of(FROM, Decimals.of(from), TO, Decimals.of(to)));
    }

    public static Rule matches(String regex) {
        return new Rule(RuleKind.MATCHES, Map.of(REGEX, Objects.requireNonNull(regex, "regex must not be null")));
    }

    public static Rule emailAddress() {
        return new Rule(RuleKind.EMAIL_ADDRESS, Map.of());
    }

    /**
     * Allowed values, kept in declaration order. Enum constants are stored by name, numbers as exact
     * decimals (see {@link Decimals}). {@code null} members are kept.
     */
    public static Rule isInEnum(Collection<?> values) {
        Objects.requireNonNull(values, "values must not be null");
        List<Object> normalized = values.stream()
                .<Object>map(Rule::enumValue)
                .toList();
        return new Rule(RuleKind.IS_IN_ENUM, Map.of(VALUES, normalized));
    }

    private static Object enumValue(Object value) {
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        return value instanceof Number n ? Decimals.of(n) : value;
    }

    /** Allowed values taken from every constant of {@code enumType}. */
    public static Rule isInEnum(Class<? extends Enum<?>> enumType) {
        return isInEnum(List.of(enumType.getEnumConstants()));
    }

    /** Returns an integer parameter. */
    public Integer integer(String name) {
        Object value = parameters.get(name);
        return value == null ? null : ((Number) value).intValue();
    }

    /** Returns a decimal parameter. */
    public BigDecimal decimal(String name) {
        Object value = parameters.get(name);
        return value == null ? null : Decimals.of((Number) value);
    }

    /** Returns a string parameter. */
    public String text(String name) {
        Object value = parameters.get(name);
        return value == null ? null : value.toString();
    }

    /** Returns the allowed values of an {@link RuleKind#IS_IN_ENUM} rule. */
    @SuppressWarnings("unchecked")
    public List<Object> values() {
        Object value = parameters.get(VALUES);
        return value == null ? List.of() : (List<Object>) value;
    }

    private static int requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException("'" + name + "' must not be negative, got: " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return parameters.isEmpty() ? kind.declaredName() : kind.declaredName() + parameters;
    }
}
