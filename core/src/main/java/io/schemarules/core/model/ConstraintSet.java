package io.schemarules.core.model;

import io.schemarules.core.spi.SchemaNode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Mutable bag of schema constraints computed for one property.
 *
 * <p>Merge policy:
 *
 * <ul>
 *   <li>lower bounds ({@code minLength}, {@code minItems}, {@code minimum}) keep the larger value;
 *   <li>upper bounds ({@code maxLength}, {@code maxItems}, {@code maximum}) keep the smaller value;
 *   <li>on equal numeric bounds the exclusivity flags are OR-ed, otherwise the winning bound keeps
 *       its own flag;
 *   <li>{@code required} and not-nullable only ever switch on;
 *   <li>{@code pattern} and {@code enumValues}: the last proposal wins.
 * </ul>
 *
 * <p>Contradictory bounds (a minimum above a maximum) are kept as proposed.
 *
 * <p>Not thread-safe. Created per (type, property) and discarded after {@link #applyTo}.
 */
public final class ConstraintSet {

    private boolean required;
    private boolean notNullable;
    private Integer minLength;
    private Integer maxLength;
    private Integer minItems;
    private Integer maxItems;
    private BigDecimal minimum;
    private boolean exclusiveMinimum;
    private BigDecimal maximum;
    private boolean exclusiveMaximum;
    private String pattern;
    private List<Object> enumValues;

    /**
     * Reads the constraints currently written on {@code node}. The required flag lives on the
     * parent schema and is not read.
     */
    public static ConstraintSet readFrom(SchemaNode node) {
        ConstraintSet set = new ConstraintSet();
        if (node.isEmpty()) {
            return set;
        }
        set.notNullable = Boolean.FALSE.equals(node.getNullable());
        set.proposeMinLength(node.getMinLength());
        set.proposeMaxLength(node.getMaxLength());
        set.proposeMinItems(node.getMinItems());
        set.proposeMaxItems(node.getMaxItems());
        set.proposeMinimum(node.getMinimum(), Boolean.TRUE.equals(node.getExclusiveMinimum()));
        set.proposeMaximum(node.getMaximum(), Boolean.TRUE.equals(node.getExclusiveMaximum()));
        set.proposePattern(node.getPattern());
        set.proposeEnumValues(node.getEnumValues());
        return set;
    }

    public void markRequired() {
        required = true;
    }

    public void markNotNullable() {
        notNullable = true;
    }

    public void proposeMinLength(Integer value) {
        minLength = higher(minLength, value);
    }

    public void proposeMaxLength(Integer value) {
        maxLength = lower(maxLength, value);
    }

    public void proposeMinItems(Integer value) {
        minItems = higher(minItems, value);
    }

    public void proposeMaxItems(Integer value) {
        maxItems = lower(maxItems, value);
    }

    public void proposeMinimum(BigDecimal value, boolean exclusive) {
        if (value == null) {
            return;
        }
        int cmp = minimum == null ? 1 : value.compareTo(minimum);
        if (cmp > 0) {
            minimum = value;
            exclusiveMinimum = exclusive;
        } else if (cmp == 0) {
            exclusiveMinimum = exclusiveMinimum || exclusive;
        }
    }

    public void proposeMaximum(BigDecimal value, boolean exclusive) {
        if (value == null) {
            return;
        }
        int cmp = maximum == null ? -1 : value.compareTo(maximum);
        if (cmp < 0) {
            maximum = value;
            exclusiveMaximum = exclusive;
        } else if (cmp == 0) {
            exclusiveMaximum = exclusiveMaximum || exclusive;
        }
    }

    public void proposePattern(String value) {
        if (value != null) {
            pattern = value;
        }
    }

    public void proposeEnumValues(List<?> values) {
        if (values != null) {
            // null is a legal member of a nullable enum
            enumValues = Collections.unmodifiableList(new ArrayList<>(values));
        }
    }

    /** Folds {@code other} into this set using the merge policy; {@code other} counts as later. */
    public ConstraintSet merge(ConstraintSet other) {
        if (other.required) {
            required = true;
        }
        if (other.notNullable) {
            notNullable = true;
        }
        proposeMinLength(other.minLength);
        proposeMaxLength(other.maxLength);
        proposeMinItems(other.minItems);
        proposeMaxItems(other.maxItems);
        proposeMinimum(other.minimum, other.exclusiveMinimum);
        proposeMaximum(other.maximum, other.exclusiveMaximum);
        proposePattern(other.pattern);
        proposeEnumValues(other.enumValues);
        return this;
    }

    /**
     * Writes every constraint held here onto {@code node}, overwriting its values. Writes on an
     * empty node are discarded by the node itself.
     */
    public void writeTo(SchemaNode node) {
        if (notNullable) {
            node.setNullable(Boolean.FALSE);
        }
        if (minLength != null) {
            node.setMinLength(minLength);
        }
        if (maxLength != null) {
            node.setMaxLength(maxLength);
        }
        if (minItems != null) {
            node.setMinItems(minItems);
        }
        if (maxItems != null) {
            node.setMaxItems(maxItems);
        }
        if (minimum != null) {
            node.setMinimum(minimum);
            node.setExclusiveMinimum(exclusiveMinimum ? Boolean.TRUE : null);
        }
        if (maximum != null) {
            node.setMaximum(maximum);
            node.setExclusiveMaximum(exclusiveMaximum ? Boolean.TRUE : null);
        }
        if (pattern != null) {
            node.setPattern(pattern);
        }
        if (enumValues != null) {
            node.setEnumValues(enumValues);
        }
    }

    /**
     * Merges this set over the property's current constraints and writes the result back. The
     * required flag is recorded on {@code parent} under {@code propertyKey}, even when the
     * property node itself is empty.
     */
    public void applyTo(SchemaNode property, SchemaNode parent, String propertyKey) {
        ConstraintSet current = readFrom(property);
        current.merge(this);
        current.writeTo(property);
        if (required) {
            parent.addRequired(propertyKey);
        }
    }

    public boolean isEmpty() {
        return equals(new ConstraintSet());
    }

    public boolean isRequired() {
        return required;
    }

    public boolean isNotNullable() {
        return notNullable;
    }

    public Integer minLength() {
        return minLength;
    }

    public Integer maxLength() {
        return maxLength;
    }

    public Integer minItems() {
        return minItems;
    }

    public Integer maxItems() {
        return maxItems;
    }

    public BigDecimal minimum() {
        return minimum;
    }

    public boolean exclusiveMinimum() {
        return exclusiveMinimum;
    }

    public BigDecimal maximum() {
        return maximum;
    }

    public boolean exclusiveMaximum() {
        return exclusiveMaximum;
    }

    public String pattern() {
        return pattern;
    }

    public List<Object> enumValues() {
        return enumValues;
    }

    private static Integer higher(Integer current, Integer proposed) {
        if (proposed == null) {
            return current;
        }
        return current == null ? proposed : Math.max(current, proposed);
    }

    private static Integer lower(Integer current, Integer proposed) {
        if (proposed == null) {
            return current;
        }
        return current == null ? proposed : Math.min(current, proposed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstraintSet that)) return false;
        return required == that.required
                && notNullable == that.notNullable
                && exclusiveMinimum == that.exclusiveMinimum
                && exclusiveMaximum == that.exclusiveMaximum
                && Objects.equals(minLength, that.minLength)
                && Objects.equals(maxLength, that.maxLength)
                && Objects.equals(minItems, that.minItems)
                && Objects.equals(maxItems, that.maxItems)
                && compareDecimals(minimum, that.minimum)
                && compareDecimals(maximum, that.maximum)
                && Objects.equals(pattern, that.pattern)
                && Objects.equals(enumValues, that.enumValues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                required,
                notNullable,
                minLength,
                maxLength,
                minItems,
                maxItems,
                minimum == null ? null : minimum.stripTrailingZeros(),
                exclusiveMinimum,
                maximum == null ? null : maximum.stripTrailingZeros(),
                exclusiveMaximum,
                pattern,
                enumValues);
    }

    private static boolean compareDecimals(BigDecimal a, BigDecimal b) {
        return a == null ? b == null : b != null && a.compareTo(b) == 0;
    }

    @Override
    public String toString() {
        return "ConstraintSet{required=" + required
                + ", notNullable=" + notNullable
                + ", minLength=" + minLength
                + ", maxLength=" + maxLength
                + ", minItems=" + minItems
                + ", maxItems=" + maxItems
                + ", minimum=" + minimum
                + ", exclusiveMinimum=" + exclusiveMinimum
                + ", maximum=" + maximum
                + ", exclusiveMaximum=" + exclusiveMaximum
                + ", pattern=" + pattern
                + ", enumValues=" + enumValues
                + '}';
    }
}
