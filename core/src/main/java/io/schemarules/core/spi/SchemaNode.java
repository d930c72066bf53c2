package io.schemarules.core.spi;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Handle to the settable constraint fields of one schema object, independent of the host's
 * schema model.
 *
 * <p>The hierarchy is sealed: a node is either a {@link MutableSchemaNode} backed by a concrete
 * schema object, or the {@link EmptySchemaNode} returned when the schema cannot be reached (for
 * example a property that is only a reference to an enum or nested type). Reads on the empty node
 * return {@code null}; writes are discarded.
 */
public sealed interface SchemaNode permits MutableSchemaNode, EmptySchemaNode {

    /** Returns the shared empty node. */
    static SchemaNode empty() {
        return EmptySchemaNode.INSTANCE;
    }

    /** {@code true} for the empty node. */
    boolean isEmpty();

    /** JSON schema type ({@code string}, {@code integer}, {@code array}, ...), if declared. */
    Optional<String> type();

    /** Property keys declared by this (object) schema, in declaration order. */
    Set<String> propertyNames();

    /** Property keys listed as required. */
    Set<String> getRequired();

    void addRequired(String propertyKey);

    Boolean getNullable();

    void setNullable(Boolean nullable);

    Integer getMinLength();

    void setMinLength(Integer minLength);

    Integer getMaxLength();

    void setMaxLength(Integer maxLength);

    Integer getMinItems();

    void setMinItems(Integer minItems);

    Integer getMaxItems();

    void setMaxItems(Integer maxItems);

    BigDecimal getMinimum();

    void setMinimum(BigDecimal minimum);

    Boolean getExclusiveMinimum();

    void setExclusiveMinimum(Boolean exclusiveMinimum);

    BigDecimal getMaximum();

    void setMaximum(BigDecimal maximum);

    Boolean getExclusiveMaximum();

    void setExclusiveMaximum(Boolean exclusiveMaximum);

    String getPattern();

    void setPattern(String pattern);

    List<Object> getEnumValues();

    void setEnumValues(List<Object> enumValues);
}
