package io.schemarules.core.spi;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** No-op node for schemas that cannot be reached. Obtain it through {@link SchemaNode#empty()}. */
public final class EmptySchemaNode implements SchemaNode {

    static final EmptySchemaNode INSTANCE = new EmptySchemaNode();

    private EmptySchemaNode() {}

    @Override
    public boolean isEmpty() {
        return true;
    }

    @Override
    public Optional<String> type() {
        return Optional.empty();
    }

    @Override
    public Set<String> propertyNames() {
        return Set.of();
    }

    @Override
    public Set<String> getRequired() {
        return Set.of();
    }

    @Override
    public void addRequired(String propertyKey) {}

    @Override
    public Boolean getNullable() {
        return null;
    }

    @Override
    public void setNullable(Boolean nullable) {}

    @Override
    public Integer getMinLength() {
        return null;
    }

    @Override
    public void setMinLength(Integer minLength) {}

    @Override
    public Integer getMaxLength() {
        return null;
    }

    @Override
    public void setMaxLength(Integer maxLength) {}

    @Override
    public Integer getMinItems() {
        return null;
    }

    @Override
    public void setMinItems(Integer minItems) {}

    @Override
    public Integer getMaxItems() {
        return null;
    }

    @Override
    public void setMaxItems(Integer maxItems) {}

    @Override
    public BigDecimal getMinimum() {
        return null;
    }

    @Override
    public void setMinimum(BigDecimal minimum) {}

    @Override
    public Boolean getExclusiveMinimum() {
        return null;
    }

    @Override
    public void setExclusiveMinimum(Boolean exclusiveMinimum) {}

    @Override
    public BigDecimal getMaximum() {
        return null;
    }

    @Override
    public void setMaximum(BigDecimal maximum) {}

    @Override
    public Boolean getExclusiveMaximum() {
        return null;
    }

    @Override
    public void setExclusiveMaximum(Boolean exclusiveMaximum) {}

    @Override
    public String getPattern() {
        return null;
    }

    @Override
    public void setPattern(String pattern) {}

    @Override
    public List<Object> getEnumValues() {
        return null;
    }

    @Override
    public void setEnumValues(List<Object> enumValues) {}

    @Override
    public String toString() {
        return "EmptySchemaNode";
    }
}
