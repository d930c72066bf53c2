package io.schemarules.tree;

import io.schemarules.core.spi.MutableSchemaNode;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/** {@link MutableSchemaNode} over a {@link JsonSchema}. */
public final class TreeSchemaNode implements MutableSchemaNode {

    private final JsonSchema schema;

    public TreeSchemaNode(JsonSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
    }

    public JsonSchema schema() {
        return schema;
    }

    @Override
    public Optional<String> type() {
        return Optional.ofNullable(schema.getType());
    }

    @Override
    public Set<String> propertyNames() {
        return schema.getProperties().keySet();
    }

    @Override
    public Set<String> getRequired() {
        return schema.getRequired();
    }

    @Override
    public void addRequired(String propertyKey) {
        schema.getRequired().add(propertyKey);
    }

    @Override
    public Boolean getNullable() {
        return schema.getNullable();
    }

    @Override
    public void setNullable(Boolean nullable) {
        schema.setNullable(nullable);
    }

    @Override
    public Integer getMinLength() {
        return schema.getMinLength();
    }

    @Override
    public void setMinLength(Integer minLength) {
        schema.setMinLength(minLength);
    }

    @Override
    public Integer getMaxLength() {
        return schema.getMaxLength();
    }

    @Override
    public void setMaxLength(Integer maxLength) {
        schema.setMaxLength(maxLength);
    }

    @Override
    public Integer getMinItems() {
        return schema.getMinItems();
    }

    @Override
    public void setMinItems(Integer minItems) {
        schema.setMinItems(minItems);
    }

    @Override
    public Integer getMaxItems() {
        return schema.getMaxItems();
    }

    @Override
    public void setMaxItems(Integer maxItems) {
        schema.setMaxItems(maxItems);
    }

    @Override
    public BigDecimal getMinimum() {
        return schema.getMinimum();
    }

    @Override
    public void setMinimum(BigDecimal minimum) {
        schema.setMinimum(minimum);
    }

    @Override
    public Boolean getExclusiveMinimum() {
        return schema.getExclusiveMinimum();
    }

    @Override
    public void setExclusiveMinimum(Boolean exclusiveMinimum) {
        schema.setExclusiveMinimum(exclusiveMinimum);
    }

    @Override
    public BigDecimal getMaximum() {
        return schema.getMaximum();
    }

    @Override
    public void setMaximum(BigDecimal maximum) {
        schema.setMaximum(maximum);
    }

    @Override
    public Boolean getExclusiveMaximum() {
        return schema.getExclusiveMaximum();
    }

    @Override
    public void setExclusiveMaximum(Boolean exclusiveMaximum) {
        schema.setExclusiveMaximum(exclusiveMaximum);
    }

    @Override
    public String getPattern() {
        return schema.getPattern();
    }

    @Override
    public void setPattern(String pattern) {
        schema.setPattern(pattern);
    }

    @Override
    public List<Object> getEnumValues() {
        return schema.getEnumeration();
    }

    @Override
    public void setEnumValues(List<Object> enumValues) {
        schema.setEnumeration(enumValues);
    }
}
