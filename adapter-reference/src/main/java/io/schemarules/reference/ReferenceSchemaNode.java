package io.schemarules.reference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemarules.core.spi.MutableSchemaNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link MutableSchemaNode} over an OpenAPI 3.0 schema object held as a Jackson {@link ObjectNode}.
 * Exclusive bounds use the 3.0 boolean form; a {@code null} write removes the keyword.
 */
public final class ReferenceSchemaNode implements MutableSchemaNode {

    private final ObjectNode json;

    public ReferenceSchemaNode(ObjectNode json) {
        this.json = Objects.requireNonNull(json, "json must not be null");
    }

    public ObjectNode json() {
        return json;
    }

    @Override
    public Optional<String> type() {
        JsonNode type = json.get("type");
        return type != null && type.isTextual() ? Optional.of(type.asText()) : Optional.empty();
    }

    @Override
    public Set<String> propertyNames() {
        Set<String> names = new LinkedHashSet<>();
        JsonNode properties = json.get("properties");
        if (properties != null && properties.isObject()) {
            properties.fieldNames().forEachRemaining(names::add);
        }
        return names;
    }

    @Override
    public Set<String> getRequired() {
        Set<String> required = new LinkedHashSet<>();
        JsonNode array = json.get("required");
        if (array != null && array.isArray()) {
            array.forEach(item -> required.add(item.asText()));
        }
        return required;
    }

    @Override
    public void addRequired(String propertyKey) {
        if (getRequired().contains(propertyKey)) {
            return;
        }
        JsonNode existing = json.get("required");
        ArrayNode array = existing != null && existing.isArray() ? (ArrayNode) existing : json.putArray("required");
        array.add(propertyKey);
    }

    @Override
    public Boolean getNullable() {
        return bool("nullable");
    }

    @Override
    public void setNullable(Boolean nullable) {
        putBool("nullable", nullable);
    }

    @Override
    public Integer getMinLength() {
        return integer("minLength");
    }

    @Override
    public void setMinLength(Integer minLength) {
        putInt("minLength", minLength);
    }

    @Override
    public Integer getMaxLength() {
        return integer("maxLength");
    }

    @Override
    public void setMaxLength(Integer maxLength) {
        putInt("maxLength", maxLength);
    }

    @Override
    public Integer getMinItems() {
        return integer("minItems");
    }

    @Override
    public void setMinItems(Integer minItems) {
        putInt("minItems", minItems);
    }

    @Override
    public Integer getMaxItems() {
        return integer("maxItems");
    }

    @Override
    public void setMaxItems(Integer maxItems) {
        putInt("maxItems", maxItems);
    }

    @Override
    public BigDecimal getMinimum() {
        return decimal("minimum");
    }

    @Override
    public void setMinimum(BigDecimal minimum) {
        putDecimal("minimum", minimum);
    }

    @Override
    public Boolean getExclusiveMinimum() {
        return bool("exclusiveMinimum");
    }

    @Override
    public void setExclusiveMinimum(Boolean exclusiveMinimum) {
        putBool("exclusiveMinimum", exclusiveMinimum);
    }

    @Override
    public BigDecimal getMaximum() {
        return decimal("maximum");
    }

    @Override
    public void setMaximum(BigDecimal maximum) {
        putDecimal("maximum", maximum);
    }

    @Override
    public Boolean getExclusiveMaximum() {
        return bool("exclusiveMaximum");
    }

    @Override
    public void setExclusiveMaximum(Boolean exclusiveMaximum) {
        putBool("exclusiveMaximum", exclusiveMaximum);
    }

    @Override
    public String getPattern() {
        JsonNode pattern = json.get("pattern");
        return pattern != null && pattern.isTextual() ? pattern.asText() : null;
    }

    @Override
    public void setPattern(String pattern) {
        if (pattern == null) {
            json.remove("pattern");
        } else {
            json.put("pattern", pattern);
        }
    }

    @Override
    public List<Object> getEnumValues() {
        JsonNode array = json.get("enum");
        if (array == null || !array.isArray()) {
            return null;
        }
        List<Object> values = new ArrayList<>();
        for (JsonNode item : array) {
            if (item.isNull()) {
                values.add(null);
            } else if (item.isNumber()) {
                values.add(item.decimalValue());
            } else if (item.isBoolean()) {
                values.add(item.booleanValue());
            } else {
                values.add(item.asText());
            }
        }
        return values;
    }

    @Override
    public void setEnumValues(List<Object> enumValues) {
        if (enumValues == null) {
            json.remove("enum");
            return;
        }
        ArrayNode array = json.putArray("enum");
        for (Object value : enumValues) {
            if (value == null) {
                array.addNull();
            } else if (value instanceof BigDecimal d) {
                array.add(d);
            } else if (value instanceof BigInteger i) {
                array.add(i);
            } else if (value instanceof Integer || value instanceof Long || value instanceof Short) {
                array.add(((Number) value).longValue());
            } else if (value instanceof Number n) {
                array.add(n.doubleValue());
            } else if (value instanceof Boolean b) {
                array.add(b);
            } else {
                array.add(String.valueOf(value));
            }
        }
    }

    private Boolean bool(String field) {
        JsonNode value = json.get(field);
        return value != null && value.isBoolean() ? value.booleanValue() : null;
    }

    private Integer integer(String field) {
        JsonNode value = json.get(field);
        return value != null && value.canConvertToInt() && value.isIntegralNumber() ? value.intValue() : null;
    }

    private BigDecimal decimal(String field) {
        JsonNode value = json.get(field);
        return value != null && value.isNumber() ? value.decimalValue() : null;
    }

    private void putBool(String field, Boolean value) {
        if (value == null) {
            json.remove(field);
        } else {
            json.put(field, value);
        }
    }

    private void putInt(String field, Integer value) {
        if (value == null) {
            json.remove(field);
        } else {
            json.put(field, value);
        }
    }

    private void putDecimal(String field, BigDecimal value) {
        if (value == null) {
            json.remove(field);
        } else if (value.signum() == 0 || value.stripTrailingZeros().scale() <= 0) {
            // integral bounds are written without a fraction or exponent
            json.put(field, value.toBigIntegerExact());
        } else {
            json.put(field, value.stripTrailingZeros());
        }
    }

    @Override
    public String toString() {
        return json.toString();
    }
}
