package io.schemarules.tree;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed, mutable JSON schema object. Nested schemas are either held inline or, for a reference
 * schema, point at another {@code JsonSchema} instance registered in a {@link SchemaResolver}.
 *
 * <p>Serializes to draft-04 style JSON (boolean exclusive bounds, {@code #/definitions/} refs).
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"$ref", "type", "format", "nullable", "properties", "required", "items"})
public final class JsonSchema {

    private String type;
    private String format;
    private Boolean nullable;
    private final Map<String, JsonSchema> properties = new LinkedHashMap<>();
    private final Set<String> required = new LinkedHashSet<>();
    private JsonSchema items;
    private JsonSchema additionalProperties;
    private Integer minLength;
    private Integer maxLength;
    private Integer minItems;
    private Integer maxItems;
    private BigDecimal minimum;
    private Boolean exclusiveMinimum;
    private BigDecimal maximum;
    private Boolean exclusiveMaximum;
    private String pattern;
    private List<Object> enumeration;

    @JsonIgnore
    private JsonSchema reference;

    @JsonIgnore
    private String definitionId;

    public static JsonSchema ofType(String type) {
        JsonSchema schema = new JsonSchema();
        schema.type = type;
        return schema;
    }

    /** A schema that only points at {@code target}. */
    public static JsonSchema referenceTo(JsonSchema target) {
        JsonSchema schema = new JsonSchema();
        schema.reference = target;
        return schema;
    }

    /** The referenced schema, or {@code null} for an inline schema. */
    @JsonIgnore
    public JsonSchema getReference() {
        return reference;
    }

    @JsonIgnore
    public boolean hasReference() {
        return reference != null;
    }

    /** Follows references to the schema that carries the content. */
    @JsonIgnore
    public JsonSchema actualSchema() {
        JsonSchema current = this;
        Set<JsonSchema> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        while (current.reference != null && seen.add(current)) {
            current = current.reference;
        }
        return current;
    }

    @JsonProperty("$ref")
    public String getRef() {
        if (reference == null) {
            return null;
        }
        return reference.definitionId != null ? "#/definitions/" + reference.definitionId : null;
    }

    @JsonIgnore
    String getDefinitionId() {
        return definitionId;
    }

    void setDefinitionId(String definitionId) {
        this.definitionId = definitionId;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public Boolean getNullable() {
        return nullable;
    }

    public void setNullable(Boolean nullable) {
        this.nullable = nullable;
    }

    public Map<String, JsonSchema> getProperties() {
        return properties;
    }

    public Set<String> getRequired() {
        return required;
    }

    public JsonSchema getItems() {
        return items;
    }

    public void setItems(JsonSchema items) {
        this.items = items;
    }

    public JsonSchema getAdditionalProperties() {
        return additionalProperties;
    }

    public void setAdditionalProperties(JsonSchema additionalProperties) {
        this.additionalProperties = additionalProperties;
    }

    public Integer getMinLength() {
        return minLength;
    }

    public void setMinLength(Integer minLength) {
        this.minLength = minLength;
    }

    public Integer getMaxLength() {
        return maxLength;
    }

    public void setMaxLength(Integer maxLength) {
        this.maxLength = maxLength;
    }

    public Integer getMinItems() {
        return minItems;
    }

    public void setMinItems(Integer minItems) {
        this.minItems = minItems;
    }

    public Integer getMaxItems() {
        return maxItems;
    }

    public void setMaxItems(Integer maxItems) {
        this.maxItems = maxItems;
    }

    public BigDecimal getMinimum() {
        return minimum;
    }

    public void setMinimum(BigDecimal minimum) {
        this.minimum = minimum;
    }

    public Boolean getExclusiveMinimum() {
        return exclusiveMinimum;
    }

    public void setExclusiveMinimum(Boolean exclusiveMinimum) {
        this.exclusiveMinimum = exclusiveMinimum;
    }

    public BigDecimal getMaximum() {
        return maximum;
    }

    public void setMaximum(BigDecimal maximum) {
        this.maximum = maximum;
    }

    public Boolean getExclusiveMaximum() {
        return exclusiveMaximum;
    }

    public void setExclusiveMaximum(Boolean exclusiveMaximum) {
        this.exclusiveMaximum = exclusiveMaximum;
    }

    public String getPattern() {
        return pattern;
    }

    public void setPattern(String pattern) {
        this.pattern = pattern;
    }

    @JsonProperty("enum")
    public List<Object> getEnumeration() {
        return enumeration;
    }

    public void setEnumeration(List<Object> enumeration) {
        this.enumeration = enumeration;
    }
}
