package io.schemarules.reference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemarules.core.spi.SchemaContext;
import io.schemarules.core.spi.SchemaNode;
import java.util.Objects;

/**
 * {@link SchemaContext} over a schema of the reference model. Properties that are {@code $ref}s
 * (enums, nested beans) are listed but yield {@link SchemaNode#empty()}: constraints never leak
 * into the shared component they point at.
 */
public final class ReferenceSchemaContext implements SchemaContext {

    private final Class<?> schemaType;
    private final ObjectNode schema;
    private final ReferenceSchemaProvider provider;

    public ReferenceSchemaContext(Class<?> schemaType, ObjectNode schema, ReferenceSchemaProvider provider) {
        this.schemaType = Objects.requireNonNull(schemaType, "schemaType must not be null");
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
    }

    @Override
    public Class<?> schemaType() {
        return schemaType;
    }

    @Override
    public SchemaNode schema() {
        return new ReferenceSchemaNode(schema);
    }

    @Override
    public SchemaNode getPropertyNode(String propertyKey) {
        JsonNode property = schema.path("properties").get(propertyKey);
        if (property == null || !property.isObject() || property.has("$ref")) {
            return SchemaNode.empty();
        }
        return new ReferenceSchemaNode((ObjectNode) property);
    }

    @Override
    public SchemaContext getSchemaForType(Class<?> type) {
        return provider.getSchemaForType(type);
    }
}
