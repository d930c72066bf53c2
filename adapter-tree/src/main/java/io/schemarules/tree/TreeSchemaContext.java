package io.schemarules.tree;

import io.schemarules.core.spi.SchemaContext;
import io.schemarules.core.spi.SchemaNode;
import java.util.Objects;

/**
 * {@link SchemaContext} over a {@link JsonSchema}. Inline nested schemas are writable; properties
 * that only reference a definition yield {@link SchemaNode#empty()}.
 */
public final class TreeSchemaContext implements SchemaContext {

    private final Class<?> schemaType;
    private final JsonSchema schema;
    private final TreeSchemaProvider provider;

    public TreeSchemaContext(Class<?> schemaType, JsonSchema schema, TreeSchemaProvider provider) {
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
        return new TreeSchemaNode(schema);
    }

    @Override
    public SchemaNode getPropertyNode(String propertyKey) {
        JsonSchema property = schema.getProperties().get(propertyKey);
        if (property == null || property.hasReference()) {
            return SchemaNode.empty();
        }
        return new TreeSchemaNode(property);
    }

    @Override
    public SchemaContext getSchemaForType(Class<?> type) {
        return provider.getSchemaForType(type);
    }
}
