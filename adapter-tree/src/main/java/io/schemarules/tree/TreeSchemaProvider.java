package io.schemarules.tree;

import io.schemarules.core.spi.SchemaProvider;
import java.util.Objects;

/**
 * Fetch-or-create access to definitions. A type without a definition is generated and registered
 * in the resolver as a side effect.
 */
public final class TreeSchemaProvider implements SchemaProvider {

    private final TreeSchemaGenerator generator;
    private final SchemaResolver resolver;

    public TreeSchemaProvider(TreeSchemaGenerator generator, SchemaResolver resolver) {
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    @Override
    public TreeSchemaContext getSchemaForType(Class<?> type) {
        return new TreeSchemaContext(type, generator.resolveDefinition(type, resolver), this);
    }
}
