package io.schemarules.reference;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Per-type hook of {@link ReferenceSchemaGenerator}: runs once on every object schema the generator
 * registers in the {@link ComponentRepository}.
 */
@FunctionalInterface
public interface SchemaFilter {

    void apply(ObjectNode schema, SchemaFilterContext context);
}
