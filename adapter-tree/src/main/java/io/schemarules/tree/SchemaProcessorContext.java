package io.schemarules.tree;

/**
 * @param type the type the schema was generated for
 * @param schema the generated object schema
 * @param resolver the document's definitions
 * @param generator the running generator
 */
public record SchemaProcessorContext(
        Class<?> type, JsonSchema schema, SchemaResolver resolver, TreeSchemaGenerator generator) {}
