package io.schemarules.reference;

/**
 * What a {@link SchemaFilter} sees besides the schema itself.
 *
 * @param type the type the schema was generated for
 * @param generator the running generator, for fetching further schemas
 * @param repository the repository being filled
 */
public record SchemaFilterContext(Class<?> type, ReferenceSchemaGenerator generator, ComponentRepository repository) {}
