package io.schemarules.core.spi;

/** Fetch-or-create access to type schemas in the host's {@link SchemaStore}. */
public interface SchemaProvider {

    /**
     * Returns the schema context for {@code type}. If the store has no schema for it yet, the host
     * generator creates one and registers it in the store as a side effect.
     *
     * @param type the type to describe
     * @return a context rooted at the type's schema, never null
     */
    SchemaContext getSchemaForType(Class<?> type);
}
