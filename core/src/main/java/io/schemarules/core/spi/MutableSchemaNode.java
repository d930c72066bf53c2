package io.schemarules.core.spi;

/**
 * A {@link SchemaNode} backed by a concrete, writable schema object. Implemented by the host
 * adapters.
 */
public non-sealed interface MutableSchemaNode extends SchemaNode {

    @Override
    default boolean isEmpty() {
        return false;
    }
}
