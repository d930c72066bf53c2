package io.schemarules.core.spi;

import java.util.Collection;

/**
 * Uniform view of one type's schema, regardless of whether the host stores nested schemas by
 * reference or inline.
 */
public interface SchemaContext extends SchemaProvider {

    /** The type this schema describes. */
    Class<?> schemaType();

    /** The type's own schema node. */
    SchemaNode schema();

    /** Property keys declared by the schema. */
    default Collection<String> propertyNames() {
        return schema().propertyNames();
    }

    /**
     * Returns the node for the named property. Never throws: a property that is missing, is a pure
     * reference, or has a shape the adapter cannot write to yields {@link SchemaNode#empty()}.
     *
     * @param propertyKey schema property key (already passed through the name resolver)
     */
    SchemaNode getPropertyNode(String propertyKey);
}
