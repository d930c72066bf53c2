package io.schemarules.core.engine;

import io.schemarules.core.spi.SchemaNode;
import java.util.Optional;

/**
 * One emitted parameter of an API operation, as seen by {@link OperationAugmenter}. Adapters wrap
 * their host's parameter objects in this view.
 */
public interface OperationParameter {

    /** Parameter name as emitted. */
    String name();

    /**
     * The type whose property the host expanded into this parameter (a parameter-grouping container
     * type), or empty for a parameter bound directly.
     */
    Optional<Class<?>> containerType();

    /** Property of the container type this parameter was expanded from. */
    String propertyName();

    /** The parameter's own schema. */
    SchemaNode schema();

    boolean isRequired();

    void markRequired();
}
