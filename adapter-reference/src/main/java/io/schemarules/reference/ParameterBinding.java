package io.schemarules.reference;

import java.util.Objects;

/**
 * Records that the host expanded a property of a parameter-grouping container type into an
 * operation parameter.
 *
 * @param parameterName the emitted parameter's {@code name}
 * @param containerType the grouping type
 * @param propertyName the container property the parameter came from
 */
public record ParameterBinding(String parameterName, Class<?> containerType, String propertyName) {

    public ParameterBinding {
        Objects.requireNonNull(parameterName, "parameterName must not be null");
        Objects.requireNonNull(containerType, "containerType must not be null");
        Objects.requireNonNull(propertyName, "propertyName must not be null");
    }

    /** Binding whose parameter carries the property's own name. */
    public static ParameterBinding of(Class<?> containerType, String propertyName) {
        return new ParameterBinding(propertyName, containerType, propertyName);
    }
}
