package io.schemarules.tree;

import java.util.Objects;

/**
 * One operation parameter of the tree model. A parameter expanded from a property of a
 * parameter-grouping type records that type and property.
 */
public final class TreeParameter {

    /** Where the parameter is carried. */
    public enum Location {
        QUERY,
        PATH,
        HEADER,
        COOKIE
    }

    private final String name;
    private final Location location;
    private final JsonSchema schema;
    private final Class<?> containerType;
    private final String propertyName;
    private boolean required;

    private TreeParameter(
            String name, Location location, JsonSchema schema, Class<?> containerType, String propertyName) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.location = Objects.requireNonNull(location, "location must not be null");
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.containerType = containerType;
        this.propertyName = propertyName;
    }

    /** A parameter bound directly to a method argument. */
    public static TreeParameter direct(String name, Location location, JsonSchema schema) {
        return new TreeParameter(name, location, schema, null, null);
    }

    /** A parameter expanded from {@code propertyName} of {@code containerType}. */
    public static TreeParameter expanded(
            String name, Location location, JsonSchema schema, Class<?> containerType, String propertyName) {
        Objects.requireNonNull(containerType, "containerType must not be null");
        Objects.requireNonNull(propertyName, "propertyName must not be null");
        return new TreeParameter(name, location, schema, containerType, propertyName);
    }

    public String name() {
        return name;
    }

    public Location location() {
        return location;
    }

    public JsonSchema schema() {
        return schema;
    }

    /** {@code null} for a directly bound parameter. */
    public Class<?> containerType() {
        return containerType;
    }

    public String propertyName() {
        return propertyName != null ? propertyName : name;
    }

    public boolean isRequired() {
        return required;
    }

    public void setRequired(boolean required) {
        this.required = required;
    }
}
