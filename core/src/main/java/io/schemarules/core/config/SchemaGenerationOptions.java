package io.schemarules.core.config;

import java.util.Objects;
import java.util.function.Function;

/**
 * Options shared by the registry, the per-type hook and the per-operation hook.
 *
 * @param oneValidatorPerType when {@code true} (default) only the first validator found for a type
 *     contributes rules
 * @param nameResolver maps validator property names to schema property keys (default identity)
 * @param schemaIdSelector identifier under which a type's schema is stored (default {@link
 *     Class#getSimpleName()})
 */
public record SchemaGenerationOptions(
        boolean oneValidatorPerType, NameResolver nameResolver, Function<Class<?>, String> schemaIdSelector) {

    /** Default selector: the simple class name. */
    public static final Function<Class<?>, String> SIMPLE_NAME = Class::getSimpleName;

    public SchemaGenerationOptions {
        Objects.requireNonNull(nameResolver, "nameResolver must not be null");
        Objects.requireNonNull(schemaIdSelector, "schemaIdSelector must not be null");
    }

    /** Options with every default applied. */
    public static SchemaGenerationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Schema id for {@code type} under the configured selector. */
    public String schemaId(Class<?> type) {
        return schemaIdSelector.apply(type);
    }

    /** Builder for {@link SchemaGenerationOptions}. */
    public static final class Builder {

        private boolean oneValidatorPerType = true;
        private NameResolver nameResolver = NameResolver.identity();
        private Function<Class<?>, String> schemaIdSelector = SIMPLE_NAME;

        Builder() {}

        public Builder oneValidatorPerType(boolean oneValidatorPerType) {
            this.oneValidatorPerType = oneValidatorPerType;
            return this;
        }

        public Builder nameResolver(NameResolver nameResolver) {
            this.nameResolver = nameResolver;
            return this;
        }

        public Builder schemaIdSelector(Function<Class<?>, String> schemaIdSelector) {
            this.schemaIdSelector = schemaIdSelector;
            return this;
        }

        public SchemaGenerationOptions build() {
            return new SchemaGenerationOptions(oneValidatorPerType, nameResolver, schemaIdSelector);
        }
    }
}
