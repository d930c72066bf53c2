package io.schemarules.core.config;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import java.util.Locale;
import java.util.Objects;

/**
 * Maps a validator's property name to the key the host generator used for that property in the
 * schema. Must match the naming convention of the host's serializer.
 */
@FunctionalInterface
public interface NameResolver {

    String resolve(String propertyName);

    /** Keeps names as declared. */
    static NameResolver identity() {
        return name -> name;
    }

    /** Adapts a Jackson naming strategy, e.g. {@link PropertyNamingStrategies.SnakeCaseStrategy}. */
    static NameResolver of(PropertyNamingStrategies.NamingBase strategy) {
        Objects.requireNonNull(strategy, "strategy must not be null");
        return strategy::translate;
    }

    /**
     * Resolves a resolver by configuration name: {@code identity}, {@code camel}, {@code snake},
     * {@code kebab}, {@code lower} or {@code upper-camel}.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    static NameResolver named(String name) {
        String normalized = name == null ? "identity" : name.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "identity", "" -> identity();
            case "camel" -> of((PropertyNamingStrategies.NamingBase) PropertyNamingStrategies.LOWER_CAMEL_CASE);
            case "upper-camel" -> of((PropertyNamingStrategies.NamingBase) PropertyNamingStrategies.UPPER_CAMEL_CASE);
            case "snake" -> of((PropertyNamingStrategies.NamingBase) PropertyNamingStrategies.SNAKE_CASE);
            case "kebab" -> of((PropertyNamingStrategies.NamingBase) PropertyNamingStrategies.KEBAB_CASE);
            case "lower" -> of((PropertyNamingStrategies.NamingBase) PropertyNamingStrategies.LOWER_CASE);
            default -> throw new IllegalArgumentException("Unknown naming convention: '" + name
                    + "'; expected one of: identity, camel, upper-camel, snake, kebab, lower");
        };
    }
}
