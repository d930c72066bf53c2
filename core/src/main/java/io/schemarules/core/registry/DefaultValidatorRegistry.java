package io.schemarules.core.registry;

import io.schemarules.core.config.SchemaGenerationOptions;
import io.schemarules.core.model.Validator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Explicit validator registry, populated at startup and keyed by the validated type.
 *
 * <p>Registrations are either unkeyed or carry a key (several validators for one type, selected by
 * name elsewhere). Lookups always see unkeyed validators before keyed ones. Safe to read from
 * several threads once populated.
 */
public final class DefaultValidatorRegistry implements ValidatorRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultValidatorRegistry.class);

    private final SchemaGenerationOptions options;
    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    public DefaultValidatorRegistry() {
        this(SchemaGenerationOptions.defaults());
    }

    public DefaultValidatorRegistry(SchemaGenerationOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /** Creates a registry pre-populated with unkeyed validators. */
    public static DefaultValidatorRegistry of(SchemaGenerationOptions options, Validator... validators) {
        DefaultValidatorRegistry registry = new DefaultValidatorRegistry(options);
        for (Validator validator : validators) {
            registry.register(validator);
        }
        return registry;
    }

    /**
     * Registers an unkeyed validator.
     *
     * @throws NullPointerException if validator or its validated type is null
     */
    public DefaultValidatorRegistry register(Validator validator) {
        add(null, validator);
        return this;
    }

    /**
     * Registers a validator under {@code key}.
     *
     * @throws NullPointerException if validator or its validated type is null
     * @throws IllegalArgumentException if key is null or blank
     */
    public DefaultValidatorRegistry register(String key, Validator validator) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("validator key must not be null or blank");
        }
        add(key, validator);
        return this;
    }

    @Override
    public List<Validator> getValidators(Class<?> type) {
        if (type == null) {
            return List.of();
        }
        Stream<Validator> ordered = Stream.concat(
                registrations.stream().filter(r -> !r.keyed() && r.type().equals(type)),
                registrations.stream().filter(r -> r.keyed() && r.type().equals(type)))
                .map(Registration::validator);
        List<Validator> found = options.oneValidatorPerType() ? ordered.limit(1).toList() : ordered.toList();
        if (found.isEmpty()) {
            LOG.trace("No validator registered for type={}", type.getName());
        }
        return found;
    }

    /** Number of registrations (keyed and unkeyed). */
    public int size() {
        return registrations.size();
    }

    /** Types with at least one registration, in first-registration order. */
    public List<Class<?>> registeredTypes() {
        List<Class<?>> types = new ArrayList<>();
        for (Registration registration : registrations) {
            if (!types.contains(registration.type())) {
                types.add(registration.type());
            }
        }
        return types;
    }

    private void add(String key, Validator validator) {
        if (validator == null) {
            throw new NullPointerException("validator must not be null");
        }
        Class<?> type = Objects.requireNonNull(validator.validatedType(), "validator.validatedType() must not be null");
        registrations.add(new Registration(key, type, validator));
        LOG.debug("Registered validator={} type={} key={}", validator, type.getName(), key != null ? key : "none");
    }

    private record Registration(String key, Class<?> type, Validator validator) {
        boolean keyed() {
            return key != null;
        }
    }
}
