package io.schemarules.core.registry;

import io.schemarules.core.model.Validator;
import java.util.List;
import java.util.Optional;

/** Looks up the validators that describe a type. */
public interface ValidatorRegistry {

    /**
     * Returns the validators applicable to {@code type}: unkeyed registrations first, then keyed
     * registrations, each in registration order. When the registry is configured with one
     * validator per type, at most the first of these is returned.
     *
     * @param type the validated type
     * @return the validators, empty if none is registered
     */
    List<Validator> getValidators(Class<?> type);

    /** Returns the first of {@link #getValidators(Class)}, if any. */
    default Optional<Validator> getValidator(Class<?> type) {
        List<Validator> validators = getValidators(type);
        return validators.isEmpty() ? Optional.empty() : Optional.of(validators.get(0));
    }
}
