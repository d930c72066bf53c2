package io.schemarules.core.engine;

import io.schemarules.core.config.SchemaGenerationOptions;
import io.schemarules.core.materialization.MaterializationGuard;
import io.schemarules.core.model.ConstraintSet;
import io.schemarules.core.model.RuleChain;
import io.schemarules.core.model.Validator;
import io.schemarules.core.registry.ValidatorRegistry;
import io.schemarules.core.spi.SchemaContext;
import io.schemarules.core.spi.SchemaNode;
import io.schemarules.core.spi.SchemaProvider;
import io.schemarules.core.spi.SchemaStore;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-operation hook: carries container-type rules over to the flat parameters the host expanded
 * the container into.
 *
 * <p>For each parameter bound to a container property, the container's schema is fetched (and
 * materialized if missing) through the {@link SchemaProvider}. The property's constraints are
 * merged with the parameter's own rule chains and written onto the parameter schema. The parameter
 * is required when a rule or the container's required list says so.
 *
 * <p>The pass runs inside a {@link MaterializationGuard}: container schemas created only to answer
 * these lookups are removed afterwards unless the operation's final output references them.
 */
public final class OperationAugmenter {

    private static final Logger LOG = LoggerFactory.getLogger(OperationAugmenter.class);

    private final ValidatorRegistry registry;
    private final SchemaGenerationOptions options;
    private final ConstraintMapper mapper;

    public OperationAugmenter(ValidatorRegistry registry, SchemaGenerationOptions options) {
        this(registry, options, new ConstraintMapper());
    }

    public OperationAugmenter(ValidatorRegistry registry, SchemaGenerationOptions options, ConstraintMapper mapper) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * Applies container rules to {@code parameters} and cleans up schemas materialized on the way.
     *
     * @param parameters the operation's emitted parameters
     * @param provider fetch-or-create access to type schemas
     * @param store the store {@code provider} writes to
     * @param emittedRoots evaluated after the pass; schema ids the operation's final parameters and
     *     body reference
     * @return ids removed by the cleanup
     */
    public Set<String> augment(
            List<? extends OperationParameter> parameters,
            SchemaProvider provider,
            SchemaStore store,
            Supplier<Set<String>> emittedRoots) {
        MaterializationGuard guard = new MaterializationGuard(store);
        Set<String> removed = guard.run(() -> parameters.forEach(p -> augmentParameter(p, provider)), emittedRoots);
        if (!removed.isEmpty()) {
            LOG.debug("operation.cleanup removed={}", removed);
        }
        return removed;
    }

    private void augmentParameter(OperationParameter parameter, SchemaProvider provider) {
        Class<?> container = parameter.containerType().orElse(null);
        if (container == null) {
            return;
        }
        List<Validator> validators = registry.getValidators(container);
        if (validators.isEmpty()) {
            return;
        }

        String key = options.nameResolver().resolve(parameter.propertyName());
        SchemaContext containerContext = provider.getSchemaForType(container);
        SchemaNode source = containerContext.getPropertyNode(key);

        // container schemas may have been generated without the rule hook
        ConstraintSet constraints = source.isEmpty() ? new ConstraintSet() : ConstraintSet.readFrom(source);
        SchemaNode typeNode = parameter.schema().isEmpty() ? source : parameter.schema();
        for (Validator validator : validators) {
            for (RuleChain chain : validator.ruleChains()) {
                if (chain.propertyName().equals(parameter.propertyName())) {
                    mapper.mapInto(constraints, chain, typeNode);
                }
            }
        }
        boolean required = constraints.isRequired()
                || (!source.isEmpty() && containerContext.schema().getRequired().contains(key));

        constraints.applyTo(parameter.schema(), SchemaNode.empty(), key);
        if (required && !parameter.isRequired()) {
            parameter.markRequired();
        }
        LOG.trace(
                "parameter.augmented name={} container={} property={} required={}",
                parameter.name(),
                container.getName(),
                key,
                required);
    }
}
