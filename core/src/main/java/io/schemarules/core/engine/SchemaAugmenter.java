package io.schemarules.core.engine;

import io.schemarules.core.config.SchemaGenerationOptions;
import io.schemarules.core.model.ConstraintSet;
import io.schemarules.core.model.RuleChain;
import io.schemarules.core.model.Validator;
import io.schemarules.core.registry.ValidatorRegistry;
import io.schemarules.core.spi.SchemaContext;
import io.schemarules.core.spi.SchemaNode;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-type hook: applies the rules registered for a type to the schema the host generated for it.
 *
 * <p>Chains from every applicable validator are folded into one {@link ConstraintSet} per
 * property, merged with the values already on the property's schema and written back. Properties
 * the schema does not list are skipped. Properties whose node is empty (pure references) keep
 * their schema untouched, but a required rule still lists them as required on the parent.
 */
public final class SchemaAugmenter {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaAugmenter.class);

    private final ValidatorRegistry registry;
    private final SchemaGenerationOptions options;
    private final ConstraintMapper mapper;

    public SchemaAugmenter(ValidatorRegistry registry, SchemaGenerationOptions options) {
        this(registry, options, new ConstraintMapper());
    }

    public SchemaAugmenter(ValidatorRegistry registry, SchemaGenerationOptions options, ConstraintMapper mapper) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * Applies the registered rules for {@code context.schemaType()} to its schema.
     *
     * @return the number of schema properties that had rules
     */
    public int augment(SchemaContext context) {
        List<Validator> validators = registry.getValidators(context.schemaType());
        if (validators.isEmpty()) {
            return 0;
        }

        Collection<String> schemaProperties = context.propertyNames();
        Map<String, ConstraintSet> byKey = new LinkedHashMap<>();
        Map<String, SchemaNode> nodes = new LinkedHashMap<>();
        for (Validator validator : validators) {
            for (RuleChain chain : validator.ruleChains()) {
                String key = options.nameResolver().resolve(chain.propertyName());
                if (!schemaProperties.contains(key)) {
                    LOG.debug(
                            "Skipping rules for property={} key={} type={}: not in schema",
                            chain.propertyName(),
                            key,
                            context.schemaType().getName());
                    continue;
                }
                SchemaNode node = nodes.computeIfAbsent(key, context::getPropertyNode);
                mapper.mapInto(byKey.computeIfAbsent(key, k -> new ConstraintSet()), chain, node);
            }
        }

        SchemaNode parent = context.schema();
        byKey.forEach((key, constraints) -> constraints.applyTo(nodes.get(key), parent, key));

        long skipped = nodes.values().stream().filter(SchemaNode::isEmpty).count();
        LOG.debug(
                "schema.augmented type={} validators={} properties={} unreachable={}",
                context.schemaType().getName(),
                validators.size(),
                byKey.size(),
                skipped);
        return byKey.size();
    }
}
