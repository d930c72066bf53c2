package io.schemarules.tree;

import io.schemarules.core.config.SchemaGenerationOptions;
import io.schemarules.core.engine.OperationAugmenter;
import io.schemarules.core.engine.OperationParameter;
import io.schemarules.core.registry.ValidatorRegistry;
import io.schemarules.core.spi.SchemaNode;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per-operation hook for {@link TreeOperation}s: copies container-type rules onto the parameters
 * they were expanded into, then drops definitions registered only for that lookup.
 */
public final class RuleOperationProcessor {

    private final OperationAugmenter augmenter;

    public RuleOperationProcessor(ValidatorRegistry registry, SchemaGenerationOptions options) {
        this(new OperationAugmenter(registry, options));
    }

    public RuleOperationProcessor(OperationAugmenter augmenter) {
        this.augmenter = Objects.requireNonNull(augmenter, "augmenter must not be null");
    }

    /**
     * @return definition ids removed from {@code resolver}
     */
    public Set<String> process(TreeOperation operation, TreeSchemaGenerator generator, SchemaResolver resolver) {
        List<ParameterView> parameters = operation.parameters().stream()
                .filter(p -> p.containerType() != null)
                .map(ParameterView::new)
                .toList();
        return augmenter.augment(
                parameters,
                new TreeSchemaProvider(generator, resolver),
                resolver,
                () -> emittedRoots(operation, resolver));
    }

    private static Set<String> emittedRoots(TreeOperation operation, SchemaResolver resolver) {
        Set<String> roots = new LinkedHashSet<>();
        for (TreeParameter parameter : operation.parameters()) {
            collect(parameter.schema(), resolver, roots);
        }
        collect(operation.requestBody(), resolver, roots);
        return roots;
    }

    private static void collect(JsonSchema schema, SchemaResolver resolver, Set<String> roots) {
        if (schema == null) {
            return;
        }
        resolver.idOf(schema).ifPresent(roots::add);
        roots.addAll(resolver.referencedIds(schema));
    }

    private record ParameterView(TreeParameter parameter) implements OperationParameter {

        @Override
        public String name() {
            return parameter.name();
        }

        @Override
        public Optional<Class<?>> containerType() {
            return Optional.ofNullable(parameter.containerType());
        }

        @Override
        public String propertyName() {
            return parameter.propertyName();
        }

        @Override
        public SchemaNode schema() {
            JsonSchema schema = parameter.schema();
            return schema.hasReference() ? SchemaNode.empty() : new TreeSchemaNode(schema);
        }

        @Override
        public boolean isRequired() {
            return parameter.isRequired();
        }

        @Override
        public void markRequired() {
            parameter.setRequired(true);
        }
    }
}
