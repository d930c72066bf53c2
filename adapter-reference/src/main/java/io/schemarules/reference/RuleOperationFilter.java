package io.schemarules.reference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemarules.core.config.SchemaGenerationOptions;
import io.schemarules.core.engine.OperationAugmenter;
import io.schemarules.core.registry.ValidatorRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Per-operation hook for OpenAPI operations: copies container-type rules onto the parameters they
 * were expanded into.
 *
 * <p>Container schemas generated only to read those rules are removed from the repository
 * afterwards. A schema stays when the finished operation still references it, for example as the
 * request body.
 */
public final class RuleOperationFilter {

    private final OperationAugmenter augmenter;

    public RuleOperationFilter(ValidatorRegistry registry, SchemaGenerationOptions options) {
        this(new OperationAugmenter(registry, options));
    }

    public RuleOperationFilter(OperationAugmenter augmenter) {
        this.augmenter = Objects.requireNonNull(augmenter, "augmenter must not be null");
    }

    /**
     * Applies container rules to {@code operation}'s parameters.
     *
     * @param operation an OpenAPI operation object; its {@code parameters} are updated in place
     * @return schema ids removed from the repository
     */
    public Set<String> apply(ObjectNode operation, OperationFilterContext context) {
        Map<String, ParameterBinding> byName = context.bindings().stream()
                .collect(Collectors.toMap(ParameterBinding::parameterName, Function.identity(), (a, b) -> a));

        List<ReferenceParameter> parameters = new ArrayList<>();
        for (JsonNode parameter : operation.path("parameters")) {
            ParameterBinding binding = byName.get(parameter.path("name").asText());
            if (binding != null && parameter.isObject()) {
                parameters.add(new ReferenceParameter((ObjectNode) parameter, binding));
            }
        }

        ComponentRepository repository = context.repository();
        return augmenter.augment(
                parameters,
                new ReferenceSchemaProvider(context.generator(), repository),
                repository,
                () -> ComponentRepository.collectReferences(operation));
    }
}
