package io.schemarules.reference;

import java.util.List;
import java.util.Objects;

/**
 * Host state handed to {@link RuleOperationFilter} for one operation.
 *
 * @param bindings container bindings of the operation's parameters
 * @param generator the document's schema generator
 * @param repository the document's component repository
 */
public record OperationFilterContext(
        List<ParameterBinding> bindings, ReferenceSchemaGenerator generator, ComponentRepository repository) {

    public OperationFilterContext {
        bindings = bindings != null ? List.copyOf(bindings) : List.of();
        Objects.requireNonNull(generator, "generator must not be null");
        Objects.requireNonNull(repository, "repository must not be null");
    }
}
