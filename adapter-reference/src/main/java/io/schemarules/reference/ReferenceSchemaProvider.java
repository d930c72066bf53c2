package io.schemarules.reference;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemarules.core.spi.SchemaContext;
import io.schemarules.core.spi.SchemaProvider;
import java.util.Objects;

/**
 * Fetch-or-create access to type schemas. A type not yet in the repository is generated and
 * registered as a side effect; callers that must not leave such schemas behind run inside a
 * {@link io.schemarules.core.materialization.MaterializationGuard}.
 */
public final class ReferenceSchemaProvider implements SchemaProvider {

    private final ReferenceSchemaGenerator generator;
    private final ComponentRepository repository;

    public ReferenceSchemaProvider(ReferenceSchemaGenerator generator, ComponentRepository repository) {
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
    }

    @Override
    public ReferenceSchemaContext getSchemaForType(Class<?> type) {
        ObjectNode generated = generator.generateSchema(type, repository);
        ObjectNode schema = repository.resolve(generated).orElse(generated);
        return new ReferenceSchemaContext(type, schema, this);
    }
}
