package io.schemarules.reference;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemarules.core.config.SchemaGenerationOptions;
import io.schemarules.core.engine.SchemaAugmenter;
import io.schemarules.core.registry.ValidatorRegistry;
import java.util.Objects;

/** Applies registered validation rules to every bean schema the generator produces. */
public final class RuleSchemaFilter implements SchemaFilter {

    private final SchemaAugmenter augmenter;

    public RuleSchemaFilter(ValidatorRegistry registry, SchemaGenerationOptions options) {
        this(new SchemaAugmenter(registry, options));
    }

    public RuleSchemaFilter(SchemaAugmenter augmenter) {
        this.augmenter = Objects.requireNonNull(augmenter, "augmenter must not be null");
    }

    @Override
    public void apply(ObjectNode schema, SchemaFilterContext context) {
        ReferenceSchemaProvider provider = new ReferenceSchemaProvider(context.generator(), context.repository());
        augmenter.augment(new ReferenceSchemaContext(context.type(), schema, provider));
    }
}
