package io.schemarules.tree;

import io.schemarules.core.config.SchemaGenerationOptions;
import io.schemarules.core.engine.SchemaAugmenter;
import io.schemarules.core.registry.ValidatorRegistry;
import java.util.Objects;

/** Applies registered validation rules to every object schema the tree generator builds. */
public final class RuleSchemaProcessor implements SchemaProcessor {

    private final SchemaAugmenter augmenter;

    public RuleSchemaProcessor(ValidatorRegistry registry, SchemaGenerationOptions options) {
        this(new SchemaAugmenter(registry, options));
    }

    public RuleSchemaProcessor(SchemaAugmenter augmenter) {
        this.augmenter = Objects.requireNonNull(augmenter, "augmenter must not be null");
    }

    @Override
    public void process(SchemaProcessorContext context) {
        TreeSchemaProvider provider = new TreeSchemaProvider(context.generator(), context.resolver());
        augmenter.augment(new TreeSchemaContext(context.type(), context.schema(), provider));
    }
}
