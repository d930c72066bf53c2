package io.schemarules.tree;

/** Per-type hook of {@link TreeSchemaGenerator}, run once on every object schema it builds. */
@FunctionalInterface
public interface SchemaProcessor {

    void process(SchemaProcessorContext context);
}
