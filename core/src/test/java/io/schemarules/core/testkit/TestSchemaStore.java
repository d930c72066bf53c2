package io.schemarules.core.testkit;

import io.schemarules.core.spi.SchemaContext;
import io.schemarules.core.spi.SchemaNode;
import io.schemarules.core.spi.SchemaProvider;
import io.schemarules.core.spi.SchemaStore;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * In-memory {@link SchemaStore} plus a {@link SchemaProvider} that materializes schemas through a
 * factory, counting how often it had to.
 */
public final class TestSchemaStore implements SchemaStore, SchemaProvider {

    private final Map<String, TestSchemaNode> schemas = new LinkedHashMap<>();
    private final Function<Class<?>, TestSchemaNode> factory;
    private int materialized;

    public TestSchemaStore() {
        this(type -> TestSchemaNode.object());
    }

    public TestSchemaStore(Function<Class<?>, TestSchemaNode> factory) {
        this.factory = factory;
    }

    public TestSchemaStore put(String id, TestSchemaNode schema) {
        schemas.put(id, schema);
        return this;
    }

    public TestSchemaNode get(String id) {
        return schemas.get(id);
    }

    public int materialized() {
        return materialized;
    }

    @Override
    public Set<String> schemaIds() {
        return new LinkedHashSet<>(schemas.keySet());
    }

    @Override
    public boolean remove(String schemaId) {
        return schemas.remove(schemaId) != null;
    }

    @Override
    public Set<String> referencedIds(String schemaId) {
        TestSchemaNode schema = schemas.get(schemaId);
        return schema == null ? Set.of() : schema.references();
    }

    @Override
    public SchemaContext getSchemaForType(Class<?> type) {
        String id = type.getSimpleName();
        TestSchemaNode schema = schemas.get(id);
        if (schema == null) {
            schema = factory.apply(type);
            schemas.put(id, schema);
            materialized++;
        }
        return new TestSchemaContext(type, schema, this);
    }

    /** Context over a {@link TestSchemaNode}; references and missing properties degrade to empty. */
    public record TestSchemaContext(Class<?> schemaType, TestSchemaNode root, SchemaProvider provider)
            implements SchemaContext {

        @Override
        public SchemaNode schema() {
            return root;
        }

        @Override
        public SchemaNode getPropertyNode(String propertyKey) {
            TestSchemaNode node = root.property(propertyKey);
            if (node == null || !node.references().isEmpty()) {
                return SchemaNode.empty();
            }
            return node;
        }

        @Override
        public SchemaContext getSchemaForType(Class<?> type) {
            return provider.getSchemaForType(type);
        }
    }
}
