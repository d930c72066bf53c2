package io.schemarules.tree;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemarules.core.spi.SchemaStore;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Definitions of one schema document, keyed by id and by the type they were generated for. Also
 * answers which definition a given schema instance is.
 */
public final class SchemaResolver implements SchemaStore {

    private final Map<String, JsonSchema> definitions = new LinkedHashMap<>();
    private final Map<Class<?>, String> idsByType = new LinkedHashMap<>();

    /**
     * Registers {@code schema} as the definition of {@code type}.
     *
     * @throws IllegalStateException if {@code id} is already taken by another type
     */
    public void register(Class<?> type, String id, JsonSchema schema) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        String owner = idsByType.entrySet().stream()
                .filter(e -> e.getValue().equals(id))
                .map(e -> e.getKey().getName())
                .findFirst()
                .orElse(null);
        if (owner != null && !owner.equals(type.getName())) {
            throw new IllegalStateException("Definition id '" + id + "' already used by " + owner);
        }
        schema.setDefinitionId(id);
        definitions.put(id, schema);
        idsByType.put(type, id);
    }

    public boolean hasSchema(Class<?> type) {
        return idsByType.containsKey(type);
    }

    public Optional<JsonSchema> findSchema(Class<?> type) {
        String id = idsByType.get(type);
        return id == null ? Optional.empty() : Optional.ofNullable(definitions.get(id));
    }

    /** Id under which {@code schema} itself is registered. */
    public Optional<String> idOf(JsonSchema schema) {
        if (schema == null || schema.getDefinitionId() == null) {
            return Optional.empty();
        }
        String id = schema.getDefinitionId();
        return definitions.get(id) == schema ? Optional.of(id) : Optional.empty();
    }

    public Map<String, JsonSchema> definitions() {
        return Collections.unmodifiableMap(definitions);
    }

    @Override
    public Set<String> schemaIds() {
        return new LinkedHashSet<>(definitions.keySet());
    }

    @Override
    public boolean remove(String schemaId) {
        JsonSchema removed = definitions.remove(schemaId);
        if (removed == null) {
            return false;
        }
        idsByType.values().removeIf(schemaId::equals);
        return true;
    }

    @Override
    public Set<String> referencedIds(String schemaId) {
        JsonSchema schema = definitions.get(schemaId);
        return schema == null ? Set.of() : referencedIds(schema);
    }

    /** Ids of the definitions referenced anywhere below {@code schema}, not counting itself. */
    public Set<String> referencedIds(JsonSchema schema) {
        Set<String> ids = new LinkedHashSet<>();
        collect(schema, ids, Collections.newSetFromMap(new IdentityHashMap<>()), true);
        return ids;
    }

    private void collect(JsonSchema schema, Set<String> ids, Set<JsonSchema> visited, boolean root) {
        if (schema == null || !visited.add(schema)) {
            return;
        }
        if (!root) {
            // an inline child that is itself a definition counts as referenced
            idOf(schema).ifPresent(ids::add);
        }
        if (schema.hasReference()) {
            idOf(schema.getReference()).ifPresent(ids::add);
            return;
        }
        schema.getProperties().values().forEach(p -> collect(p, ids, visited, false));
        collect(schema.getItems(), ids, visited, false);
        collect(schema.getAdditionalProperties(), ids, visited, false);
    }

    /** Builds {@code {"definitions": {...}}} from the current content. */
    public ObjectNode toDocument(ObjectMapper mapper) {
        ObjectNode document = mapper.createObjectNode();
        document.set("definitions", mapper.valueToTree(definitions));
        return document;
    }
}
