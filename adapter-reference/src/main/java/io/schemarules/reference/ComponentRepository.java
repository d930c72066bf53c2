package io.schemarules.reference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemarules.core.spi.SchemaStore;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The {@code components/schemas} section of an OpenAPI document: named schemas in insertion order.
 * Object and enum schemas live here and are pointed at with {@code $ref}.
 */
public final class ComponentRepository implements SchemaStore {

    /** Prefix of every {@code $ref} into this repository. */
    public static final String REF_PREFIX = "#/components/schemas/";

    private final Map<String, ObjectNode> schemas = new LinkedHashMap<>();
    private final Map<String, Class<?>> owners = new HashMap<>();

    /** Returns {@code {"$ref": "#/components/schemas/<id>"}}. */
    public static ObjectNode referenceTo(String schemaId) {
        return JsonNodeFactory.instance.objectNode().put("$ref", REF_PREFIX + schemaId);
    }

    /** Id targeted by {@code node}'s {@code $ref}, if it points into this repository. */
    public static Optional<String> referencedId(JsonNode node) {
        JsonNode ref = node == null ? null : node.get("$ref");
        if (ref == null || !ref.isTextual() || !ref.asText().startsWith(REF_PREFIX)) {
            return Optional.empty();
        }
        return Optional.of(ref.asText().substring(REF_PREFIX.length()));
    }

    public void put(String schemaId, ObjectNode schema) {
        schemas.put(Objects.requireNonNull(schemaId, "schemaId must not be null"), schema);
    }

    /**
     * Stores {@code schema} as the schema generated for {@code type}.
     *
     * @throws IllegalStateException if {@code schemaId} already holds another type's schema
     */
    public void register(Class<?> type, String schemaId, ObjectNode schema) {
        Objects.requireNonNull(type, "type must not be null");
        containsFor(type, schemaId);
        put(schemaId, schema);
        owners.put(schemaId, type);
    }

    /**
     * Whether {@code schemaId} is present. Ids stored through {@link #register} answer only for
     * their own type.
     *
     * @throws IllegalStateException if {@code schemaId} holds another type's schema
     */
    public boolean containsFor(Class<?> type, String schemaId) {
        Class<?> owner = owners.get(schemaId);
        if (owner != null && !owner.equals(type)) {
            throw new IllegalStateException(
                    "Schema id '" + schemaId + "' already used by " + owner.getName() + ", cannot register "
                            + type.getName());
        }
        return schemas.containsKey(schemaId);
    }

    public Optional<Class<?>> ownerOf(String schemaId) {
        return Optional.ofNullable(owners.get(schemaId));
    }

    public boolean contains(String schemaId) {
        return schemas.containsKey(schemaId);
    }

    public Optional<ObjectNode> find(String schemaId) {
        return Optional.ofNullable(schemas.get(schemaId));
    }

    /** Follows a {@code $ref} node to its stored schema. */
    public Optional<ObjectNode> resolve(JsonNode reference) {
        return referencedId(reference).flatMap(this::find);
    }

    public Map<String, ObjectNode> schemas() {
        return Collections.unmodifiableMap(schemas);
    }

    @Override
    public Set<String> schemaIds() {
        return new LinkedHashSet<>(schemas.keySet());
    }

    @Override
    public boolean remove(String schemaId) {
        owners.remove(schemaId);
        return schemas.remove(schemaId) != null;
    }

    @Override
    public Set<String> referencedIds(String schemaId) {
        ObjectNode schema = schemas.get(schemaId);
        if (schema == null) {
            return Set.of();
        }
        Set<String> ids = new LinkedHashSet<>();
        collectReferences(schema, ids);
        return ids;
    }

    /** Every repository id referenced anywhere inside {@code node}. */
    public static Set<String> collectReferences(JsonNode node) {
        Set<String> ids = new LinkedHashSet<>();
        collectReferences(node, ids);
        return ids;
    }

    private static void collectReferences(JsonNode node, Set<String> ids) {
        if (node == null) {
            return;
        }
        referencedId(node).ifPresent(ids::add);
        for (JsonNode child : node) {
            collectReferences(child, ids);
        }
    }

    /** Builds {@code {"components": {"schemas": {...}}}} from the current content. */
    public ObjectNode toDocument() {
        ObjectNode document = JsonNodeFactory.instance.objectNode();
        ObjectNode target = document.putObject("components").putObject("schemas");
        schemas.forEach(target::set);
        return document;
    }
}
