package io.schemarules.reference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemarules.core.engine.OperationParameter;
import io.schemarules.core.spi.SchemaNode;
import java.util.Optional;

/** {@link OperationParameter} view over an OpenAPI parameter object. */
final class ReferenceParameter implements OperationParameter {

    private final ObjectNode json;
    private final ParameterBinding binding;

    ReferenceParameter(ObjectNode json, ParameterBinding binding) {
        this.json = json;
        this.binding = binding;
    }

    @Override
    public String name() {
        return json.path("name").asText();
    }

    @Override
    public Optional<Class<?>> containerType() {
        return Optional.of(binding.containerType());
    }

    @Override
    public String propertyName() {
        return binding.propertyName();
    }

    @Override
    public SchemaNode schema() {
        JsonNode schema = json.get("schema");
        if (schema == null || schema.isNull()) {
            return new ReferenceSchemaNode(json.putObject("schema"));
        }
        if (!schema.isObject() || schema.has("$ref")) {
            return SchemaNode.empty();
        }
        return new ReferenceSchemaNode((ObjectNode) schema);
    }

    @Override
    public boolean isRequired() {
        return json.path("required").asBoolean(false);
    }

    @Override
    public void markRequired() {
        json.put("required", true);
    }
}
