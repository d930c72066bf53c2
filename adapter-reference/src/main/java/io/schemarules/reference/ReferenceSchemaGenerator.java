package io.schemarules.reference;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemarules.core.config.SchemaGenerationOptions;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.temporal.Temporal;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal reflective OpenAPI 3.0 schema generator over Jackson bean introspection.
 *
 * <p>Scalars are returned inline. Enums and bean types are stored in the {@link
 * ComponentRepository} under {@link SchemaGenerationOptions#schemaId(Class)} and returned as
 * {@code $ref}; collections and arrays become {@code type: array} with generated items. Property
 * names follow the naming strategy configured on the {@link ObjectMapper}. Two types mapping to the
 * same schema id are rejected with {@link IllegalStateException}.
 *
 * <p>Registered {@link SchemaFilter}s run on each new bean schema after its properties are filled.
 */
public final class ReferenceSchemaGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceSchemaGenerator.class);

    private final ObjectMapper mapper;
    private final SchemaGenerationOptions options;
    private final List<SchemaFilter> filters;

    public ReferenceSchemaGenerator(SchemaGenerationOptions options, List<SchemaFilter> filters) {
        this(new ObjectMapper(), options, filters);
    }

    public ReferenceSchemaGenerator(ObjectMapper mapper, SchemaGenerationOptions options, List<SchemaFilter> filters) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.filters = filters != null ? List.copyOf(filters) : List.of();
    }

    public SchemaGenerationOptions options() {
        return options;
    }

    /**
     * Generates the schema for {@code type}, registering enum and bean schemas in {@code repository}.
     *
     * @return an inline schema for scalars and arrays, a {@code $ref} otherwise
     */
    public ObjectNode generateSchema(Class<?> type, ComponentRepository repository) {
        Objects.requireNonNull(type, "type must not be null");
        return generate(mapper.constructType(type), repository);
    }

    private ObjectNode generate(JavaType type, ComponentRepository repository) {
        ObjectNode scalar = scalarSchema(type.getRawClass());
        if (scalar != null) {
            return scalar;
        }
        if (type.isArrayType() || type.isCollectionLikeType()) {
            ObjectNode schema = JsonNodeFactory.instance.objectNode().put("type", "array");
            schema.set("items", generate(type.getContentType(), repository));
            return schema;
        }
        if (type.isMapLikeType()) {
            ObjectNode schema = JsonNodeFactory.instance.objectNode().put("type", "object");
            schema.set("additionalProperties", generate(type.getContentType(), repository));
            return schema;
        }
        if (type.isEnumType()) {
            return register(type.getRawClass(), repository, () -> enumSchema(type.getRawClass()));
        }
        if (type.getRawClass() == Object.class) {
            return JsonNodeFactory.instance.objectNode().put("type", "object");
        }
        return registerBean(type, repository);
    }

    private ObjectNode register(Class<?> raw, ComponentRepository repository, Supplier<ObjectNode> body) {
        String id = options.schemaId(raw);
        if (!repository.containsFor(raw, id)) {
            repository.register(raw, id, body.get());
            LOG.debug("Registered schema id={} type={}", id, raw.getName());
        }
        return ComponentRepository.referenceTo(id);
    }

    private ObjectNode registerBean(JavaType type, ComponentRepository repository) {
        Class<?> raw = type.getRawClass();
        String id = options.schemaId(raw);
        if (repository.containsFor(raw, id)) {
            return ComponentRepository.referenceTo(id);
        }
        // placeholder first so self references terminate
        ObjectNode schema = JsonNodeFactory.instance.objectNode().put("type", "object");
        repository.register(raw, id, schema);

        ObjectNode properties = schema.putObject("properties");
        BeanDescription description = mapper.getSerializationConfig().introspect(type);
        for (BeanPropertyDefinition property : description.findProperties()) {
            if (!property.couldSerialize()) {
                continue;
            }
            properties.set(property.getName(), generate(property.getPrimaryType(), repository));
        }
        schema.put("additionalProperties", false);

        SchemaFilterContext context = new SchemaFilterContext(raw, this, repository);
        for (SchemaFilter filter : filters) {
            filter.apply(schema, context);
        }
        LOG.debug("Registered schema id={} type={} properties={}", id, raw.getName(), properties.size());
        return ComponentRepository.referenceTo(id);
    }

    private static ObjectNode enumSchema(Class<?> enumType) {
        ObjectNode schema = JsonNodeFactory.instance.objectNode().put("type", "string");
        ArrayNode values = schema.putArray("enum");
        for (Object constant : enumType.getEnumConstants()) {
            values.add(((Enum<?>) constant).name());
        }
        return schema;
    }

    private static ObjectNode scalarSchema(Class<?> raw) {
        ObjectNode schema = JsonNodeFactory.instance.objectNode();
        if (raw == String.class || raw == char.class || raw == Character.class || CharSequence.class.isAssignableFrom(raw)) {
            return schema.put("type", "string");
        }
        if (raw == boolean.class || raw == Boolean.class) {
            return schema.put("type", "boolean");
        }
        if (raw == int.class || raw == Integer.class || raw == short.class || raw == Short.class
                || raw == byte.class || raw == Byte.class) {
            return schema.put("type", "integer").put("format", "int32");
        }
        if (raw == long.class || raw == Long.class) {
            return schema.put("type", "integer").put("format", "int64");
        }
        if (raw == BigInteger.class) {
            return schema.put("type", "integer");
        }
        if (raw == float.class || raw == Float.class) {
            return schema.put("type", "number").put("format", "float");
        }
        if (raw == double.class || raw == Double.class) {
            return schema.put("type", "number").put("format", "double");
        }
        if (raw == BigDecimal.class) {
            return schema.put("type", "number");
        }
        if (raw == UUID.class) {
            return schema.put("type", "string").put("format", "uuid");
        }
        if (raw == LocalDate.class) {
            return schema.put("type", "string").put("format", "date");
        }
        if (Temporal.class.isAssignableFrom(raw)) {
            return schema.put("type", "string").put("format", "date-time");
        }
        return null;
    }
}
