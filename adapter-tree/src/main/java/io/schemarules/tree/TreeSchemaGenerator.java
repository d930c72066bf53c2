package io.schemarules.tree;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import io.schemarules.core.config.SchemaGenerationOptions;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal reflective generator of {@link JsonSchema} trees over Jackson bean introspection.
 *
 * <p>By default nested beans and enums are generated inline, each nested bean running the
 * registered {@link SchemaProcessor}s itself. With {@code useReferences} they become definitions in
 * the {@link SchemaResolver} and properties reference them. Recursive types are always broken with
 * a reference.
 */
public final class TreeSchemaGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(TreeSchemaGenerator.class);

    private final ObjectMapper mapper;
    private final SchemaGenerationOptions options;
    private final boolean useReferences;
    private final List<SchemaProcessor> processors;

    public TreeSchemaGenerator(SchemaGenerationOptions options, List<SchemaProcessor> processors) {
        this(new ObjectMapper(), options, false, processors);
    }

    public TreeSchemaGenerator(
            ObjectMapper mapper, SchemaGenerationOptions options, boolean useReferences, List<SchemaProcessor> processors) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.useReferences = useReferences;
        this.processors = processors != null ? List.copyOf(processors) : List.of();
    }

    public boolean useReferences() {
        return useReferences;
    }

    /** Generates the schema of {@code type} without registering it as a definition. */
    public JsonSchema generate(Class<?> type, SchemaResolver resolver) {
        Objects.requireNonNull(type, "type must not be null");
        return generate(mapper.constructType(type), resolver, new HashMap<>());
    }

    /** Returns the definition of {@code type}, generating and registering it first if needed. */
    public JsonSchema resolveDefinition(Class<?> type, SchemaResolver resolver) {
        Optional<JsonSchema> existing = resolver.findSchema(type);
        if (existing.isPresent()) {
            return existing.get();
        }
        JavaType javaType = mapper.constructType(type);
        if (isBean(javaType)) {
            return define(javaType, resolver, new HashMap<>());
        }
        JsonSchema schema = generate(javaType, resolver, new HashMap<>()).actualSchema();
        if (!resolver.hasSchema(type)) {
            resolver.register(type, options.schemaId(type), schema);
        }
        return schema;
    }

    private JsonSchema generate(JavaType type, SchemaResolver resolver, Map<Class<?>, JsonSchema> inProgress) {
        Class<?> raw = type.getRawClass();
        JsonSchema scalar = scalarSchema(raw);
        if (scalar != null) {
            return scalar;
        }
        if (type.isArrayType() || type.isCollectionLikeType()) {
            JsonSchema schema = JsonSchema.ofType("array");
            schema.setItems(generate(type.getContentType(), resolver, inProgress));
            return schema;
        }
        if (type.isMapLikeType()) {
            JsonSchema schema = JsonSchema.ofType("object");
            schema.setAdditionalProperties(generate(type.getContentType(), resolver, inProgress));
            return schema;
        }
        if (type.isEnumType()) {
            if (!useReferences) {
                return enumSchema(raw);
            }
            JsonSchema definition = resolver.findSchema(raw).orElseGet(() -> {
                JsonSchema schema = enumSchema(raw);
                resolver.register(raw, options.schemaId(raw), schema);
                return schema;
            });
            return JsonSchema.referenceTo(definition);
        }
        if (raw == Object.class) {
            return JsonSchema.ofType("object");
        }

        JsonSchema building = inProgress.get(raw);
        if (building != null) {
            if (resolver.idOf(building).isEmpty()) {
                resolver.register(raw, options.schemaId(raw), building);
            }
            return JsonSchema.referenceTo(building);
        }
        if (useReferences) {
            return JsonSchema.referenceTo(
                    resolver.findSchema(raw).orElseGet(() -> define(type, resolver, inProgress)));
        }
        JsonSchema schema = JsonSchema.ofType("object");
        fillBean(schema, type, resolver, inProgress);
        return schema;
    }

    private JsonSchema define(JavaType type, SchemaResolver resolver, Map<Class<?>, JsonSchema> inProgress) {
        Class<?> raw = type.getRawClass();
        JsonSchema schema = JsonSchema.ofType("object");
        resolver.register(raw, options.schemaId(raw), schema);
        fillBean(schema, type, resolver, inProgress);
        return schema;
    }

    private void fillBean(
            JsonSchema schema, JavaType type, SchemaResolver resolver, Map<Class<?>, JsonSchema> inProgress) {
        Class<?> raw = type.getRawClass();
        inProgress.put(raw, schema);
        try {
            BeanDescription description = mapper.getSerializationConfig().introspect(type);
            for (BeanPropertyDefinition property : description.findProperties()) {
                if (property.couldSerialize()) {
                    schema.getProperties()
                            .put(property.getName(), generate(property.getPrimaryType(), resolver, inProgress));
                }
            }
        } finally {
            inProgress.remove(raw);
        }

        SchemaProcessorContext context = new SchemaProcessorContext(raw, schema, resolver, this);
        for (SchemaProcessor processor : processors) {
            processor.process(context);
        }
        LOG.debug(
                "Generated schema type={} properties={} definition={}",
                raw.getName(),
                schema.getProperties().size(),
                resolver.idOf(schema).orElse("inline"));
    }

    private boolean isBean(JavaType type) {
        return scalarSchema(type.getRawClass()) == null
                && !type.isContainerType()
                && !type.isArrayType()
                && !type.isEnumType()
                && type.getRawClass() != Object.class;
    }

    private static JsonSchema enumSchema(Class<?> enumType) {
        JsonSchema schema = JsonSchema.ofType("string");
        List<Object> names = new ArrayList<>();
        for (Object constant : enumType.getEnumConstants()) {
            names.add(((Enum<?>) constant).name());
        }
        schema.setEnumeration(names);
        return schema;
    }

    private static JsonSchema scalarSchema(Class<?> raw) {
        if (raw == String.class || raw == char.class || raw == Character.class || CharSequence.class.isAssignableFrom(raw)) {
            return JsonSchema.ofType("string");
        }
        if (raw == boolean.class || raw == Boolean.class) {
            return JsonSchema.ofType("boolean");
        }
        if (raw == int.class || raw == Integer.class || raw == short.class || raw == Short.class
                || raw == byte.class || raw == Byte.class) {
            return formatted("integer", "int32");
        }
        if (raw == long.class || raw == Long.class) {
            return formatted("integer", "int64");
        }
        if (raw == BigInteger.class) {
            return JsonSchema.ofType("integer");
        }
        if (raw == float.class || raw == Float.class) {
            return formatted("number", "float");
        }
        if (raw == double.class || raw == Double.class) {
            return formatted("number", "double");
        }
        if (raw == BigDecimal.class) {
            return JsonSchema.ofType("number");
        }
        if (raw == UUID.class) {
            return formatted("string", "uuid");
        }
        if (raw == LocalDate.class) {
            return formatted("string", "date");
        }
        if (Temporal.class.isAssignableFrom(raw)) {
            return formatted("string", "date-time");
        }
        return null;
    }

    private static JsonSchema formatted(String type, String format) {
        JsonSchema schema = JsonSchema.ofType(type);
        schema.setFormat(format);
        return schema;
    }
}
