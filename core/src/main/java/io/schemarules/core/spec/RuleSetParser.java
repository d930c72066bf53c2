package io.schemarules.core.spec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.schemarules.core.error.RuleSetParseException;
import io.schemarules.core.error.RuleSetSchemaException;
import io.schemarules.core.model.Rule;
import io.schemarules.core.model.RuleChain;
import io.schemarules.core.model.RuleKind;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses YAML rule-set files into {@link RuleSet}s.
 *
 * <pre>
 * type: com.example.SearchRequest
 * key: admin            # optional
 * rules:
 *   query:
 *     - notEmpty
 *     - maximumLength: 200
 *   page:
 *     - greaterThan: 0
 *   range:
 *     - inclusiveBetween: { from: 5, to: 10 }
 * </pre>
 *
 * <p>The document structure is checked against {@code schemas/rule-set.schema.json} before rules
 * are read. {@code type} is a binary class name ({@code Outer$Inner} for nested classes) resolved
 * through the parser's class loader.
 *
 * <p>Thread-safe.
 */
public final class RuleSetParser {

    private static final Logger LOG = LoggerFactory.getLogger(RuleSetParser.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String RULE_SET_SCHEMA = "/schemas/rule-set.schema.json";
    private static final JsonSchema SCHEMA = loadSchema();

    private static final Set<String> LENGTH_KEYS = Set.of(Rule.MIN, Rule.MAX);
    private static final Set<String> RANGE_KEYS = Set.of(Rule.FROM, Rule.TO);

    private final ClassLoader classLoader;

    public RuleSetParser() {
        this(RuleSetParser.class.getClassLoader());
    }

    public RuleSetParser(ClassLoader classLoader) {
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader must not be null");
    }

    /**
     * Parses one rule-set file.
     *
     * @throws RuleSetParseException if the file is unreadable or names an unknown type or rule
     * @throws RuleSetSchemaException if the document does not match the rule-set schema
     */
    public RuleSet parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root = readYaml(path, source);
        validateStructure(root, source);

        String typeName = root.get("type").asText();
        Class<?> type = resolveType(typeName, source);
        String key = root.hasNonNull("key") ? root.get("key").asText() : null;

        List<RuleChain> chains = new ArrayList<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = root.get("rules").fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> property = it.next();
            List<Rule> rules = new ArrayList<>();
            for (JsonNode ruleNode : property.getValue()) {
                rules.add(parseRule(ruleNode, property.getKey(), typeName, source));
            }
            chains.add(new RuleChain(property.getKey(), rules));
        }

        LOG.info("Loaded rule set: type={} key={} properties={} source={}", typeName, key, chains.size(), source);
        return new RuleSet(key, new DeclaredValidator(type, chains), source);
    }

    /**
     * Parses every {@code *.yaml} / {@code *.yml} file directly inside {@code directory}, in file
     * name order.
     *
     * @throws RuleSetParseException if the directory cannot be listed
     */
    public List<RuleSet> parseDirectory(Path directory) {
        Objects.requireNonNull(directory, "directory must not be null");
        if (!Files.isDirectory(directory)) {
            throw new RuleSetParseException("Rule-set directory not found: " + directory, null, directory.toString());
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.endsWith(".yaml") || name.endsWith(".yml");
                    })
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .map(this::parse)
                    .toList();
        } catch (IOException e) {
            throw new RuleSetParseException(
                    "Failed to list rule-set directory: " + e.getMessage(), e, null, directory.toString());
        } catch (UncheckedIOException e) {
            throw new RuleSetParseException(
                    "Failed to list rule-set directory: " + e.getMessage(), e.getCause(), null, directory.toString());
        }
    }

    private Rule parseRule(JsonNode node, String property, String typeName, String source) {
        if (node.isTextual()) {
            RuleKind kind = resolveKind(node.asText(), property, typeName, source);
            return switch (kind) {
                case NOT_NULL -> Rule.notNull();
                case NOT_EMPTY -> Rule.notEmpty();
                case EMAIL_ADDRESS -> Rule.emailAddress();
                default -> throw new RuleSetParseException(
                        "Rule '" + kind.declaredName() + "' on property '" + property + "' requires a parameter",
                        typeName,
                        source);
            };
        }

        Map.Entry<String, JsonNode> entry = node.fields().next();
        RuleKind kind = resolveKind(entry.getKey(), property, typeName, source);
        JsonNode arg = entry.getValue();
        String where = "'" + kind.declaredName() + "' on property '" + property + "'";
        try {
            return switch (kind) {
                case NOT_NULL -> Rule.notNull();
                case NOT_EMPTY -> Rule.notEmpty();
                case EMAIL_ADDRESS -> Rule.emailAddress();
                case MAXIMUM_LENGTH -> Rule.maximumLength(integer(arg, Rule.MAX, where, typeName, source));
                case MINIMUM_LENGTH -> Rule.minimumLength(integer(arg, Rule.MIN, where, typeName, source));
                case LENGTH -> {
                    requireObject(arg, LENGTH_KEYS, where, typeName, source);
                    yield Rule.length(
                            integer(arg.get(Rule.MIN), Rule.MIN, where, typeName, source),
                            integer(arg.get(Rule.MAX), Rule.MAX, where, typeName, source));
                }
                case GREATER_THAN -> Rule.greaterThan(decimal(arg, Rule.VALUE, where, typeName, source));
                case GREATER_THAN_OR_EQUAL -> Rule.greaterThanOrEqual(decimal(arg, Rule.VALUE, where, typeName, source));
                case LESS_THAN -> Rule.lessThan(decimal(arg, Rule.VALUE, where, typeName, source));
                case LESS_THAN_OR_EQUAL -> Rule.lessThanOrEqual(decimal(arg, Rule.VALUE, where, typeName, source));
                case INCLUSIVE_BETWEEN -> {
                    requireObject(arg, RANGE_KEYS, where, typeName, source);
                    yield Rule.inclusiveBetween(
                            decimal(arg.get(Rule.FROM), Rule.FROM, where, typeName, source),
                            decimal(arg.get(Rule.TO), Rule.TO, where, typeName, source));
                }
                case EXCLUSIVE_BETWEEN -> {
                    requireObject(arg, RANGE_KEYS, where, typeName, source);
                    yield Rule.exclusiveBetween(
                            decimal(arg.get(Rule.FROM), Rule.FROM, where, typeName, source),
                            decimal(arg.get(Rule.TO), Rule.TO, where, typeName, source));
                }
                case MATCHES -> Rule.matches(text(arg, Rule.REGEX, where, typeName, source));
                case IS_IN_ENUM -> Rule.isInEnum(values(arg, where, typeName, source));
            };
        } catch (IllegalArgumentException e) {
            throw new RuleSetParseException("Invalid " + where + ": " + e.getMessage(), e, typeName, source);
        }
    }

    private RuleKind resolveKind(String name, String property, String typeName, String source) {
        return RuleKind.fromDeclaredName(name)
                .orElseThrow(() -> new RuleSetParseException(
                        "Unknown rule '" + name + "' on property '" + property + "'; recognized rules are: "
                                + Stream.of(RuleKind.values())
                                        .map(RuleKind::declaredName)
                                        .collect(Collectors.joining(", ")),
                        typeName,
                        source));
    }

    private static int integer(JsonNode arg, String field, String where, String typeName, String source) {
        JsonNode value = unwrap(arg, field);
        if (value == null || !value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new RuleSetParseException(
                    "Missing or non-integer '" + field + "' for " + where, typeName, source);
        }
        return value.intValue();
    }

    private static BigDecimal decimal(JsonNode arg, String field, String where, String typeName, String source) {
        JsonNode value = unwrap(arg, field);
        if (value == null || !value.isNumber()) {
            throw new RuleSetParseException("Missing or non-numeric '" + field + "' for " + where, typeName, source);
        }
        return value.decimalValue();
    }

    private static String text(JsonNode arg, String field, String where, String typeName, String source) {
        JsonNode value = unwrap(arg, field);
        if (value == null || !value.isTextual()) {
            throw new RuleSetParseException("Missing or non-string '" + field + "' for " + where, typeName, source);
        }
        return value.asText();
    }

    private static List<Object> values(JsonNode arg, String where, String typeName, String source) {
        JsonNode value = unwrap(arg, Rule.VALUES);
        if (value == null || !value.isArray()) {
            throw new RuleSetParseException("Missing or non-list 'values' for " + where, typeName, source);
        }
        List<Object> values = new ArrayList<>();
        for (JsonNode item : value) {
            if (item.isNumber()) {
                values.add(item.decimalValue());
            } else if (item.isBoolean()) {
                values.add(item.booleanValue());
            } else if (item.isTextual()) {
                values.add(item.asText());
            } else if (item.isNull()) {
                values.add(null);
            } else {
                throw new RuleSetParseException("Enum values must be scalars in " + where, typeName, source);
            }
        }
        return values;
    }

    /** Accepts the short form ({@code maximumLength: 5}) and the object form ({@code {max: 5}}). */
    private static JsonNode unwrap(JsonNode arg, String field) {
        if (arg != null && arg.isObject()) {
            return arg.get(field);
        }
        return arg;
    }

    private static void requireObject(JsonNode arg, Set<String> keys, String where, String typeName, String source) {
        if (arg == null || !arg.isObject()) {
            throw new RuleSetParseException(where + " requires an object with keys " + keys, typeName, source);
        }
        List<String> unknown = StreamSupport.stream(((Iterable<String>) arg::fieldNames).spliterator(), false)
                .filter(k -> !keys.contains(k))
                .toList();
        if (!unknown.isEmpty()) {
            throw new RuleSetParseException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " " + unknown + " in " + where
                            + "; recognized keys are: " + keys,
                    typeName,
                    source);
        }
    }

    private Class<?> resolveType(String typeName, String source) {
        try {
            return Class.forName(typeName, false, classLoader);
        } catch (ClassNotFoundException e) {
            throw new RuleSetParseException("Unknown type '" + typeName + "'", e, typeName, source);
        }
    }

    private static JsonNode readYaml(Path path, String source) {
        try {
            JsonNode root = YAML_MAPPER.readTree(path.toFile());
            if (root == null || root.isMissingNode()) {
                throw new RuleSetParseException("Rule-set file is empty", null, source);
            }
            return root;
        } catch (IOException e) {
            throw new RuleSetParseException("Failed to read or parse YAML: " + e.getMessage(), e, null, source);
        }
    }

    private static void validateStructure(JsonNode root, String source) {
        Set<ValidationMessage> errors = SCHEMA.validate(root);
        if (!errors.isEmpty()) {
            List<String> messages =
                    errors.stream().map(ValidationMessage::getMessage).sorted().toList();
            String typeName = root.path("type").isTextual() ? root.get("type").asText() : null;
            throw new RuleSetSchemaException(
                    "Rule set does not match the rule-set schema: " + messages, messages, typeName, source);
        }
    }

    private static JsonSchema loadSchema() {
        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
        try (InputStream in = RuleSetParser.class.getResourceAsStream(RULE_SET_SCHEMA)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RULE_SET_SCHEMA);
            }
            return factory.getSchema(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + RULE_SET_SCHEMA, e);
        }
    }
}
