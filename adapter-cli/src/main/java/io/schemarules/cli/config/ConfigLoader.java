package io.schemarules.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.schemarules.core.config.NameResolver;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link CliConfig} from a YAML file, then overlays environment variables.
 *
 * <p>Every key can be overridden by a {@code SCHEMA_RULES_*} variable, which takes precedence over
 * the file. A variable counts as set only when it is defined and not blank after trimming.
 *
 * <table>
 *   <caption>Environment variables</caption>
 *   <tr><td>{@code SCHEMA_RULES_RULES_DIR}</td><td>{@code rules.dir}</td></tr>
 *   <tr><td>{@code SCHEMA_RULES_TYPES}</td><td>{@code types} (comma-separated)</td></tr>
 *   <tr><td>{@code SCHEMA_RULES_OUTPUT_PATH}</td><td>{@code output.path}</td></tr>
 *   <tr><td>{@code SCHEMA_RULES_OUTPUT_PRETTY}</td><td>{@code output.pretty}</td></tr>
 *   <tr><td>{@code SCHEMA_RULES_ONE_VALIDATOR_PER_TYPE}</td><td>{@code options.one-validator-per-type}</td></tr>
 *   <tr><td>{@code SCHEMA_RULES_NAMING}</td><td>{@code options.naming}</td></tr>
 *   <tr><td>{@code SCHEMA_RULES_LOG_FORMAT}</td><td>{@code logging.format}</td></tr>
 *   <tr><td>{@code SCHEMA_RULES_LOG_LEVEL}</td><td>{@code logging.level}</td></tr>
 * </table>
 */
public final class ConfigLoader {

    static final String ENV_PREFIX = "SCHEMA_RULES_";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "schema-rules.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or holds an invalid value
     */
    public static CliConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration, applying overrides from {@code envLookup}. A {@code null} lookup
     * result means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or holds an invalid value
     */
    public static CliConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            root = YAML_MAPPER.createObjectNode();
        }
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration must be a YAML mapping: " + configPath);
        }

        CliConfig.Builder builder = CliConfig.builder();
        mapYaml(root, builder);
        applyEnvOverrides(builder, envLookup);
        CliConfig config = builder.build();
        validate(config);
        return config;
    }

    /**
     * Resolves the config file from the command line: {@code --config <path>}, otherwise {@code
     * schema-rules.yaml} in the working directory.
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static void mapYaml(JsonNode root, CliConfig.Builder builder) {
        JsonNode rules = root.path("rules");
        if (rules.has("dir")) builder.rulesDir(rules.get("dir").asText());

        JsonNode types = root.path("types");
        if (types.isArray()) {
            List<String> names = new ArrayList<>();
            types.forEach(t -> names.add(t.asText()));
            builder.types(names);
        } else if (!types.isMissingNode()) {
            throw new ConfigLoadException("'types' must be a list of class names");
        }

        JsonNode output = root.path("output");
        if (output.has("path")) builder.outputPath(output.get("path").asText());
        if (output.has("pretty")) builder.outputPretty(output.get("pretty").asBoolean());

        JsonNode options = root.path("options");
        if (options.has("one-validator-per-type"))
            builder.oneValidatorPerType(options.get("one-validator-per-type").asBoolean());
        if (options.has("naming")) builder.naming(options.get("naming").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
    }

    private static void applyEnvOverrides(CliConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "RULES_DIR", builder::rulesDir);
        envString(envLookup, "OUTPUT_PATH", builder::outputPath);
        envString(envLookup, "NAMING", builder::naming);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        envBool(envLookup, "OUTPUT_PRETTY", builder::outputPretty);
        envBool(envLookup, "ONE_VALIDATOR_PER_TYPE", builder::oneValidatorPerType);

        envString(envLookup, "TYPES", value -> builder.types(Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList()));
    }

    private static void validate(CliConfig config) {
        try {
            NameResolver.named(config.naming());
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid options.naming: " + e.getMessage(), e);
        }
        String format = config.loggingFormat().toLowerCase(Locale.ROOT);
        if (!format.equals("text") && !format.equals("json")) {
            throw new ConfigLoadException(
                    "Invalid logging.format: '" + config.loggingFormat() + "'; expected 'text' or 'json'");
        }
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String key, Consumer<String> setter) {
        String envVar = ENV_PREFIX + key;
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envBool(Function<String, String> envLookup, String key, Consumer<Boolean> setter) {
        String envVar = ENV_PREFIX + key;
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
