package io.schemarules.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.PropertyNamingStrategy;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemarules.cli.config.CliConfig;
import io.schemarules.cli.config.ConfigLoadException;
import io.schemarules.cli.config.ConfigLoader;
import io.schemarules.cli.logging.LogbackConfigurator;
import io.schemarules.core.config.NameResolver;
import io.schemarules.core.config.SchemaGenerationOptions;
import io.schemarules.core.registry.DefaultValidatorRegistry;
import io.schemarules.core.spec.RuleSet;
import io.schemarules.core.spec.RuleSetParser;
import io.schemarules.reference.ComponentRepository;
import io.schemarules.reference.ReferenceSchemaGenerator;
import io.schemarules.reference.RuleSchemaFilter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One CLI run: loads the rule sets, registers them, generates the configured types through the
 * reference adapter with the rule filter installed and writes the resulting components document.
 *
 * <p>Relative {@code rules.dir} and {@code output.path} values resolve against {@code baseDir},
 * the directory of the configuration file.
 */
public final class CliApp {

    private static final Logger LOG = LoggerFactory.getLogger(CliApp.class);

    private final CliConfig config;
    private final Path baseDir;
    private final PrintStream stdout;
    private final ClassLoader classLoader;

    public CliApp(CliConfig config, Path baseDir) {
        this(config, baseDir, System.out, Thread.currentThread().getContextClassLoader());
    }

    CliApp(CliConfig config, Path baseDir, PrintStream stdout, ClassLoader classLoader) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir must not be null");
        this.stdout = Objects.requireNonNull(stdout, "stdout must not be null");
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader must not be null");
    }

    /** Full startup: resolve and load the configuration, configure logging, run. */
    public static void start(String[] args) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        CliConfig config = ConfigLoader.load(configPath);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        Path baseDir = configPath.toAbsolutePath().getParent();
        new CliApp(config, baseDir).run();
    }

    /** Generates the document and writes it to the configured output. */
    public void run() {
        ObjectNode document = generate();
        write(document);
    }

    /** Generates the components document without writing it. */
    public ObjectNode generate() {
        SchemaGenerationOptions options = SchemaGenerationOptions.builder()
                .oneValidatorPerType(config.oneValidatorPerType())
                .nameResolver(NameResolver.named(config.naming()))
                .build();

        DefaultValidatorRegistry registry = new DefaultValidatorRegistry(options);
        List<RuleSet> ruleSets = new RuleSetParser(classLoader).parseDirectory(resolve(config.rulesDir()));
        ruleSets.forEach(ruleSet -> ruleSet.registerInto(registry));

        ObjectMapper mapper = new ObjectMapper();
        PropertyNamingStrategy naming = namingStrategy(config.naming());
        if (naming != null) {
            mapper.setPropertyNamingStrategy(naming);
        }
        ReferenceSchemaGenerator generator =
                new ReferenceSchemaGenerator(mapper, options, List.of(new RuleSchemaFilter(registry, options)));

        List<Class<?>> types = config.types().isEmpty() ? registry.registeredTypes() : loadTypes(config.types());
        ComponentRepository repository = new ComponentRepository();
        for (Class<?> type : types) {
            generator.generateSchema(type, repository);
        }
        LOG.info(
                "cli.generated ruleSets={} types={} schemas={}",
                ruleSets.size(),
                types.size(),
                repository.schemaIds().size());
        return repository.toDocument();
    }

    private void write(ObjectNode document) {
        ObjectMapper mapper = new ObjectMapper();
        ObjectWriter writer = config.outputPretty()
                ? mapper.writer().with(SerializationFeature.INDENT_OUTPUT)
                : mapper.writer();
        try {
            if (config.outputPath() == null || config.outputPath().equals("-")) {
                stdout.println(writer.writeValueAsString(document));
                return;
            }
            Path target = resolve(config.outputPath());
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(target)) {
                writer.writeValue(out, document);
            }
            LOG.info("cli.written output={}", target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write components document to " + config.outputPath(), e);
        }
    }

    private List<Class<?>> loadTypes(List<String> names) {
        List<Class<?>> types = new ArrayList<>();
        for (String name : names) {
            try {
                types.add(Class.forName(name, false, classLoader));
            } catch (ClassNotFoundException e) {
                throw new ConfigLoadException("Unknown type in 'types': " + name, e);
            }
        }
        return types;
    }

    private Path resolve(String path) {
        return baseDir.resolve(path).normalize();
    }

    private static PropertyNamingStrategy namingStrategy(String naming) {
        return switch (naming.trim().toLowerCase(Locale.ROOT)) {
            case "camel" -> PropertyNamingStrategies.LOWER_CAMEL_CASE;
            case "upper-camel" -> PropertyNamingStrategies.UPPER_CAMEL_CASE;
            case "snake" -> PropertyNamingStrategies.SNAKE_CASE;
            case "kebab" -> PropertyNamingStrategies.KEBAB_CASE;
            case "lower" -> PropertyNamingStrategies.LOWER_CASE;
            default -> null;
        };
    }
}
