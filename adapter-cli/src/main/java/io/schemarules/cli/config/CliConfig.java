package io.schemarules.cli.config;

import java.util.List;
import java.util.Objects;

/**
 * Immutable CLI configuration. Built through {@link Builder}, which carries the defaults.
 *
 * @param rulesDir directory holding the YAML rule-set files
 * @param types fully qualified names of the types to generate; empty means every type a rule set
 *     declares
 * @param outputPath file to write the components document to; {@code null} writes to stdout
 * @param outputPretty pretty-print the document
 * @param oneValidatorPerType see {@link io.schemarules.core.config.SchemaGenerationOptions}
 * @param naming naming convention shared by the generator and the rule lookup
 * @param loggingFormat {@code text} or {@code json}
 * @param loggingLevel root log level
 */
public record CliConfig(
        String rulesDir,
        List<String> types,
        String outputPath,
        boolean outputPretty,
        boolean oneValidatorPerType,
        String naming,
        String loggingFormat,
        String loggingLevel) {

    public CliConfig {
        Objects.requireNonNull(rulesDir, "rulesDir must not be null");
        types = List.copyOf(types);
        Objects.requireNonNull(naming, "naming must not be null");
        Objects.requireNonNull(loggingFormat, "loggingFormat must not be null");
        Objects.requireNonNull(loggingLevel, "loggingLevel must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder with defaults for every key. */
    public static final class Builder {

        private String rulesDir = "rules";
        private List<String> types = List.of();
        private String outputPath;
        private boolean outputPretty = true;
        private boolean oneValidatorPerType = true;
        private String naming = "identity";
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder rulesDir(String rulesDir) {
            this.rulesDir = rulesDir;
            return this;
        }

        public Builder types(List<String> types) {
            this.types = types;
            return this;
        }

        public Builder outputPath(String outputPath) {
            this.outputPath = outputPath;
            return this;
        }

        public Builder outputPretty(boolean outputPretty) {
            this.outputPretty = outputPretty;
            return this;
        }

        public Builder oneValidatorPerType(boolean oneValidatorPerType) {
            this.oneValidatorPerType = oneValidatorPerType;
            return this;
        }

        public Builder naming(String naming) {
            this.naming = naming;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public CliConfig build() {
            return new CliConfig(
                    rulesDir, types, outputPath, outputPretty, oneValidatorPerType, naming, loggingFormat, loggingLevel);
        }
    }
}
