package io.schemarules.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: {@code java -jar schema-rules-adapter-cli.jar [--config schema-rules.yaml]}. Exits
 * with status 1 when loading or generation fails.
 */
public final class CliMain {

    private static final Logger LOG = LoggerFactory.getLogger(CliMain.class);

    private CliMain() {
        // utility class
    }

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            CliApp.start(args);
        } catch (Exception e) {
            LOG.error("Generation failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
