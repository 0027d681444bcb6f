package org.linecalc.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    /** Name of the optional configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "linecalc.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. CLI arguments (as Java System Properties, e.g., -Dkey=value)
     * 2. The explicit configuration file, or linecalc.conf in the working directory
     * 3. Default values (from reference.conf on the classpath)
     *
     * @param explicitFile A file given on the command line, or {@code null}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws IllegalArgumentException if the explicit file does not exist.
     */
    public static Config load(final File explicitFile) {
        final Config fileConfig;
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + explicitFile.getAbsolutePath());
            }
            LOG.info("Using configuration file specified via --config: {}", explicitFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(explicitFile);
        } else {
            final File cwdConfigFile = new File(CONFIG_FILE_NAME);
            if (cwdConfigFile.isFile()) {
                LOG.info("Loading configuration from file: {}", cwdConfigFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(cwdConfigFile);
            } else {
                LOG.debug("Configuration file '{}' not found. Using defaults.", CONFIG_FILE_NAME);
                fileConfig = ConfigFactory.empty();
            }
        }

        // Chain the configs together. The one provided first wins.
        return ConfigFactory.systemProperties()
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }
}
