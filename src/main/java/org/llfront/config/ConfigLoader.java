package org.llfront.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "llfront.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (e.g., -Dllfront.parser.max-nesting-depth=64)
     * 3. Configuration File ({@code llfront.conf} in the working directory, or the given file)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile An explicit configuration file, or {@code null} to look in the working directory.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or a substitution cannot be resolved.
     */
    public static Config load(final File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertyConfig = ConfigFactory.systemProperties();

        final File file = configFile != null ? configFile : new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (file.exists() && !file.isDirectory()) {
            LOG.debug("Loading configuration from file: {}", file.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(file);
        } else {
            LOG.debug("Configuration file '{}' not found or is a directory. Skipping file-based configuration.", file.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
            .withFallback(propertyConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
