package org.monkey.cli.config;

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
    static final String CONFIG_FILE_NAME = "monkey.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using {@code monkey.conf} in the working directory, if present.
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. CLI arguments passed as Java System Properties (-Dkey=value)
     * 2. Environment Variables
     * 3. Configuration file ({@code configFile}, or monkey.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile An explicit configuration file, or {@code null} to look for monkey.conf.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or a substitution
     *         cannot be resolved.
     */
    public static Config load(final File configFile) {
        final File candidate = configFile != null ? configFile : new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (candidate.isFile()) {
            LOG.info("Loading configuration from file: {}", candidate.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(candidate);
        } else {
            LOG.debug("Configuration file '{}' not found or is a directory. Using defaults.", candidate.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
