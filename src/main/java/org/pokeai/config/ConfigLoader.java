package org.pokeai.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration from various sources.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "pokeai.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration with {@code pokeai.conf} from the working directory as the file source.
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment variables
     * 2. Java system properties (-Dkey=value)
     * 3. Configuration file (the given file, or pokeai.conf in the working directory)
     * 4. Default values (reference.conf on the classpath)
     *
     * @param explicitFile a file named on the command line, or {@code null}
     * @return the resolved configuration
     * @throws IllegalArgumentException if an explicit file does not exist
     */
    public static Config load(final File explicitFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertiesConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + explicitFile.getAbsolutePath());
            }
            LOG.debug("Loading configuration from file: {}", explicitFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(explicitFile);
        } else {
            final File configFile = new File(CONFIG_FILE_NAME);
            if (configFile.isFile()) {
                LOG.debug("Loading configuration from file: {}", configFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(configFile);
            } else {
                LOG.debug("Configuration file '{}' not found, using defaults.", configFile.getPath());
                fileConfig = ConfigFactory.empty();
            }
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
            .withFallback(propertiesConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
