package org.optimax.rogue.server.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Builds the server configuration by layering environment, system properties, an optional HOCON
 * file and the bundled {@code reference.conf}.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "optimax-rogue.conf";

    private ConfigLoader() {
    }

    /**
     * Loads the configuration with {@value #CONFIG_FILE_NAME} from the working directory as the
     * file layer.
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Merges the layers, earlier ones winning: environment variables, {@code -D} system
     * properties, {@code configFile} (or {@value #CONFIG_FILE_NAME} in the working directory),
     * then {@code reference.conf}.
     *
     * @param configFile an explicit configuration file, or {@code null}
     * @return the merged and resolved configuration
     * @throws IllegalArgumentException if an explicit file does not exist
     */
    public static Config load(final File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertiesConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + configFile.getAbsolutePath());
            }
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            final File defaultFile = new File(CONFIG_FILE_NAME);
            if (defaultFile.isFile()) {
                LOG.info("Loading configuration from file: {}", defaultFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(defaultFile);
            } else {
                LOG.debug("Configuration file '{}' not found, using defaults.", defaultFile.getPath());
                fileConfig = ConfigFactory.empty();
            }
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        return envConfig
            .withFallback(propertiesConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
