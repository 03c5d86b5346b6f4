package org.bootc.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    /** Name of the configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "bootc.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (e.g., -Dbootc.toolchain.command=clang)
     * 3. Configuration File (the explicit file, or bootc.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitConfigFile A file given on the command line, or null.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws com.typesafe.config.ConfigException if the explicit file is missing or any source is malformed.
     */
    public static Config load(final File explicitConfigFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config cliConfig = ConfigFactory.systemProperties();
        final Config fileConfig = loadFileConfig(explicitConfigFile);
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // Chain the configs together. The one provided first wins.
        final Config combinedConfig = envConfig
            .withFallback(cliConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig);

        return combinedConfig.resolve();
    }

    private static Config loadFileConfig(final File explicitConfigFile) {
        if (explicitConfigFile != null) {
            LOG.info("Loading configuration from file: {}", explicitConfigFile.getAbsolutePath());
            return ConfigFactory.parseFile(explicitConfigFile, ConfigParseOptions.defaults().setAllowMissing(false));
        }
        final File configFile = new File(CONFIG_FILE_NAME);
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            return ConfigFactory.parseFile(configFile);
        }
        LOG.debug("Configuration file '{}' not found or is a directory. Skipping file-based configuration.", configFile.getPath());
        return ConfigFactory.empty();
    }
}
