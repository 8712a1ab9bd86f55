package org.includer.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;

/**
 * Loads the HOCON configuration of the CLI.
 * <p>
 * The first configuration file found wins:
 * <ol>
 *   <li>the file passed with {@code --config}</li>
 *   <li>the file named by {@code -Dconfig.file}</li>
 *   <li>{@code config/includer.conf} in the working directory</li>
 * </ol>
 * Without a file only {@code reference.conf} is used. System properties and environment
 * variables are layered on top of the file, and {@code reference.conf} sits underneath it.
 * Substitutions are resolved after layering, so overrides reach values that refer to them.
 */
public final class ConfigLoader {

    static final File WORKING_DIR_CONFIG = new File("config", "includer.conf");

    private ConfigLoader() {
    }

    /**
     * Receives a note about which configuration source was chosen.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(String message);
    }

    /**
     * @param explicitConfigFile file from {@code --config}, or {@code null} to search.
     * @param handler            told which source was selected.
     * @return the resolved configuration.
     * @throws IllegalArgumentException                if {@code --config} or {@code -Dconfig.file}
     *                                                 names a file that does not exist.
     * @throws com.typesafe.config.ConfigException     if a file cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            requireExisting(explicitConfigFile, "Configuration file not found: ");
            handler.log("Using configuration file specified via --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String propertyPath = System.getProperty("config.file");
        if (propertyPath != null && !propertyPath.isBlank()) {
            final File propertyFile = new File(propertyPath).getAbsoluteFile();
            requireExisting(propertyFile, "Configuration file specified via -Dconfig.file not found: ");
            handler.log("Using configuration file specified via -Dconfig.file: " + propertyFile);
            return loadFromFile(propertyFile);
        }

        if (WORKING_DIR_CONFIG.isFile()) {
            handler.log("Using configuration file found in current directory: "
                    + WORKING_DIR_CONFIG.getAbsolutePath());
            return loadFromFile(WORKING_DIR_CONFIG);
        }

        handler.log("No '" + WORKING_DIR_CONFIG.getPath() + "' found. Using default configuration from classpath.");
        return loadDefaults();
    }

    static Config loadFromFile(final File configFile) {
        return overrides()
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    static Config loadDefaults() {
        return overrides()
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    private static Config overrides() {
        return ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
    }

    private static void requireExisting(final File file, final String messagePrefix) {
        if (!file.exists()) {
            throw new IllegalArgumentException(messagePrefix + file.getAbsolutePath());
        }
    }
}
