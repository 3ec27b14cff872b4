package org.genemeta.cli.config;

import java.io.File;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the application configuration for the CLI.
 * <p>
 * Layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dgenemeta.http.port=9090})</li>
 *   <li>Environment variables</li>
 *   <li>The user configuration file, if one is found</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved after all layers are composed, so overriding a value that
 * {@code reference.conf} refers to propagates to every reference.
 */
public final class ConfigLoader {

    /** Root path of all engine settings. */
    public static final String ROOT_PATH = "genemeta";

    private static final String CONFIG_DIR = "config";
    private static final String CONFIG_FILE_NAME = "genemeta.conf";

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Locates the user configuration file and loads the full configuration.
     * <p>
     * The file is taken from, in order: the {@code --config} option, the {@code -Dconfig.file}
     * system property, {@code config/genemeta.conf} in the working directory. Without any of
     * them only the classpath defaults are used.
     *
     * @param explicitConfigFile File from {@code --config}, or {@code null}.
     * @param handler            Receives progress messages.
     * @return The resolved configuration (whole tree, not just {@link #ROOT_PATH}).
     * @throws IllegalArgumentException if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        return resolve(explicitConfigFile, new File(CONFIG_DIR, CONFIG_FILE_NAME), handler);
    }

    static Config resolve(final File explicitConfigFile, final File workingDirConfigFile,
                          final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                    "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                "Using configuration file specified via --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                    "Configuration file specified via -Dconfig.file not found: " + systemConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                "Using configuration file specified via -Dconfig.file: " + systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        if (workingDirConfigFile.exists()) {
            handler.log(MessageLevel.INFO,
                "Using configuration file found in current directory: " + workingDirConfigFile.getAbsolutePath());
            return loadFromFile(workingDirConfigFile);
        }

        handler.log(MessageLevel.WARN, "No '" + workingDirConfigFile.getPath()
            + "' found. Using default configuration from classpath.");
        return loadDefaults();
    }

    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }
}
