package org.tapline.cli.config;

import java.io.File;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Configuration loader of the command line.
 * <p>
 * Composes HOCON configuration with the following precedence (highest to lowest):
 * <ol>
 *   <li>Java system properties ({@code -Dtapline.output.path=...})</li>
 *   <li>Environment variables</li>
 *   <li>User configuration file</li>
 *   <li>Defaults ({@code reference.conf} on the classpath)</li>
 * </ol>
 * Substitutions are resolved after all layers are composed, so user overrides propagate to
 * values of {@code reference.conf} that refer to them.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "tapline.conf";

    private ConfigLoader() {
    }

    /**
     * Message severity levels for configuration resolution feedback.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is looked up.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Resolves the configuration file with this cascade:
     * <ol>
     *   <li>file passed via {@code --config}</li>
     *   <li>{@code -Dconfig.file}</li>
     *   <li>{@code config/tapline.conf} relative to the working directory</li>
     *   <li>classpath defaults only</li>
     * </ol>
     *
     * @param explicitConfigFile config file from the CLI option, or {@code null}.
     * @param handler            receives resolution progress messages.
     * @return the resolved application configuration.
     * @throws IllegalArgumentException                if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException     if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(File explicitConfigFile, ConfigMessageHandler handler) {
        return resolve(explicitConfigFile, new File(CONFIG_DIR, CONFIG_FILE_NAME), handler);
    }

    static Config resolve(File explicitConfigFile, File workingDirConfigFile, ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
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

        handler.log(MessageLevel.WARN,
                "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME + "' found in current directory. "
                        + "Using default configuration from classpath.");
        return loadDefaults();
    }

    /**
     * Loads configuration from a file, merged with classpath defaults.
     */
    static Config loadFromFile(File configFile) {
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
