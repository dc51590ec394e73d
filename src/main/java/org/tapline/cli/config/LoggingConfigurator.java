package org.tapline.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies the {@code logging} section of the application configuration to Logback.
 * <pre>
 * logging {
 *   default-level = "INFO"
 *   levels { "org.tapline.compiler" = "DEBUG" }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * Sets the root level and the per-logger levels. Does nothing if the SLF4J binding is
     * not Logback.
     *
     * @param config the application configuration.
     * @throws IllegalArgumentException if a level name is unknown.
     */
    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.default-level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(parseLevel(config.getString("logging.default-level")));
        }
        if (config.hasPath("logging.levels")) {
            // nested and quoted keys both yield the dotted logger name
            for (Map.Entry<String, ConfigValue> entry : config.getConfig("logging.levels").entrySet()) {
                String loggerName = String.join(".", ConfigUtil.splitPath(entry.getKey()));
                String level = String.valueOf(entry.getValue().unwrapped());
                context.getLogger(loggerName).setLevel(parseLevel(level));
            }
        }
    }

    static Level parseLevel(String name) {
        Level level = Level.toLevel(name, null);
        if (level == null) {
            throw new IllegalArgumentException("Unknown log level: " + name);
        }
        return level;
    }
}
