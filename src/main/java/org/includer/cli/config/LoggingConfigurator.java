package org.includer.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies log levels from the {@code logging} configuration block to Logback.
 * <pre>
 * logging {
 *   default-level = WARN
 *   levels { "org.includer.merger" = DEBUG }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            return;
        }

        if (config.hasPath("logging.default-level")) {
            Level level = Level.toLevel(config.getString("logging.default-level"), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        }

        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
                Level level = Level.toLevel(String.valueOf(entry.getValue().unwrapped()), null);
                if (level == null) {
                    throw new IllegalArgumentException(
                            "Invalid log level for '" + entry.getKey() + "': " + entry.getValue().unwrapped());
                }
                context.getLogger(entry.getKey()).setLevel(level);
            }
        }
    }
}
