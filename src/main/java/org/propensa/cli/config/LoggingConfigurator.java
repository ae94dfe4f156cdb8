package org.propensa.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies log levels from the {@code logging} configuration block to Logback.
 * <pre>
 * logging {
 *   default-level = INFO
 *   levels { "org.propensa.compiler" = DEBUG }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.default-level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME)
                    .setLevel(Level.toLevel(config.getString("logging.default-level"), Level.INFO));
        }
        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, Object> entry : config.getObject("logging.levels").unwrapped().entrySet()) {
                context.getLogger(entry.getKey()).setLevel(Level.toLevel(String.valueOf(entry.getValue()), Level.INFO));
            }
        }
    }
}
