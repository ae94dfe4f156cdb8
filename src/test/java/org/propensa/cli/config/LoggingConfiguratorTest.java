package org.propensa.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LoggingConfiguratorTest {

    private static final String LOGGER = "org.propensa.sample";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private final Level rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();

    @AfterEach
    void restore() {
        context.getLogger(LOGGER).setLevel(null);
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
    }

    @Test
    void appliesDefaultAndPerLoggerLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString("""
            logging {
              default-level = ERROR
              levels { "org.propensa.sample" = TRACE }
            }
            """));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger(LOGGER).getLevel()).isEqualTo(Level.TRACE);
    }

    @Test
    void missingBlockChangesNothing() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(rootLevel);
        assertThat(context.getLogger(LOGGER).getLevel()).isNull();
    }
}
