package org.kaleidoscope.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.kaleidoscope.junit.extensions.logging.ExpectLog;
import org.kaleidoscope.junit.extensions.logging.LogLevel;
import org.kaleidoscope.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the LoggingConfigurator class. Only levels are touched here; the PLAIN format
 * is what logback.xml starts with, so no reload happens.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private static final String TEST_LOGGER = "org.kaleidoscope.test.configured";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger(TEST_LOGGER).setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void configure_withLevels_shouldSetRootAndNamedLoggers() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "ERROR"
              levels {
                "org.kaleidoscope.test.configured" = "TRACE"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger(TEST_LOGGER).getLevel()).isEqualTo(Level.TRACE);
    }

    @Test
    void configure_calledTwice_shouldApplyOnlyFirst() {
        // Given
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"ERROR\""));

        // When
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"DEBUG\""));

        // Then
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void configure_withoutLoggingSection_shouldKeepLevels() {
        // When
        LoggingConfigurator.configure(ConfigFactory.empty());

        // Then
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(originalRootLevel);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Ignoring unknown level 'LOUD'.*")
    void configure_withUnknownLevel_shouldWarnAndSkip() {
        // Given
        final Config config = ConfigFactory.parseString(
                "logging.levels { \"org.kaleidoscope.test.configured\" = \"LOUD\" }");

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertThat(context.getLogger(TEST_LOGGER).getLevel()).isNull();
    }
}
