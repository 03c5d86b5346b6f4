package org.bootc.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private static final Config PLAIN_WARN = ConfigFactory.parseString("""
        logging {
          format = "PLAIN"
          default-level = "WARN"
        }
        """);

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        LoggingConfigurator.configure(PLAIN_WARN);
        LoggingConfigurator.reset();
    }

    private static LoggerContext context() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    @Test
    void configure_withPlainFormat_shouldSelectPlainConsole() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "INFO"
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals("CONSOLE_PLAIN", context().getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        final ch.qos.logback.classic.Logger rootLogger = context().getLogger(Logger.ROOT_LOGGER_NAME);
        assertEquals(Level.INFO, rootLogger.getLevel());
        final Appender<?> appender = rootLogger.getAppender("CONSOLE_PLAIN");
        assertNotNull(appender, "Root logger should write through CONSOLE_PLAIN");
        assertTrue(appender instanceof ConsoleAppender, "CONSOLE_PLAIN appender should be ConsoleAppender");
    }

    @Test
    void configure_withDetailedFormat_shouldSelectDetailedConsole() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "DETAILED"
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals("CONSOLE", context().getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertNotNull(context().getLogger(Logger.ROOT_LOGGER_NAME).getAppender("CONSOLE"));
    }

    @Test
    void configure_withSpecificLoggerLevels_shouldSetLoggerLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "WARN"
              levels {
                "org.bootc.test" = "DEBUG"
                "org.bootc.compiler.backend.toolchain" = "INFO"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(Level.DEBUG, context().getLogger("org.bootc.test").getLevel());
        assertEquals(Level.INFO, context().getLogger("org.bootc.compiler.backend.toolchain").getLevel());

        context().getLogger("org.bootc.test").setLevel(null);
        context().getLogger("org.bootc.compiler.backend.toolchain").setLevel(null);
    }

    @Test
    void configure_withoutLoggingConfig_shouldKeepCurrentSetup() {
        // Given
        final Config config = ConfigFactory.parseString("""
            other {
              some-value = "test"
            }
            """);
        final Level before = context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel();

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(before, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void configure_calledMultipleTimes_shouldBeIdempotent() {
        // Given
        final Config info = ConfigFactory.parseString("logging.default-level = INFO");
        final Config error = ConfigFactory.parseString("logging.default-level = ERROR");

        // When
        LoggingConfigurator.configure(info);
        LoggingConfigurator.configure(error);

        // Then
        assertEquals(Level.INFO, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel(),
            "Second call must not change the configuration");
    }

    @Test
    void setLevel_shouldChangeSingleLogger() {
        LoggingConfigurator.setLevel("org.bootc.sample", Level.TRACE);

        assertEquals(Level.TRACE, context().getLogger("org.bootc.sample").getLevel());

        context().getLogger("org.bootc.sample").setLevel(null);
    }
}
