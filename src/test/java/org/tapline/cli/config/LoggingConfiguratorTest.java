package org.tapline.cli.config;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

import com.typesafe.config.ConfigFactory;

/**
 * Tests that the {@code logging} section is applied to Logback.
 */
class LoggingConfiguratorTest {

    private LoggerContext context;
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger("org.tapline.compiler.Watching").setLevel(null);
        context.getLogger("org.tapline.watch").setLevel(null);
    }

    @Test
    @Tag("unit")
    void testConfigure_SetsRootAndLoggerLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging { default-level = \"ERROR\"\n"
                        + "levels { \"org.tapline.compiler.Watching\" = \"TRACE\", org.tapline.watch = \"debug\" } }"));

        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.TRACE, context.getLogger("org.tapline.compiler.Watching").getLevel());
        assertEquals(Level.DEBUG, context.getLogger("org.tapline.watch").getLevel());
    }

    @Test
    @Tag("unit")
    void testConfigure_UnknownLevelRejected() {
        assertThatThrownBy(() -> LoggingConfigurator.configure(
                ConfigFactory.parseString("logging.default-level = \"LOUD\"")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("LOUD");
    }
}
