package com.doccrawler.app.logging;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.assertj.core.api.Assertions.assertThat;

class LogSetupTest {

    @Test
    void level_names_fall_back_to_info() {
        assertThat(LogSetup.levelOf("fine")).isEqualTo(Level.FINE);
        assertThat(LogSetup.levelOf(" WARNING ")).isEqualTo(Level.WARNING);
        assertThat(LogSetup.levelOf("loud")).isEqualTo(Level.INFO);
        assertThat(LogSetup.levelOf(null)).isEqualTo(Level.INFO);
    }

    @Test
    void line_format_has_level_logger_and_stack() {
        LogRecord r = new LogRecord(Level.WARNING, "robots {0} failed");
        r.setParameters(new Object[]{"https://docs.test/robots.txt"});
        r.setLoggerName("com.doccrawler.core.crawler.robots.RobotsGate");
        r.setThrown(new IllegalStateException("boom"));

        String line = new LogSetup.LineFormatter().format(r);

        assertThat(line).contains("[WARNING]", "com.doccrawler.core.crawler.robots.RobotsGate",
                "robots https://docs.test/robots.txt failed", "IllegalStateException: boom");
    }
}
