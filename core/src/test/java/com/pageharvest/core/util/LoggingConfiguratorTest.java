package com.pageharvest.core.util;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingConfiguratorTest {

    @Test
    void parsesSlf4jAndJulLevelNames() {
        assertThat(LoggingConfigurator.parseLevel("debug", Level.INFO)).isEqualTo(Level.FINE);
        assertThat(LoggingConfigurator.parseLevel("WARN", Level.INFO)).isEqualTo(Level.WARNING);
        assertThat(LoggingConfigurator.parseLevel("severe", Level.INFO)).isEqualTo(Level.SEVERE);
        assertThat(LoggingConfigurator.parseLevel("loud", Level.INFO)).isEqualTo(Level.INFO);
        assertThat(LoggingConfigurator.parseLevel(null, Level.CONFIG)).isEqualTo(Level.CONFIG);
    }
}
