package org.transitdisplay.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class DisplaySettingsTest {

    @Test
    void defaults() {
        DisplaySettings s = DisplaySettings.from(new Properties());

        assertEquals(Duration.ofSeconds(15), s.tripInterval());
        assertEquals(Duration.ofSeconds(5), s.tripRetryDelay());
        assertEquals(Duration.ofSeconds(15), s.weatherRetryDelay());
        assertEquals(Duration.ofMinutes(15), s.weatherPeriod());
        assertEquals(Duration.ofMinutes(1), s.weatherOffset());
        assertEquals(Duration.ofSeconds(30), s.watchdogInterval());
        assertEquals(Duration.ofSeconds(60), s.watchdogInitialDelay());
        assertEquals(20, s.reconnectMaxAttempts());
        assertEquals(10, s.reconnectEscalateAfter());
        assertTrue(s.watchdogEnabled());
        assertEquals(ZoneId.of("Europe/Berlin"), s.zone());
    }

    @Test
    void overridesAndBadValues() {
        Properties p = new Properties();
        p.setProperty("transit.tripIntervalSec", "20");
        p.setProperty("transit.tripRetrySec", "soon");
        p.setProperty("transit.reconnectMaxAttempts", "-3");
        p.setProperty("transit.watchdogEnabled", "false");
        p.setProperty("transit.timezone", "Mars/Olympus");

        DisplaySettings s = DisplaySettings.from(p);

        assertEquals(Duration.ofSeconds(20), s.tripInterval());
        assertEquals(Duration.ofSeconds(5), s.tripRetryDelay());
        assertEquals(20, s.reconnectMaxAttempts());
        assertFalse(s.watchdogEnabled());
        assertEquals(ZoneId.of("Europe/Berlin"), s.zone());
    }

    @Test
    void zeroFallsBackWhereAPauseMustBePositive() {
        Properties p = new Properties();
        p.setProperty("transit.tripIntervalSec", "0");
        p.setProperty("transit.tripRetrySec", "0");
        p.setProperty("transit.renderIdleSec", "0");
        p.setProperty("transit.watchdogIntervalSec", "0");
        p.setProperty("transit.reconnectMaxAttempts", "0");
        p.setProperty("transit.weatherOffsetMin", "0");
        p.setProperty("transit.watchdogInitialDelaySec", "0");

        DisplaySettings s = DisplaySettings.from(p);

        assertEquals(Duration.ofSeconds(15), s.tripInterval());
        assertEquals(Duration.ofSeconds(5), s.tripRetryDelay());
        assertEquals(Duration.ofSeconds(15), s.renderMaxIdle());
        assertEquals(Duration.ofSeconds(30), s.watchdogInterval());
        assertEquals(20, s.reconnectMaxAttempts());
        assertEquals(Duration.ZERO, s.weatherOffset());
        assertEquals(Duration.ZERO, s.watchdogInitialDelay());
    }
}
