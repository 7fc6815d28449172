package org.transitdisplay.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Properties;

/**
 * Runtime settings read from JVM system properties prefixed with
 * {@code transit.}, e.g. {@code -Dtransit.tripIntervalSec=20}. Every key has a
 * default; malformed values fall back to it with a warning.
 */
public final class DisplaySettings {

    private static final Logger log = LoggerFactory.getLogger(DisplaySettings.class);
    static final String PREFIX = "transit.";

    private final Path stationsFile;
    private final Duration tripInterval;
    private final Duration tripRetryDelay;
    private final Duration weatherRetryDelay;
    private final Duration weatherPeriod;
    private final Duration weatherOffset;
    private final Duration weatherFallback;
    private final Duration renderMaxIdle;
    private final boolean watchdogEnabled;
    private final Duration watchdogInterval;
    private final Duration watchdogInitialDelay;
    private final Duration reconnectDelay;
    private final Duration reconnectEscalatedDelay;
    private final int reconnectEscalateAfter;
    private final int reconnectMaxAttempts;
    private final double latitude;
    private final double longitude;
    private final ZoneId zone;

    private DisplaySettings(Properties p) {
        stationsFile = Path.of(p.getProperty(PREFIX + "stationsFile", "stations.json"));
        tripInterval = Duration.ofSeconds(positiveOf(p, "tripIntervalSec", 15));
        tripRetryDelay = Duration.ofSeconds(positiveOf(p, "tripRetrySec", 5));
        weatherRetryDelay = Duration.ofSeconds(positiveOf(p, "weatherRetrySec", 15));
        weatherPeriod = Duration.ofMinutes(positiveOf(p, "weatherPeriodMin", 15));
        weatherOffset = Duration.ofMinutes(longOf(p, "weatherOffsetMin", 1));
        weatherFallback = Duration.ofMinutes(positiveOf(p, "weatherFallbackMin", 15));
        renderMaxIdle = Duration.ofSeconds(positiveOf(p, "renderIdleSec", 15));
        watchdogEnabled = Boolean.parseBoolean(p.getProperty(PREFIX + "watchdogEnabled", "true"));
        watchdogInterval = Duration.ofSeconds(positiveOf(p, "watchdogIntervalSec", 30));
        watchdogInitialDelay = Duration.ofSeconds(longOf(p, "watchdogInitialDelaySec", 60));
        reconnectDelay = Duration.ofSeconds(positiveOf(p, "reconnectDelaySec", 10));
        reconnectEscalatedDelay = Duration.ofSeconds(positiveOf(p, "reconnectEscalatedDelaySec", 60));
        reconnectEscalateAfter = (int) longOf(p, "reconnectEscalateAfter", 10);
        reconnectMaxAttempts = (int) positiveOf(p, "reconnectMaxAttempts", 20);
        latitude = doubleOf(p, "latitude", 52.51356805426098);
        longitude = doubleOf(p, "longitude", 13.32652568167527);
        zone = zoneOf(p.getProperty(PREFIX + "timezone", "Europe/Berlin"));
    }

    public static DisplaySettings fromSystemProperties() {
        return from(System.getProperties());
    }

    public static DisplaySettings from(Properties properties) {
        return new DisplaySettings(properties);
    }

    private static long longOf(Properties p, String key, long def) {
        String raw = p.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) return def;
        try {
            long v = Long.parseLong(raw.trim());
            if (v < 0) {
                log.warn("[Config] {}{}={} is negative, using default {}", PREFIX, key, raw, def);
                return def;
            }
            return v;
        } catch (NumberFormatException e) {
            log.warn("[Config] {}{}={} is not a number, using default {}", PREFIX, key, raw, def);
            return def;
        }
    }

    /** Like {@link #longOf} but zero also falls back to the default. */
    private static long positiveOf(Properties p, String key, long def) {
        long v = longOf(p, key, def);
        if (v == 0) {
            log.warn("[Config] {}{}=0 must be positive, using default {}", PREFIX, key, def);
            return def;
        }
        return v;
    }

    private static double doubleOf(Properties p, String key, double def) {
        String raw = p.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) return def;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("[Config] {}{}={} is not a number, using default {}", PREFIX, key, raw, def);
            return def;
        }
    }

    private static ZoneId zoneOf(String raw) {
        try {
            return ZoneId.of(raw);
        } catch (RuntimeException e) {
            log.warn("[Config] unknown timezone {}, using Europe/Berlin", raw);
            return ZoneId.of("Europe/Berlin");
        }
    }

    public Path stationsFile() { return stationsFile; }
    public Duration tripInterval() { return tripInterval; }
    public Duration tripRetryDelay() { return tripRetryDelay; }
    public Duration weatherRetryDelay() { return weatherRetryDelay; }
    public Duration weatherPeriod() { return weatherPeriod; }
    public Duration weatherOffset() { return weatherOffset; }
    public Duration weatherFallback() { return weatherFallback; }
    public Duration renderMaxIdle() { return renderMaxIdle; }
    public boolean watchdogEnabled() { return watchdogEnabled; }
    public Duration watchdogInterval() { return watchdogInterval; }
    public Duration watchdogInitialDelay() { return watchdogInitialDelay; }
    public Duration reconnectDelay() { return reconnectDelay; }
    public Duration reconnectEscalatedDelay() { return reconnectEscalatedDelay; }
    public int reconnectEscalateAfter() { return reconnectEscalateAfter; }
    public int reconnectMaxAttempts() { return reconnectMaxAttempts; }
    public double latitude() { return latitude; }
    public double longitude() { return longitude; }
    public ZoneId zone() { return zone; }
}
