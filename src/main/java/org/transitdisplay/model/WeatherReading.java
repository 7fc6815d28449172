package org.transitdisplay.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Current and daily weather values. Record equality is structural, so any
 * single changed field makes a new reading count as an update.
 *
 * @param observedAt server-attributed time of the reading, used for scheduling
 */
public record WeatherReading(Instant observedAt,
                             double temperature,
                             double uvIndex,
                             double temperatureDailyMin,
                             double temperatureDailyMax,
                             double uvIndexDailyMax) {

    public WeatherReading {
        Objects.requireNonNull(observedAt, "observedAt");
    }
}
