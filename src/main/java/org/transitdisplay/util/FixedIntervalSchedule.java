package org.transitdisplay.util;

import org.transitdisplay.interfaces.FetchSchedule;

import java.time.Duration;
import java.time.Instant;

/**
 * FixedIntervalSchedule sleeps a constant interval after every cycle.
 * Immutable and thread-safe.
 */
public final class FixedIntervalSchedule<T> implements FetchSchedule<T> {

    private final Duration interval;

    /**
     * @param interval strictly positive pause between cycles
     */
    public FixedIntervalSchedule(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
        this.interval = interval;
    }

    @Override
    public Duration delayAfter(T fetched, Instant now) {
        return interval;
    }

    @Override
    public Duration fallback() {
        return interval;
    }
}
