package org.transitdisplay.interfaces;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides how long a producer loop sleeps after a completed cycle.
 *
 * @param <T> value type of the source
 */
public interface FetchSchedule<T> {

    /**
     * @param fetched value returned by the last successful fetch
     * @param now     current wall-clock time
     * @return a strictly positive delay until the next fetch attempt
     */
    Duration delayAfter(T fetched, Instant now);

    /** Delay used when no better information is available. */
    Duration fallback();
}
