package org.transitdisplay.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitdisplay.errors.FetchException;
import org.transitdisplay.interfaces.Fetcher;
import org.transitdisplay.interfaces.RetryExecutor;
import org.transitdisplay.interfaces.Sleeper;

import java.time.Duration;
import java.util.Objects;

/**
 * UntilSuccessRetryExecutor retries a fetch indefinitely with a fixed or
 * escalating delay between attempts.
 * <p>
 * <b>Notes:</b>
 * <ul>
 *   <li>There is no attempt cap; upstream outages are expected to be transient.</li>
 *   <li>The call blocks the calling thread for its whole duration, so it must run on a producer thread.</li>
 *   <li>Interruption is the only exit without a value.</li>
 * </ul>
 */
public final class UntilSuccessRetryExecutor implements RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(UntilSuccessRetryExecutor.class);

    /** Label used in log lines, e.g. the source or station name. */
    private final String name;

    /** Delay before each retry while the failure count is at most {@code escalateAfter}. */
    private final Duration baseDelay;

    /** Number of failures answered with {@code baseDelay}. */
    private final int escalateAfter;

    /** Delay once more than {@code escalateAfter} consecutive failures occurred. */
    private final Duration escalatedDelay;

    private final Sleeper sleeper;

    /**
     * Constructs an executor with escalating delay.
     *
     * @param name           label for log lines
     * @param baseDelay      delay for the first {@code escalateAfter} retries
     * @param escalateAfter  number of failures before switching to {@code escalatedDelay}
     * @param escalatedDelay delay for every later retry
     * @param sleeper        blocking pause
     */
    public UntilSuccessRetryExecutor(String name, Duration baseDelay, int escalateAfter,
                                     Duration escalatedDelay, Sleeper sleeper) {
        this.name = Objects.requireNonNull(name, "name");
        this.baseDelay = nonNegative(baseDelay);
        this.escalateAfter = Math.max(0, escalateAfter);
        this.escalatedDelay = nonNegative(escalatedDelay);
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /** Fixed delay between every retry. */
    public static UntilSuccessRetryExecutor fixed(String name, Duration delay, Sleeper sleeper) {
        return new UntilSuccessRetryExecutor(name, delay, Integer.MAX_VALUE, delay, sleeper);
    }

    @Override
    public <T> T execute(Fetcher<T> op) throws InterruptedException {
        int failures = 0;
        while (true) {
            try {
                return op.fetch();
            } catch (FetchException e) {
                failures++;
                Duration wait = delayFor(failures);
                log.warn("[Retry] {}: fetch failed ({}), attempt {} in {} ms",
                        name, e.getMessage(), failures + 1, wait.toMillis());
                sleeper.sleep(wait);
            }
        }
    }

    /** Delay after the given number of consecutive failures (1-based). */
    Duration delayFor(int failures) {
        return failures > escalateAfter ? escalatedDelay : baseDelay;
    }

    private static Duration nonNegative(Duration d) {
        Objects.requireNonNull(d, "delay");
        return d.isNegative() ? Duration.ZERO : d;
    }
}
