package org.transitdisplay.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitdisplay.interfaces.FetchSchedule;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

/**
 * AnchoredIntervalSchedule times the next fetch from the upstream's own
 * freshness timestamp instead of wall-clock elapsed time.
 * <p>
 * The next fetch is due at {@code anchor + period + offset}. The offset gives
 * the upstream time to publish its next update before we ask for it.
 * <ul>
 *   <li>An anchor in the future is not trusted: a warning is logged and the fallback is used.</li>
 *   <li>A due time at or before {@code now} (stale data) also yields the fallback, never a zero or negative sleep.</li>
 * </ul>
 */
public final class AnchoredIntervalSchedule<T> implements FetchSchedule<T> {

    private static final Logger log = LoggerFactory.getLogger(AnchoredIntervalSchedule.class);

    private final Function<T, Instant> anchor;
    private final Duration period;
    private final Duration offset;
    private final Duration fallback;

    /**
     * @param anchor   extracts the authoritative timestamp from a fetched value
     * @param period   upstream refresh period, e.g. 15 minutes
     * @param offset   safety offset added to the period, e.g. 1 minute
     * @param fallback positive delay used when the anchor cannot be used
     */
    public AnchoredIntervalSchedule(Function<T, Instant> anchor, Duration period, Duration offset, Duration fallback) {
        this.anchor = Objects.requireNonNull(anchor, "anchor");
        this.period = Objects.requireNonNull(period, "period");
        this.offset = Objects.requireNonNull(offset, "offset");
        if (fallback == null || fallback.isZero() || fallback.isNegative()) {
            throw new IllegalArgumentException("fallback must be positive: " + fallback);
        }
        this.fallback = fallback;
    }

    @Override
    public Duration delayAfter(T fetched, Instant now) {
        Instant ts = anchor.apply(fetched);
        if (ts == null) {
            log.warn("[Schedule] value carries no timestamp; next fetch in {}", fallback);
            return fallback;
        }
        if (ts.isAfter(now)) {
            log.warn("[Schedule] upstream returned data with future timestamp {}; scheduling next fetch for {} ({} from now)",
                    ts, now.plus(fallback), fallback);
            return fallback;
        }

        Instant next = nextDue(ts);
        Duration sleep = Duration.between(now, next);
        if (sleep.isZero() || sleep.isNegative()) {
            log.warn("[Schedule] upstream data from {} is stale (due {}); scheduling next fetch for {}",
                    ts, next, now.plus(fallback));
            return fallback;
        }
        log.info("[Schedule] next fetch scheduled for {}, sleeping {} s", next, sleep.toSeconds());
        return sleep;
    }

    /** Earliest instant a fetch is worthwhile for data stamped {@code ts}. */
    public Instant nextDue(Instant ts) {
        return ts.plus(period).plus(offset);
    }

    @Override
    public Duration fallback() {
        return fallback;
    }
}
