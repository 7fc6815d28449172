package org.transitdisplay.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitdisplay.interfaces.ChangeDetector;
import org.transitdisplay.interfaces.FetchSchedule;
import org.transitdisplay.interfaces.Fetcher;
import org.transitdisplay.interfaces.RetryExecutor;
import org.transitdisplay.interfaces.SharedCell;
import org.transitdisplay.interfaces.Sleeper;
import org.transitdisplay.interfaces.UpdateSignal;
import org.transitdisplay.model.Source;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Refresh loop of one source: fetch until success, publish if changed, sleep
 * as the schedule says, repeat.
 * <p>
 * The loop is the only writer of its source's cell, so the read-compare-write
 * in {@link #runCycle()} needs no lock beyond the cell's own.
 */
public final class ProducerLoop<T> implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ProducerLoop.class);

    private final Source<T> source;
    private final Fetcher<T> fetcher;
    private final RetryExecutor retry;
    private final ChangeDetector<T> detector;
    private final SharedCell<T> cell;
    private final UpdateSignal signal;
    private final FetchSchedule<T> schedule;
    private final Clock clock;
    private final Sleeper sleeper;

    public ProducerLoop(Source<T> source,
                        Fetcher<T> fetcher,
                        RetryExecutor retry,
                        ChangeDetector<T> detector,
                        SharedCell<T> cell,
                        UpdateSignal signal,
                        FetchSchedule<T> schedule,
                        Clock clock,
                        Sleeper sleeper) {
        this.source = Objects.requireNonNull(source, "source");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.retry = Objects.requireNonNull(retry, "retry");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.cell = Objects.requireNonNull(cell, "cell");
        this.signal = Objects.requireNonNull(signal, "signal");
        this.schedule = Objects.requireNonNull(schedule, "schedule");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * One fetch-and-publish cycle without the trailing sleep.
     *
     * @return the outcome, including the delay until the next cycle
     */
    public Cycle runCycle() throws InterruptedException {
        T fresh = retry.execute(fetcher);

        Optional<T> previous = cell.get();
        boolean changed = detector.changed(previous, fresh);
        if (changed) {
            cell.set(fresh);
            signal.raise();
            log.info("[{}] new value published", source);
        } else {
            log.debug("[{}] fetched value unchanged", source);
        }
        return new Cycle(changed, schedule.delayAfter(fresh, clock.instant()));
    }

    /**
     * Runs cycles until the thread is interrupted. Unexpected runtime errors
     * are logged and the cycle is retried after the schedule's fallback delay.
     */
    @Override
    public void run() {
        log.info("[{}] producer loop started", source);
        try {
            while (!Thread.currentThread().isInterrupted()) {
                Duration next;
                try {
                    next = runCycle().nextDelay();
                } catch (RuntimeException e) {
                    next = schedule.fallback();
                    log.error("[{}] unexpected failure in refresh cycle, retrying in {}", source, next, e);
                }
                sleeper.sleep(next);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[{}] producer loop stopped", source);
    }

    public Source<T> source() {
        return source;
    }

    /** Result of one cycle. */
    public record Cycle(boolean published, Duration nextDelay) {
    }
}
