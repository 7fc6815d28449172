package org.transitdisplay.runtime;

import org.transitdisplay.interfaces.Sleeper;
import org.transitdisplay.interfaces.UpdateSignal;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Raises the update signal whenever the wall clock crosses a minute boundary,
 * so the displayed time advances even when no feed changed.
 */
public final class MinuteTicker implements Runnable {

    private final UpdateSignal signal;
    private final Clock clock;
    private final Sleeper sleeper;

    public MinuteTicker(UpdateSignal signal, Clock clock, Sleeper sleeper) {
        this.signal = Objects.requireNonNull(signal, "signal");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    static Duration untilNextMinute(Instant now) {
        Instant next = now.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES);
        return Duration.between(now, next);
    }

    @Override
    public void run() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                sleeper.sleep(untilNextMinute(clock.instant()));
                signal.raise();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
