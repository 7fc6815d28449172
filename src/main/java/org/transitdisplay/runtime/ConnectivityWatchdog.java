package org.transitdisplay.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitdisplay.errors.FetchException;
import org.transitdisplay.errors.ReconnectExhaustedException;
import org.transitdisplay.interfaces.NetworkLink;
import org.transitdisplay.interfaces.Sleeper;

import java.time.Duration;
import java.util.Objects;

/**
 * Watches network reachability and drives a bounded reconnection procedure.
 * <p>
 * Two states, {@link State#CONNECTED} and {@link State#DISCONNECTED}. A failed
 * probe starts the procedure: reconnect, re-probe, wait, with the wait
 * escalating after {@link ReconnectPolicy#escalateAfter()} attempts. A failed
 * attempt beyond {@link ReconnectPolicy#maxAttempts()} is fatal.
 * The watchdog never touches the shared state store.
 */
public final class ConnectivityWatchdog {

    private static final Logger log = LoggerFactory.getLogger(ConnectivityWatchdog.class);

    public enum State { CONNECTED, DISCONNECTED }

    /**
     * @param delay          wait after each of the first {@code escalateAfter} failed attempts
     * @param escalateAfter  attempts answered with {@code delay}
     * @param escalatedDelay wait after every later failed attempt
     * @param maxAttempts    failed attempts tolerated before giving up
     */
    public record ReconnectPolicy(Duration delay, int escalateAfter, Duration escalatedDelay, int maxAttempts) {

        public ReconnectPolicy {
            Objects.requireNonNull(delay, "delay");
            Objects.requireNonNull(escalatedDelay, "escalatedDelay");
            if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        }

        public static ReconnectPolicy defaults() {
            return new ReconnectPolicy(Duration.ofSeconds(10), 10, Duration.ofSeconds(60), 20);
        }

        /** Wait after the given failed attempt (1-based). */
        public Duration delayAfter(int attempt) {
            return attempt > escalateAfter ? escalatedDelay : delay;
        }
    }

    private final NetworkLink link;
    private final Duration interval;
    private final Duration initialDelay;
    private final ReconnectPolicy policy;
    private final Sleeper sleeper;

    private volatile State state = State.CONNECTED;

    public ConnectivityWatchdog(NetworkLink link, Duration interval, Duration initialDelay,
                                ReconnectPolicy policy, Sleeper sleeper) {
        this.link = Objects.requireNonNull(link, "link");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public State state() {
        return state;
    }

    /**
     * Probes once and, if the link is down, runs the reconnection procedure.
     *
     * @return the state after the check
     * @throws ReconnectExhaustedException if reconnection failed too often
     */
    public State checkOnce() throws InterruptedException {
        if (link.isConnected()) {
            state = State.CONNECTED;
            return state;
        }
        log.error("[Watchdog] connectivity test indicated lost connection, attempting to reconnect");
        state = State.DISCONNECTED;
        reconnect();
        return state;
    }

    /**
     * Bounded reconnection. Returns once the link is back.
     *
     * @return number of attempts it took
     */
    int reconnect() throws InterruptedException {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                link.reconnect();
            } catch (FetchException e) {
                log.error("[Watchdog] reconnect attempt {} failed: {}", attempt, e.getMessage());
            }
            if (link.isConnected()) {
                state = State.CONNECTED;
                log.info("[Watchdog] connection reestablished after {} attempt(s)", attempt);
                return attempt;
            }
            if (attempt > policy.maxAttempts()) {
                log.error("[Watchdog] giving up after {} failed reconnect attempts", attempt);
                throw new ReconnectExhaustedException(attempt);
            }
            Duration wait = policy.delayAfter(attempt);
            log.warn("[Watchdog] still disconnected after attempt {}, retrying in {} s", attempt, wait.toSeconds());
            sleeper.sleep(wait);
        }
    }

    /**
     * Probes every {@code interval} after an initial delay, until interrupted
     * or until reconnection is exhausted.
     */
    public void run() throws InterruptedException {
        log.info("[Watchdog] first connectivity check in {} s", initialDelay.toSeconds());
        sleeper.sleep(initialDelay);
        while (!Thread.currentThread().isInterrupted()) {
            checkOnce();
            sleeper.sleep(interval);
        }
        throw new InterruptedException("watchdog interrupted");
    }
}
