package org.transitdisplay.util;

import org.transitdisplay.interfaces.UpdateSignal;

import java.time.Duration;

/**
 * Monitor-based, level-triggered update flag.
 * <p>
 * <b>Notes:</b>
 * <ul>
 *   <li>Implements the classic {@code wait/notifyAll()} monitor pattern around a single boolean.</li>
 *   <li>No counting: any number of {@link #raise()} calls before a {@link #drain()} leave exactly one pending wake-up.</li>
 *   <li>A raise is never lost; it stays visible until the consumer drains it.</li>
 * </ul>
 */
public final class CoalescingUpdateSignal implements UpdateSignal {

    /** Monitor object used for coordinating wait/notify among threads. */
    private final Object mon = new Object();

    /** Guarded by {@code mon}. */
    private boolean raised;

    public CoalescingUpdateSignal() {
        this(false);
    }

    /**
     * @param initiallyRaised true to let the consumer's first await return immediately
     */
    public CoalescingUpdateSignal(boolean initiallyRaised) {
        this.raised = initiallyRaised;
    }

    @Override
    public void raise() {
        synchronized (mon) {
            if (!raised) {
                raised = true;
                mon.notifyAll();
            }
        }
    }

    /**
     * Waits until raised or until {@code timeout} elapses, tolerating spurious wake-ups.
     */
    @Override
    public boolean await(Duration timeout) throws InterruptedException {
        long remaining = Math.max(0L, timeout.toNanos());
        long end = System.nanoTime() + remaining;
        synchronized (mon) {
            while (!raised) {
                if (remaining <= 0L) return false;
                long ms = remaining / 1_000_000L;
                int ns = (int) (remaining % 1_000_000L);
                mon.wait(ms, ns);
                remaining = end - System.nanoTime();
            }
            return true;
        }
    }

    @Override
    public boolean drain() {
        synchronized (mon) {
            boolean was = raised;
            raised = false;
            return was;
        }
    }

    @Override
    public boolean isRaised() {
        synchronized (mon) {
            return raised;
        }
    }
}
