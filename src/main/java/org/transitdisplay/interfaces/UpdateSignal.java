package org.transitdisplay.interfaces;

import java.time.Duration;

/**
 * Level-triggered wake-up flag between producers and the render loop.
 * Usage:
 *  - Producer after publishing a change:  signal.raise();
 *  - Consumer each iteration:             signal.await(timeout); signal.drain(); render...
 * Raises before a drain coalesce into one pending wake-up.
 */
public interface UpdateSignal {

    /** Sets the flag and wakes the waiting consumer. Safe from any thread. */
    void raise();

    /**
     * Blocks until the flag is raised or the timeout expires. Does not clear the flag.
     * @return true if raised; false on timeout
     */
    boolean await(Duration timeout) throws InterruptedException;

    /**
     * Clears the flag.
     * @return whether it was raised
     */
    boolean drain();

    boolean isRaised();
}
