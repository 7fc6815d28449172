package org.transitdisplay.interfaces;

import java.time.Duration;

/** Blocking pause used by all loops; replaced by a recording fake in tests. */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = d -> {
        if (!d.isNegative() && !d.isZero()) {
            Thread.sleep(d.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
