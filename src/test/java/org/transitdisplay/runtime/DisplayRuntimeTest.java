package org.transitdisplay.runtime;

import org.junit.jupiter.api.Test;
import org.transitdisplay.errors.ReconnectExhaustedException;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DisplayRuntimeTest {

    @Test
    void firstFatalErrorIsReported() throws Exception {
        CountDownLatch idle = new CountDownLatch(1);
        DisplayRuntime runtime = new DisplayRuntime()
                .loop("idle", () -> idle.await())
                .loop("watchdog", () -> { throw new ReconnectExhaustedException(21); });

        runtime.start();
        Throwable fatal = runtime.awaitFatal();

        assertInstanceOf(ReconnectExhaustedException.class, fatal);
        assertTrue(runtime.hasFailed());
        runtime.shutdown();
    }

    @Test
    void interruptionIsNotFatal() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        DisplayRuntime runtime = new DisplayRuntime()
                .loop("sleepy", () -> {
                    started.countDown();
                    Thread.sleep(60_000);
                });
        runtime.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        runtime.shutdown();

        assertFalse(runtime.hasFailed());
        for (Thread t : runtime.threads()) {
            assertFalse(t.isAlive());
            assertTrue(t.isDaemon());
        }
    }

    @Test
    void loopsCannotBeAddedAfterStart() {
        DisplayRuntime runtime = new DisplayRuntime();
        runtime.start();
        assertThrows(IllegalStateException.class, () -> runtime.loop("late", () -> { }));
    }
}
