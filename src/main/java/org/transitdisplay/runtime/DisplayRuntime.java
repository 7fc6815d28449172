package org.transitdisplay.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitdisplay.errors.FatalDisplayException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Owns the long-lived loop threads: one per producer, the minute ticker, the
 * watchdog and the render consumer. All are started once and live for the
 * process lifetime.
 * <p>
 * The first {@link FatalDisplayException} raised by any loop is recorded and
 * returned by {@link #awaitFatal()}. Any other throwable escaping a loop is
 * treated the same way, since a loop that stopped would freeze the display.
 */
public final class DisplayRuntime {

    private static final Logger log = LoggerFactory.getLogger(DisplayRuntime.class);

    /** Body of a loop thread. */
    @FunctionalInterface
    public interface LoopBody {
        void run() throws InterruptedException;
    }

    private final List<Thread> threads = new ArrayList<>();
    private final CompletableFuture<Throwable> fatal = new CompletableFuture<>();
    private volatile boolean started;

    /** Adds a loop to be started by {@link #start()}. */
    public DisplayRuntime loop(String name, LoopBody body) {
        if (started) {
            throw new IllegalStateException("runtime already started");
        }
        Thread t = new Thread(() -> runGuarded(name, body), name);
        t.setDaemon(true);
        threads.add(t);
        return this;
    }

    public synchronized void start() {
        if (started) return;
        started = true;
        for (Thread t : threads) {
            t.start();
            log.info("[Runtime] started {}", t.getName());
        }
    }

    /** Blocks until some loop fails fatally and returns that failure. */
    public Throwable awaitFatal() throws InterruptedException {
        try {
            return fatal.get();
        } catch (ExecutionException e) {
            return e.getCause();
        }
    }

    public boolean hasFailed() {
        return fatal.isDone();
    }

    /** Interrupts every loop and waits briefly for them to exit. */
    public void shutdown() throws InterruptedException {
        for (Thread t : threads) {
            t.interrupt();
        }
        for (Thread t : threads) {
            t.join(1000L);
        }
    }

    List<Thread> threads() {
        return Collections.unmodifiableList(threads);
    }

    private void runGuarded(String name, LoopBody body) {
        try {
            body.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("[Runtime] {} interrupted", name);
        } catch (FatalDisplayException e) {
            log.error("[Runtime] {} failed fatally: {}", name, e.getMessage(), e);
            fatal.complete(e);
        } catch (RuntimeException | Error e) {
            log.error("[Runtime] {} stopped unexpectedly", name, e);
            fatal.complete(e);
        }
    }
}
