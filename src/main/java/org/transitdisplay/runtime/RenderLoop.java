package org.transitdisplay.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitdisplay.errors.RenderException;
import org.transitdisplay.interfaces.Renderer;
import org.transitdisplay.interfaces.UpdateSignal;
import org.transitdisplay.model.Snapshot;
import org.transitdisplay.store.SharedStateStore;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * The single consumer: waits on the update signal, snapshots the store and
 * hands the snapshot to the renderer.
 * <p>
 * The signal is drained before the snapshot is taken, so a change published
 * while rendering stays pending for the next iteration instead of being lost.
 * The bounded wait guarantees a render at least every {@code maxIdle} even
 * without any source activity.
 */
public final class RenderLoop {

    private static final Logger log = LoggerFactory.getLogger(RenderLoop.class);

    private final SharedStateStore store;
    private final UpdateSignal signal;
    private final Renderer renderer;
    private final Duration maxIdle;
    private final Clock clock;

    public RenderLoop(SharedStateStore store, UpdateSignal signal, Renderer renderer, Duration maxIdle, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.signal = Objects.requireNonNull(signal, "signal");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        if (maxIdle == null || maxIdle.isNegative() || maxIdle.isZero()) {
            throw new IllegalArgumentException("maxIdle must be positive: " + maxIdle);
        }
        this.maxIdle = maxIdle;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * One iteration: bounded wait, drain, snapshot, render.
     *
     * @return the snapshot that was rendered
     * @throws RenderException if the renderer failed; not retried here
     */
    public Snapshot renderOnce() throws InterruptedException {
        boolean woken = signal.await(maxIdle);
        signal.drain();

        Snapshot snapshot = store.snapshot(clock.instant());
        log.debug("[Render] {} ({})", snapshot, woken ? "update" : "idle timeout");
        renderer.render(snapshot);
        return snapshot;
    }

    /**
     * Renders until interrupted. A {@link RenderException} ends the loop and
     * propagates to the caller.
     */
    public void run() throws InterruptedException {
        log.info("[Render] consumer loop started, max idle {}", maxIdle);
        while (!Thread.currentThread().isInterrupted()) {
            renderOnce();
        }
        throw new InterruptedException("render loop interrupted");
    }
}
