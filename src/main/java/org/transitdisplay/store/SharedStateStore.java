package org.transitdisplay.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitdisplay.interfaces.SharedCell;
import org.transitdisplay.model.Snapshot;
import org.transitdisplay.model.Source;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest accepted value per source, one {@link LockedCell} each.
 * <p>
 * Each source has exactly one writer, handed out once by
 * {@link #claimWriter(Source)}. Anyone may read. A {@link #snapshot(Instant)}
 * reads every cell under that cell's own lock; it is not atomic across sources.
 */
public class SharedStateStore {

    private static final Logger log = LoggerFactory.getLogger(SharedStateStore.class);

    private final ConcurrentHashMap<Source<?>, LockedCell<?>> cells = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Source<?>, Boolean> writers = new ConcurrentHashMap<>();

    /**
     * Registers a source. Idempotent.
     */
    public <T> void register(Source<T> source) {
        cells.computeIfAbsent(source, k -> new LockedCell<>());
    }

    /**
     * Hands out the write side of a source's cell, registering it if needed.
     *
     * @throws IllegalStateException if a writer was already claimed for this source
     */
    public <T> SharedCell<T> claimWriter(Source<T> source) {
        register(source);
        if (writers.putIfAbsent(source, Boolean.TRUE) != null) {
            throw new IllegalStateException("writer already claimed for source " + source);
        }
        log.debug("[Store] writer claimed for {}", source);
        return cell(source);
    }

    public <T> Optional<T> read(Source<T> source) {
        LockedCell<T> c = cellOrNull(source);
        return c == null ? Optional.empty() : c.get();
    }

    /** Copies every registered source that holds a value. */
    public Snapshot snapshot(Instant now) {
        Map<Source<?>, Object> out = new LinkedHashMap<>();
        cells.forEach((source, cell) -> cell.get().ifPresent(v -> out.put(source, v)));
        return new Snapshot(now, out);
    }

    private <T> LockedCell<T> cell(Source<T> source) {
        LockedCell<T> c = cellOrNull(source);
        if (c == null) {
            throw new IllegalStateException("unknown source " + source);
        }
        return c;
    }

    @SuppressWarnings("unchecked")
    private <T> LockedCell<T> cellOrNull(Source<T> source) {
        return (LockedCell<T>) cells.get(source);
    }
}
