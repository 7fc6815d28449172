package org.transitdisplay.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only copy of the latest accepted value per source, taken by the render
 * loop at {@link #takenAt()}. Sources without an accepted value are absent.
 */
public final class Snapshot {

    private final Instant takenAt;
    private final Map<Source<?>, Object> values;

    public Snapshot(Instant takenAt, Map<Source<?>, ?> values) {
        this.takenAt = takenAt;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Instant takenAt() {
        return takenAt;
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(Source<T> source) {
        return Optional.ofNullable((T) values.get(source));
    }

    public Set<Source<?>> sources() {
        return values.keySet();
    }

    @Override
    public String toString() {
        return "Snapshot{takenAt=" + takenAt + ", sources=" + values.keySet() + '}';
    }
}
