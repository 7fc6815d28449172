package org.transitdisplay.model;

import java.util.List;
import java.util.Objects;

/**
 * Typed identifier of one independently scheduled feed. Identity is the name.
 *
 * @param <T> type of the value the feed produces
 */
public final class Source<T> {

    public static final Source<List<Departure>> TRIPS = new Source<>("trips");
    public static final Source<WeatherReading> WEATHER = new Source<>("weather");

    private final String name;

    private Source(String name) {
        this.name = name;
    }

    public static <T> Source<T> named(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("source name must not be blank");
        }
        return new Source<>(name);
    }

    public String name() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Source)) return false;
        return name.equals(((Source<?>) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
