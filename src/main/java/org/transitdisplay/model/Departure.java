package org.transitdisplay.model;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * One upcoming departure at a station. Immutable.
 *
 * @param tripId       upstream trip identifier, volatile between polls
 * @param line         line designator, e.g. {@code M41}
 * @param destination  display text of the destination
 * @param when         scheduled time including delay, as reported upstream
 * @param delaySeconds signed delay, 0 when unknown
 * @param product      service category
 */
public record Departure(String tripId,
                        String line,
                        String destination,
                        OffsetDateTime when,
                        int delaySeconds,
                        Product product) {

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    public Departure {
        Objects.requireNonNull(line, "line");
        Objects.requireNonNull(when, "when");
        Objects.requireNonNull(product, "product");
        destination = destination == null ? "" : destination;
    }

    /** Delay in whole minutes, truncated towards zero. */
    public int delayMinutes() {
        return delaySeconds / 60;
    }

    /** {@code +3}, {@code -1} or empty for no delay. */
    public String delayLabel() {
        int m = delayMinutes();
        if (m == 0) return "";
        return m > 0 ? "+" + m : String.valueOf(m);
    }

    public String timeLabel() {
        return when.format(HH_MM);
    }

    /** Key used for dedup and change detection; ignores {@link #tripId()} and {@link #destination()}. */
    public DepartureKey key() {
        return new DepartureKey(line, when.truncatedTo(ChronoUnit.MINUTES), delayMinutes(), product);
    }
}
