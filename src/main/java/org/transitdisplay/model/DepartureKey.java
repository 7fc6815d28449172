package org.transitdisplay.model;

import java.time.OffsetDateTime;

/**
 * Comparison key of a {@link Departure}. Two departures with equal keys are the
 * same physical trip for deduplication and change detection.
 * The upstream trip id is deliberately not part of the key: the API may
 * reissue a new id for the same trip between polls.
 */
public record DepartureKey(String line, OffsetDateTime when, int delayMinutes, Product product) {
}
