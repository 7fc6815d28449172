package org.transitdisplay.interfaces;

import java.util.Optional;

/**
 * Decides whether a freshly fetched value is worth publishing.
 *
 * @param <T> value type of the source
 */
@FunctionalInterface
public interface ChangeDetector<T> {

    /**
     * @param previous the currently accepted value, empty if none yet
     * @param fresh    the newly fetched value
     * @return true if {@code fresh} should replace {@code previous}
     */
    boolean changed(Optional<T> previous, T fresh);
}
