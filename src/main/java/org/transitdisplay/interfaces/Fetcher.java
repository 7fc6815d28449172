package org.transitdisplay.interfaces;

import org.transitdisplay.errors.FetchException;

/**
 * One fetch attempt against an upstream feed.
 *
 * @param <T> type of the fetched value
 */
@FunctionalInterface
public interface Fetcher<T> {

    /**
     * @return the fetched value, never {@code null} and never an empty collection
     * @throws FetchException on network, status, parse or empty-result failure
     */
    T fetch() throws FetchException;
}
