package org.transitdisplay.interfaces;

public interface RetryExecutor {
    /**
     * Runs the fetcher until it succeeds.
     * @param op  one fetch attempt; a FetchException triggers a delayed retry
     * @param <T> result type
     * @return the first successful result
     * @throws InterruptedException if the calling thread is interrupted while waiting to retry
     */
    <T> T execute(Fetcher<T> op) throws InterruptedException;
}
