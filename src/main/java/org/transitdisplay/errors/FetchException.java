package org.transitdisplay.errors;

/**
 * Transient failure of a single upstream fetch: network error, non-success
 * HTTP status, unparsable payload or an empty result.
 * <p>
 * Always retried by the retry executor; never escapes a producer loop.
 */
public class FetchException extends Exception {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
