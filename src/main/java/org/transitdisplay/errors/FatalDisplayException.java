package org.transitdisplay.errors;

/**
 * Base type for the only conditions allowed to end the process.
 * <p>
 * The runtime records the first one raised by any loop; the entry point then
 * tries to show it on an error screen and exits.
 */
public abstract class FatalDisplayException extends RuntimeException {

    protected FatalDisplayException(String message) {
        super(message);
    }

    protected FatalDisplayException(String message, Throwable cause) {
        super(message, cause);
    }
}
