package org.transitdisplay.errors;

/** The renderer could not publish a snapshot. Not retried. */
public class RenderException extends FatalDisplayException {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
