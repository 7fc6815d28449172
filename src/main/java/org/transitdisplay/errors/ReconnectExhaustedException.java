package org.transitdisplay.errors;

/** The connectivity watchdog gave up after too many failed reconnection attempts. */
public class ReconnectExhaustedException extends FatalDisplayException {

    private final int attempts;

    public ReconnectExhaustedException(int attempts) {
        super("Max retries (" + attempts + ") exceeded for network reconnect");
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
