package org.transitdisplay.errors;

/** Station configuration could not be read or parsed. Absorbed by the loader's fallback. */
public class ConfigLoadException extends Exception {

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
