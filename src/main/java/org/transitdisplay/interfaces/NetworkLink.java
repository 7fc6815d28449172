package org.transitdisplay.interfaces;

import org.transitdisplay.errors.FetchException;

/** Network reachability probe and reconnect command used by the watchdog. */
public interface NetworkLink {

    boolean isConnected();

    /** @throws FetchException if the reconnect command itself failed */
    void reconnect() throws FetchException;
}
