package org.transitdisplay.interfaces;

import org.transitdisplay.errors.FetchException;
import org.transitdisplay.model.Departure;
import org.transitdisplay.model.Station;

import java.util.List;

/** Fetches departures for one station. Must fail rather than return an empty list. */
@FunctionalInterface
public interface StationDepartureFetcher {

    List<Departure> fetch(Station station) throws FetchException;
}
