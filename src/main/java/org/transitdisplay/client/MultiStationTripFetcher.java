package org.transitdisplay.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitdisplay.errors.FetchException;
import org.transitdisplay.interfaces.Fetcher;
import org.transitdisplay.interfaces.RetryExecutor;
import org.transitdisplay.interfaces.StationDepartureFetcher;
import org.transitdisplay.model.Departure;
import org.transitdisplay.model.DepartureKey;
import org.transitdisplay.model.Station;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Fetches all configured stations concurrently and merges the results.
 * <p>
 * One transient worker per station, each running its own retry-until-success,
 * all shut down and joined before {@link #fetch()} returns, also when one of
 * them failed. Merged departures are deduplicated by {@link Departure#key()}
 * and sorted by time.
 */
public final class MultiStationTripFetcher implements Fetcher<List<Departure>> {

    private static final Logger log = LoggerFactory.getLogger(MultiStationTripFetcher.class);

    private static final Duration WORKER_JOIN_TIMEOUT = Duration.ofSeconds(5);

    private final List<Station> stations;
    private final StationDepartureFetcher stationFetcher;
    private final Function<Station, RetryExecutor> retryFor;

    /**
     * @param stations       configured stations, at least one
     * @param stationFetcher single-station fetch
     * @param retryFor       retry policy per station (named after it for logging)
     */
    public MultiStationTripFetcher(List<Station> stations,
                                   StationDepartureFetcher stationFetcher,
                                   Function<Station, RetryExecutor> retryFor) {
        if (stations == null || stations.isEmpty()) {
            throw new IllegalArgumentException("at least one station required");
        }
        this.stations = List.copyOf(stations);
        this.stationFetcher = Objects.requireNonNull(stationFetcher, "stationFetcher");
        this.retryFor = Objects.requireNonNull(retryFor, "retryFor");
    }

    @Override
    public List<Departure> fetch() throws FetchException {
        ExecutorService pool = Executors.newFixedThreadPool(stations.size(), r -> {
            Thread t = new Thread(r, "station-fetch");
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<List<Departure>>> futures = new ArrayList<>();
            for (Station s : stations) {
                RetryExecutor retry = retryFor.apply(s);
                futures.add(pool.submit(() -> {
                    Thread.currentThread().setName("station-fetch-" + s.name());
                    return retry.execute(() -> stationFetcher.fetch(s));
                }));
            }

            List<Departure> all = new ArrayList<>();
            for (Future<List<Departure>> f : futures) {
                all.addAll(f.get());
            }
            List<Departure> merged = merge(all);
            if (merged.isEmpty()) {
                throw new FetchException("no departures from any station");
            }
            log.debug("[Trips] fetched {} departures from {} station(s)", merged.size(), stations.size());
            return merged;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("station fetch interrupted", e);
        } catch (ExecutionException e) {
            throw new FetchException("station fetch failed: " + e.getCause(), e.getCause());
        } finally {
            pool.shutdownNow();
            awaitWorkers(pool);
        }
    }

    /** Joins the workers after {@code shutdownNow()}; none may outlive the fetch. */
    private void awaitWorkers(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(WORKER_JOIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[Trips] station workers still running {} after shutdown", WORKER_JOIN_TIMEOUT);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Deduplicates by comparison key, keeping the first occurrence, then sorts by time. */
    static List<Departure> merge(List<Departure> departures) {
        Map<DepartureKey, Departure> unique = new LinkedHashMap<>();
        for (Departure d : departures) {
            unique.putIfAbsent(d.key(), d);
        }
        List<Departure> out = new ArrayList<>(unique.values());
        out.sort(Comparator.comparing(Departure::when));
        return List.copyOf(out);
    }
}
