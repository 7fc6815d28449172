package org.transitdisplay.client;

import org.junit.jupiter.api.Test;
import org.transitdisplay.TestFakes.RecordingSleeper;
import org.transitdisplay.errors.FetchException;
import org.transitdisplay.interfaces.Sleeper;
import org.transitdisplay.interfaces.StationDepartureFetcher;
import org.transitdisplay.model.Departure;
import org.transitdisplay.model.Product;
import org.transitdisplay.model.Station;
import org.transitdisplay.util.UntilSuccessRetryExecutor;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.transitdisplay.TestFakes.departure;

class MultiStationTripFetcherTest {

    private static final Station ZOO = new Station("Zoo", 1L, EnumSet.of(Product.BUS));
    private static final Station ERP = new Station("Ernst-Reuter-Platz", 2L, EnumSet.of(Product.SUBWAY));

    @Test
    void mergesDeduplicatesAndSortsAcrossStations() throws Exception {
        Map<Long, List<Departure>> byStation = Map.of(
                1L, List.of(departure("a", "M45", "Spandau", 10, 9, 0, Product.BUS),
                        departure("b", "M41", "Hbf", 10, 1, 0, Product.BUS)),
                2L, List.of(departure("c", "U2", "Pankow", 10, 4, 0, Product.SUBWAY),
                        departure("d", "M41", "Hbf", 10, 1, 0, Product.BUS)));
        Set<String> threads = ConcurrentHashMap.newKeySet();
        StationDepartureFetcher f = s -> {
            threads.add(Thread.currentThread().getName());
            return byStation.get(s.stationId());
        };

        RecordingSleeper sleeper = new RecordingSleeper();
        MultiStationTripFetcher fetcher = new MultiStationTripFetcher(List.of(ZOO, ERP), f,
                s -> UntilSuccessRetryExecutor.fixed(s.name(), Duration.ofSeconds(5), sleeper));

        List<Departure> merged = fetcher.fetch();

        assertEquals(List.of("M41", "U2", "M45"), merged.stream().map(Departure::line).toList());
        assertFalse(threads.contains(Thread.currentThread().getName()));
        assertEquals(Set.of("station-fetch-Zoo", "station-fetch-Ernst-Reuter-Platz"), threads);
    }

    @Test
    void eachStationRetriesUntilItSucceeds() throws Exception {
        AtomicInteger zooCalls = new AtomicInteger();
        StationDepartureFetcher f = s -> {
            if (s.equals(ZOO) && zooCalls.incrementAndGet() < 3) {
                throw new FetchException("Zoo: HTTP 503");
            }
            return List.of(departure("x" + s.stationId(), "L" + s.stationId(), "D", 11, 0, 0, Product.BUS));
        };
        RecordingSleeper sleeper = new RecordingSleeper();
        MultiStationTripFetcher fetcher = new MultiStationTripFetcher(List.of(ZOO, ERP), f,
                s -> UntilSuccessRetryExecutor.fixed(s.name(), Duration.ofSeconds(5), sleeper));

        List<Departure> merged = fetcher.fetch();

        assertEquals(2, merged.size());
        assertEquals(3, zooCalls.get());
        assertEquals(2, sleeper.sleeps().size());
    }

    @Test
    void requiresAtLeastOneStation() {
        assertThrows(IllegalArgumentException.class,
                () -> new MultiStationTripFetcher(List.of(), s -> List.of(), s -> null));
    }

    @Test
    void failingStationStopsAndJoinsItsSiblings() throws Exception {
        CountDownLatch siblingRunning = new CountDownLatch(1);
        CountDownLatch siblingDone = new CountDownLatch(1);
        StationDepartureFetcher f = s -> {
            if (s.equals(ERP)) {
                try {
                    siblingRunning.countDown();
                    Thread.sleep(60_000L);
                    return List.of();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new FetchException("interrupted");
                } finally {
                    siblingDone.countDown();
                }
            }
            try {
                siblingRunning.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException("unreadable payload");
        };
        MultiStationTripFetcher fetcher = new MultiStationTripFetcher(List.of(ZOO, ERP), f,
                s -> UntilSuccessRetryExecutor.fixed(s.name(), Duration.ofMillis(10), Sleeper.SYSTEM));

        assertThrows(FetchException.class, fetcher::fetch);

        assertEquals(0, siblingDone.getCount());
    }
}
