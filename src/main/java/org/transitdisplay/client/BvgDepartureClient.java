package org.transitdisplay.client;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitdisplay.errors.FetchException;
import org.transitdisplay.interfaces.StationDepartureFetcher;
import org.transitdisplay.model.Departure;
import org.transitdisplay.model.DepartureKey;
import org.transitdisplay.model.Product;
import org.transitdisplay.model.Station;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Fetches upcoming departures of one station from the BVG REST API.
 * <p>
 * Cancelled departures are dropped, duplicates (same comparison key) removed
 * and the result sorted by time. An empty result is a failure, never a valid
 * update.
 */
public final class BvgDepartureClient implements StationDepartureFetcher {

    private static final Logger log = LoggerFactory.getLogger(BvgDepartureClient.class);
    private static final Gson GSON = new Gson();

    public static final URI DEFAULT_BASE = URI.create("https://v6.bvg.transport.rest");

    private static final int HTTP_OK_MIN = 200;
    private static final int HTTP_OK_MAX = 299;
    private static final int DURATION_MINUTES = 600;
    private static final int RESULTS = 12;

    private final HttpClient http;
    private final URI base;
    private final Duration timeout;

    public BvgDepartureClient(HttpClient http, URI base, Duration timeout) {
        this.http = http;
        this.base = base;
        this.timeout = timeout;
    }

    public BvgDepartureClient() {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), DEFAULT_BASE, Duration.ofSeconds(20));
    }

    /* ---------------- JSON shape (only the fields we read) ---------------- */

    static final class DeparturesBody {
        List<DepartureJson> departures;
    }

    static final class DepartureJson {
        String tripId;
        String when;
        Integer delay;
        Boolean cancelled;
        LineJson line;
        NamedJson destination;
    }

    static final class LineJson {
        String name;
        String product;
    }

    static final class NamedJson {
        String name;
    }

    @Override
    public List<Departure> fetch(Station station) throws FetchException {
        HttpRequest req = HttpRequest.newBuilder(requestUri(station))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new FetchException(station.name() + ": request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(station.name() + ": request interrupted", e);
        }

        int code = resp.statusCode();
        if (code < HTTP_OK_MIN || code > HTTP_OK_MAX) {
            log.error("[BVG] {}: HTTP error {}", station.name(), code);
            throw new FetchException(station.name() + ": HTTP " + code);
        }
        return parse(resp.body(), station.name());
    }

    /** Builds {@code /stops/{id}/departures} with product flags for the station. */
    URI requestUri(Station station) {
        Map<String, String> q = new LinkedHashMap<>();
        q.put("when", "now");
        q.put("duration", String.valueOf(DURATION_MINUTES));
        q.put("results", String.valueOf(RESULTS));
        q.put("linesOfStops", "false");
        q.put("remarks", "true");
        q.put("language", "de");
        for (Product p : Product.values()) {
            q.put(p.apiName(), String.valueOf(station.wants(p)));
        }
        StringJoiner query = new StringJoiner("&");
        q.forEach((k, v) -> query.add(k + "=" + v));

        String root = base.toString().replaceAll("/+$", "");
        return URI.create(root + "/stops/" + station.stationId() + "/departures?" + query);
    }

    /**
     * Parses a departures payload.
     *
     * @throws FetchException on malformed JSON or if no usable departure remains
     */
    static List<Departure> parse(String body, String stationName) throws FetchException {
        DeparturesBody parsed;
        try {
            parsed = GSON.fromJson(body, DeparturesBody.class);
        } catch (JsonParseException e) {
            throw new FetchException(stationName + ": malformed departures payload", e);
        }
        if (parsed == null || parsed.departures == null) {
            throw new FetchException(stationName + ": payload has no departures field");
        }

        Map<DepartureKey, Departure> unique = new LinkedHashMap<>();
        for (DepartureJson d : parsed.departures) {
            if (d == null || Boolean.TRUE.equals(d.cancelled)) continue;
            Departure dep = toDeparture(d, stationName);
            if (dep != null) {
                unique.putIfAbsent(dep.key(), dep);
            }
        }
        if (unique.isEmpty()) {
            throw new FetchException(stationName + ": received empty departures list");
        }

        List<Departure> out = new ArrayList<>(unique.values());
        out.sort(Comparator.comparing(Departure::when));
        return out;
    }

    /** Maps one entry; entries missing a line, time or known product are skipped. */
    private static Departure toDeparture(DepartureJson d, String stationName) {
        if (d.line == null || d.line.name == null || d.when == null) {
            return null;
        }
        try {
            Product product = Product.fromApiName(d.line.product);
            OffsetDateTime when = OffsetDateTime.parse(d.when);
            int delay = d.delay == null ? 0 : d.delay;
            String destination = destinationLabel(d.line.name, d.destination == null ? null : d.destination.name);
            return new Departure(d.tripId, d.line.name, destination, when, delay, product);
        } catch (IllegalArgumentException | DateTimeParseException e) {
            log.debug("[BVG] {}: skipping departure {}: {}", stationName, d.tripId, e.getMessage());
            return null;
        }
    }

    /** Ring lines get a direction arrow; the city suffix is dropped. */
    static String destinationLabel(String line, String destination) {
        String dest = destination == null ? "" : destination;
        if ("S41".equals(line)) {
            dest = "⟳ " + dest;
        } else if ("S42".equals(line)) {
            dest = "⟲ " + dest;
        }
        return dest.replace("(Berlin)", "").trim();
    }
}
