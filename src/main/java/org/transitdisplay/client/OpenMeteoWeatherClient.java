package org.transitdisplay.client;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitdisplay.errors.FetchException;
import org.transitdisplay.interfaces.Fetcher;
import org.transitdisplay.model.WeatherReading;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Fetches current and daily weather from the Open-Meteo forecast API.
 * <p>
 * The reading's {@code observedAt} is the server's {@code current.time},
 * a local timestamp in the requested zone. That value, not wall-clock time,
 * drives the weather schedule.
 */
public final class OpenMeteoWeatherClient implements Fetcher<WeatherReading> {

    private static final Logger log = LoggerFactory.getLogger(OpenMeteoWeatherClient.class);
    private static final Gson GSON = new Gson();

    public static final URI DEFAULT_ENDPOINT = URI.create("https://api.open-meteo.com/v1/forecast");

    private final HttpClient http;
    private final URI endpoint;
    private final double latitude;
    private final double longitude;
    private final ZoneId zone;
    private final Duration timeout;

    public OpenMeteoWeatherClient(HttpClient http, URI endpoint, double latitude, double longitude,
                                  ZoneId zone, Duration timeout) {
        this.http = http;
        this.endpoint = endpoint;
        this.latitude = latitude;
        this.longitude = longitude;
        this.zone = zone;
        this.timeout = timeout;
    }

    public OpenMeteoWeatherClient(double latitude, double longitude, ZoneId zone) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                DEFAULT_ENDPOINT, latitude, longitude, zone, Duration.ofSeconds(20));
    }

    static final class ForecastBody {
        Current current;
        Daily daily;
    }

    static final class Current {
        String time;
        @SerializedName("temperature_2m") Double temperature;
        @SerializedName("uv_index") Double uvIndex;
    }

    static final class Daily {
        @SerializedName("temperature_2m_min") List<Double> temperatureMin;
        @SerializedName("temperature_2m_max") List<Double> temperatureMax;
        @SerializedName("uv_index_max") List<Double> uvIndexMax;
    }

    @Override
    public WeatherReading fetch() throws FetchException {
        HttpRequest req = HttpRequest.newBuilder(requestUri())
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new FetchException("weather request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("weather request interrupted", e);
        }
        if (resp.statusCode() / 100 != 2) {
            throw new FetchException("weather HTTP " + resp.statusCode());
        }
        WeatherReading reading = parse(resp.body(), zone);
        log.info("[Weather] successfully fetched new weather data stamped {}", reading.observedAt());
        return reading;
    }

    URI requestUri() {
        String q = String.format(Locale.ROOT,
                "latitude=%s&longitude=%s&timezone=%s&current=temperature_2m,uv_index"
                        + "&daily=temperature_2m_min,temperature_2m_max,uv_index_max&forecast_days=1",
                latitude, longitude, zone.getId().replace("/", "%2F"));
        return URI.create(endpoint + "?" + q);
    }

    /**
     * Parses a forecast payload; values are rounded to one decimal.
     *
     * @throws FetchException if the payload is malformed or misses a field
     */
    static WeatherReading parse(String body, ZoneId zone) throws FetchException {
        ForecastBody b;
        try {
            b = GSON.fromJson(body, ForecastBody.class);
        } catch (JsonParseException e) {
            throw new FetchException("malformed weather payload", e);
        }
        if (b == null || b.current == null || b.daily == null) {
            throw new FetchException("weather payload misses current or daily section");
        }
        if (b.current.time == null) {
            throw new FetchException("weather payload misses current.time");
        }
        Instant observedAt;
        try {
            observedAt = LocalDateTime.parse(b.current.time).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new FetchException("weather payload has no valid current.time: " + b.current.time, e);
        }
        return new WeatherReading(
                observedAt,
                round1(required(b.current.temperature, "current.temperature_2m")),
                round1(required(b.current.uvIndex, "current.uv_index")),
                round1(first(b.daily.temperatureMin, "daily.temperature_2m_min")),
                round1(first(b.daily.temperatureMax, "daily.temperature_2m_max")),
                round1(first(b.daily.uvIndexMax, "daily.uv_index_max")));
    }

    private static double required(Double v, String field) throws FetchException {
        if (v == null) throw new FetchException("weather payload misses " + field);
        return v;
    }

    private static double first(List<Double> values, String field) throws FetchException {
        if (values == null || values.isEmpty()) throw new FetchException("weather payload misses " + field);
        return required(values.get(0), field);
    }

    static double round1(double v) {
        return BigDecimal.valueOf(v).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
