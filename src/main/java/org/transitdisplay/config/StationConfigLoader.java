package org.transitdisplay.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitdisplay.errors.ConfigLoadException;
import org.transitdisplay.model.Product;
import org.transitdisplay.model.Station;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the ordered station list from a JSON file:
 * <pre>
 * {"stations": [{"name": "Zoologischer Garten", "stationID": 900023201, "fetch_products": ["bus"]}]}
 * </pre>
 * Loaded once at startup. Any failure falls back to {@link #DEFAULT_STATIONS}.
 */
public final class StationConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(StationConfigLoader.class);
    private static final Gson gson = new GsonBuilder().create();

    public static final List<Station> DEFAULT_STATIONS =
            List.of(new Station("Zoologischer Garten", 900023201L, EnumSet.of(Product.BUS)));

    private StationConfigLoader() {}

    /** JSON shape of the config file. */
    static final class StationsFile {
        List<StationEntry> stations;
    }

    static final class StationEntry {
        String name;
        @SerializedName("stationID") Long stationId;
        @SerializedName("fetch_products") List<String> fetchProducts;
    }

    /**
     * Strict load.
     *
     * @throws ConfigLoadException if the file is missing, unreadable, malformed or lists no station
     */
    public static List<Station> load(Path file) throws ConfigLoadException {
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigLoadException("cannot read " + file + ": " + e.getMessage(), e);
        }
        return parse(json);
    }

    static List<Station> parse(String json) throws ConfigLoadException {
        StationsFile parsed;
        try {
            parsed = gson.fromJson(json, StationsFile.class);
        } catch (JsonParseException e) {
            throw new ConfigLoadException("malformed station config: " + e.getMessage(), e);
        }
        if (parsed == null || parsed.stations == null || parsed.stations.isEmpty()) {
            throw new ConfigLoadException("station config lists no stations");
        }

        List<Station> out = new ArrayList<>();
        for (StationEntry e : parsed.stations) {
            if (e == null || e.name == null || e.stationId == null) {
                throw new ConfigLoadException("station entry needs name and stationID");
            }
            Set<Product> products = EnumSet.noneOf(Product.class);
            if (e.fetchProducts != null) {
                for (String p : e.fetchProducts) {
                    try {
                        products.add(Product.fromApiName(p));
                    } catch (IllegalArgumentException ex) {
                        throw new ConfigLoadException(e.name + ": " + ex.getMessage(), ex);
                    }
                }
            }
            out.add(new Station(e.name, e.stationId, products));
        }
        return List.copyOf(out);
    }

    /** Load with the fallback: never fails. */
    public static List<Station> loadOrDefault(Path file) {
        try {
            List<Station> stations = load(file);
            log.info("[Config] loaded {} station(s) from {}", stations.size(), file);
            return stations;
        } catch (ConfigLoadException e) {
            log.error("[Config] failed to load station config, loading default station {}. Error: {}",
                    DEFAULT_STATIONS.get(0).name(), e.getMessage());
            return DEFAULT_STATIONS;
        }
    }
}
