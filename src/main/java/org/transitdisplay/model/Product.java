package org.transitdisplay.model;

import java.util.Locale;

/** Closed set of service categories reported by the transit API. */
public enum Product {
    SUBURBAN("suburban"),
    SUBWAY("subway"),
    TRAM("tram"),
    BUS("bus"),
    FERRY("ferry"),
    EXPRESS("express"),
    REGIONAL("regional");

    private final String apiName;

    Product(String apiName) {
        this.apiName = apiName;
    }

    /** Name used by the upstream in query flags and payloads. */
    public String apiName() {
        return apiName;
    }

    /**
     * Resolves an upstream product name.
     *
     * @throws IllegalArgumentException for names outside the closed set
     */
    public static Product fromApiName(String name) {
        if (name != null) {
            String n = name.trim().toLowerCase(Locale.ROOT);
            for (Product p : values()) {
                if (p.apiName.equals(n)) {
                    return p;
                }
            }
        }
        throw new IllegalArgumentException("Unknown product: " + name);
    }
}
