package org.transitdisplay.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/** A configured station and the products to fetch there. */
public record Station(String name, long stationId, Set<Product> products) {

    public Station {
        Objects.requireNonNull(name, "name");
        products = products == null || products.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(products));
    }

    public boolean wants(Product p) {
        return products.contains(p);
    }
}
