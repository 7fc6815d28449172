package org.transitdisplay.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.transitdisplay.TestFakes.departure;

class DepartureTest {

    @Test
    void keyIgnoresTripIdAndDestination() {
        Departure a = departure("trip-1", "M41", "Hauptbahnhof", 10, 0, 60, Product.BUS);
        Departure b = departure("trip-2", "M41", "Hbf", 10, 0, 89, Product.BUS);

        assertEquals(a.key(), b.key());
        assertNotEquals(a.key(), departure("trip-1", "M41", "Hauptbahnhof", 10, 0, 120, Product.BUS).key());
        assertNotEquals(a.key(), departure("trip-1", "M41", "Hauptbahnhof", 10, 1, 60, Product.BUS).key());
    }

    @Test
    void delayLabels() {
        assertEquals("", departure("t", "U2", "Pankow", 9, 0, 0, Product.SUBWAY).delayLabel());
        assertEquals("+2", departure("t", "U2", "Pankow", 9, 0, 150, Product.SUBWAY).delayLabel());
        assertEquals("-1", departure("t", "U2", "Pankow", 9, 0, -60, Product.SUBWAY).delayLabel());
    }

    @Test
    void productNames() {
        assertEquals(Product.SUBURBAN, Product.fromApiName(" Suburban "));
        assertThrows(IllegalArgumentException.class, () -> Product.fromApiName("zeppelin"));
        assertThrows(IllegalArgumentException.class, () -> Product.fromApiName(null));
    }
}
