package com.example.placescout_backend.model;

import java.util.Locale;

/**
 * Latitude/longitude pair, used as a search bias point.
 */
public record GeoPoint(double latitude, double longitude) {

    public String asQueryParam() {
        return String.format(Locale.ROOT, "%s,%s", latitude, longitude);
    }
}
