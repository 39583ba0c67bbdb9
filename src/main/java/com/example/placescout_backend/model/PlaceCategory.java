package com.example.placescout_backend.model;

import java.util.List;
import java.util.Locale;
import java.util.Map;

public enum PlaceCategory {
    RESTAURANT, CAFE, BAR, BAKERY, HOTEL, ATTRACTION, STORE, NEIGHBORHOOD, PARK, TRANSIT, OTHER;

    // first matching keyword wins, so the more specific words come first
    private static final List<Map.Entry<String, PlaceCategory>> KEYWORDS = List.of(
            Map.entry("bakery", BAKERY),
            Map.entry("cafe", CAFE),
            Map.entry("coffee", CAFE),
            Map.entry("brewery", BAR),
            Map.entry("tavern", BAR),
            Map.entry("pub", BAR),
            Map.entry("bar", BAR),
            Map.entry("hotel", HOTEL),
            Map.entry("hostel", HOTEL),
            Map.entry("museum", ATTRACTION),
            Map.entry("gallery", ATTRACTION),
            Map.entry("temple", ATTRACTION),
            Map.entry("church", ATTRACTION),
            Map.entry("stadium", ATTRACTION),
            Map.entry("theater", ATTRACTION),
            Map.entry("park", PARK),
            Map.entry("trail", PARK),
            Map.entry("beach", PARK),
            Map.entry("station", TRANSIT),
            Map.entry("airport", TRANSIT),
            Map.entry("market", STORE),
            Map.entry("mall", STORE),
            Map.entry("store", STORE),
            Map.entry("neighborhood", NEIGHBORHOOD),
            Map.entry("district", NEIGHBORHOOD),
            Map.entry("restaurant", RESTAURANT),
            Map.entry("bistro", RESTAURANT),
            Map.entry("diner", RESTAURANT),
            Map.entry("grill", RESTAURANT),
            Map.entry("kitchen", RESTAURANT),
            Map.entry("izakaya", RESTAURANT),
            Map.entry("ramen", RESTAURANT),
            Map.entry("sushi", RESTAURANT),
            Map.entry("pizza", RESTAURANT),
            Map.entry("taco", RESTAURANT)
    );

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps a model-supplied category label; anything unknown becomes {@link #OTHER}.
     */
    public static PlaceCategory fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return OTHER;
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return OTHER;
        }
    }

    /**
     * Guesses a category from words in a heuristically mined name.
     */
    public static PlaceCategory infer(String name) {
        if (name == null) {
            return OTHER;
        }
        String lowered = name.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, PlaceCategory> e : KEYWORDS) {
            if (lowered.contains(e.getKey())) {
                return e.getValue();
            }
        }
        return OTHER;
    }

}
