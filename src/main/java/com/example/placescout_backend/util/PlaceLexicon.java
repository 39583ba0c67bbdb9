package com.example.placescout_backend.util;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Fixed word lists behind segment filtering, OCR acceptance and scoring.
 */
public final class PlaceLexicon {

    /** Place-category words that make a transcript segment worth sending to the model. */
    public static final List<String> CATEGORY_WORDS = List.of(
            "restaurant", "cafe", "bar", "bakery", "hotel", "museum", "park", "market", "store", "mall",
            "beach", "trail", "station", "attraction", "gallery", "brewery", "pub", "temple", "church",
            "stadium", "theater", "cinema", "neighborhood", "district", "plaza"
    );

    public static final List<String> ACTION_WORDS = List.of(
            "go", "went", "visit", "visited", "recommend", "try", "tried", "ate", "eating", "stayed",
            "booked", "checked in", "check in", "check-in", "see", "saw", "stop", "stopped"
    );

    public static final List<String> LOCATION_CUES = List.of(
            "in", "at", "near", "next to", "on", "by", "across from", "around", "inside"
    );

    /** Keywords that make a name look like a venue (OCR acceptance and the keyword bonus). */
    public static final List<String> PLACE_KEYWORDS = List.of(
            "cafe", "coffee", "ramen", "restaurant", "bar", "bistro", "diner", "grill", "market",
            "bakery", "pizza", "taco", "sushi", "bbq", "pub", "tavern", "tea", "noodle", "burger",
            "kitchen", "izakaya", "food", "eatery", "steak", "pho", "gelato", "dessert", "brew"
    );

    public static final Set<String> GENERIC_PHRASES = Set.of(
            "today", "tomorrow", "yesterday", "subscribe", "follow", "like", "comment", "share",
            "welcome", "hello", "thanks", "thank you", "video", "travel", "trip", "food", "menu"
    );

    private PlaceLexicon() {
    }

    public static boolean containsPlaceKeyword(String text) {
        return containsAny(lower(text), PLACE_KEYWORDS);
    }

    public static boolean isGenericPhrase(String text) {
        return GENERIC_PHRASES.contains(lower(text));
    }

    /**
     * Plain substring test, so {@code "go"} also matches {@code "good"}.
     */
    public static boolean containsAny(String lowered, List<String> words) {
        if (lowered == null || lowered.isEmpty()) {
            return false;
        }
        for (String word : words) {
            if (lowered.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }
}
