package com.example.placescout_backend.extraction;

import com.example.placescout_backend.model.Segment;
import com.example.placescout_backend.util.PlaceLexicon;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Shrinks an oversized transcript to the segments that carry place signals, plus two segments
 * of context on each side, before it goes into a model prompt.
 */
public final class SegmentFilter {

    public static final int DEFAULT_MAX_SEGMENTS = 120;
    static final int CONTEXT_RADIUS = 2;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private SegmentFilter() {
    }

    public static List<Segment> filter(List<Segment> segments) {
        return filter(segments, DEFAULT_MAX_SEGMENTS);
    }

    /**
     * Returns {@code segments} itself when it already fits; otherwise an order-preserving
     * subsequence of at most {@code maxSegments} elements.
     */
    public static List<Segment> filter(List<Segment> segments, int maxSegments) {
        if (segments == null) {
            return List.of();
        }
        int limit = Math.max(0, maxSegments);
        if (segments.size() <= limit) {
            return segments;
        }

        TreeSet<Integer> keep = new TreeSet<>();
        int last = segments.size() - 1;
        for (int idx = 0; idx <= last; idx++) {
            if (!matches(segments.get(idx).text())) {
                continue;
            }
            for (int i = Math.max(0, idx - CONTEXT_RADIUS); i <= Math.min(last, idx + CONTEXT_RADIUS); i++) {
                keep.add(i);
            }
        }

        List<Segment> filtered = new ArrayList<>(Math.min(keep.size(), limit));
        for (Integer i : keep) {
            if (filtered.size() >= limit) {
                break;
            }
            filtered.add(segments.get(i));
        }
        return filtered;
    }

    static boolean matches(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        if (PlaceLexicon.containsAny(lowered, PlaceLexicon.ACTION_WORDS)) {
            return true;
        }
        if (PlaceLexicon.containsAny(lowered, PlaceLexicon.CATEGORY_WORDS)) {
            return true;
        }
        for (String cue : PlaceLexicon.LOCATION_CUES) {
            if (lowered.contains(" " + cue + " ")) {
                return true;
            }
        }
        return looksProperNounish(text);
    }

    static boolean looksProperNounish(String text) {
        int tokens = 0;
        int capitalized = 0;
        for (String token : WHITESPACE.split(text)) {
            if (token.isEmpty()) {
                continue;
            }
            tokens++;
            if (Character.isUpperCase(token.charAt(0))) {
                capitalized++;
            }
        }
        return tokens >= 2 && capitalized >= 2;
    }
}
