package com.example.placescout_backend.util;

import java.util.regex.Pattern;

/**
 * Canonicalises transcript and frame text before any pattern matching.
 */
public final class TextNormalizer {

    private static final Pattern UNSUPPORTED = Pattern.compile("[^A-Za-z0-9\\s&@\\-'.]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    /**
     * Replaces characters outside letters, digits, whitespace and {@code &@-'.} with a space and
     * collapses whitespace runs.
     *
     * @param text raw text, may be {@code null}.
     * @return normalised text, empty for {@code null} input.
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = UNSUPPORTED.matcher(text).replaceAll(" ");
        return WHITESPACE.matcher(cleaned).replaceAll(" ").strip();
    }

    public static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }

    /**
     * Title case as the OCR filter understands it: every cased run starts upper case and
     * continues lower case, and at least one cased character exists.
     */
    public static boolean isTitleCase(String text) {
        if (text == null) {
            return false;
        }
        boolean cased = false;
        boolean previousCased = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isUpperCase(c) || Character.isTitleCase(c)) {
                if (previousCased) {
                    return false;
                }
                previousCased = true;
                cased = true;
            } else if (Character.isLowerCase(c)) {
                if (!previousCased) {
                    return false;
                }
                previousCased = true;
                cased = true;
            } else {
                previousCased = false;
            }
        }
        return cased;
    }

    public static int countUpperCase(String text) {
        if (text == null) {
            return 0;
        }
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (Character.isUpperCase(text.charAt(i))) {
                count++;
            }
        }
        return count;
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (max <= 0) {
            return "";
        }
        return value.length() <= max ? value : value.substring(0, max);
    }
}
