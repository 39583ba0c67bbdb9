package com.example.placescout_backend.util;

/**
 * Bounds shared by every scorer. A candidate is never certain and never impossible.
 */
public final class Confidence {

    public static final double FLOOR = 0.05;
    public static final double CEILING = 0.95;
    public static final String FINAL_TERM = "final";

    private Confidence() {
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return FLOOR;
        }
        return Math.max(FLOOR, Math.min(CEILING, value));
    }
}
