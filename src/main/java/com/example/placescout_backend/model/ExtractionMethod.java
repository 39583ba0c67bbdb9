package com.example.placescout_backend.model;

import java.util.Locale;

public enum ExtractionMethod {
    HEURISTIC,
    MODEL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
