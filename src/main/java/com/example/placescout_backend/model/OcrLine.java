package com.example.placescout_backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Text read from a single sampled video frame.
 *
 * @param timestampMs frame offset in milliseconds.
 * @param text        recognised text; several boxes of one frame are joined with {@code " | "}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OcrLine(
        @JsonProperty("timestamp_ms") long timestampMs,
        @JsonProperty("text") String text
) {
    public OcrLine {
        timestampMs = Math.max(0L, timestampMs);
        text = text == null ? "" : text;
    }
}
