package com.example.placescout_backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Timestamped transcript fragment produced by the transcription engine.
 *
 * @param startMs start offset in milliseconds, never negative.
 * @param endMs   end offset in milliseconds, never before {@code startMs}.
 * @param text    spoken text, never {@code null}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Segment(
        @JsonProperty("start_ms") long startMs,
        @JsonProperty("end_ms") long endMs,
        @JsonProperty("text") String text
) {
    public Segment {
        startMs = Math.max(0L, startMs);
        endMs = Math.max(startMs, endMs);
        text = text == null ? "" : text;
    }
}
