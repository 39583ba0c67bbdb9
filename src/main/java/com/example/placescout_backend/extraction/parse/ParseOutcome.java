package com.example.placescout_backend.extraction.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Result of {@link ModelResponseParser#parse}. Exactly one of {@code json} and {@code error} is set.
 *
 * @param json       parsed value, {@code null} on failure.
 * @param candidates object-valued candidate entries; empty when nothing usable was found.
 * @param strategy   {@code direct}, {@code substring} or {@code repair}; {@code null} on failure.
 * @param error      failure detail, {@code null} on success.
 */
public record ParseOutcome(JsonNode json, List<ObjectNode> candidates, String strategy, String error) {

    public static final String DIRECT = "direct";
    public static final String SUBSTRING = "substring";
    public static final String REPAIR = "repair";

    public static ParseOutcome parsed(JsonNode json, String strategy) {
        return new ParseOutcome(json, ModelResponseParser.normalizeCandidates(json), strategy, null);
    }

    public static ParseOutcome failed(String error) {
        return new ParseOutcome(null, List.of(), null, error == null ? "json_parse_failed" : error);
    }

    public boolean isParsed() {
        return json != null;
    }
}
