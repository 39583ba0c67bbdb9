package com.example.placescout_backend.extraction;

import com.example.placescout_backend.model.Candidate;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Audit record of one pass through the language-model path.
 *
 * @param used           whether the model path was attempted at all.
 * @param candidates     mapped candidates; empty unless the attempt succeeded.
 * @param prompt         request text sent to the model.
 * @param input          structured part of the request.
 * @param outputRaw      raw model text.
 * @param outputJson     parsed and sanitised output.
 * @param error          transport, parse or model error detail.
 * @param fallbackReason why the heuristic path ran instead; {@code null} on success.
 * @param parseStrategy  recovery step that produced the JSON.
 * @param segmentCount   transcript segments in the request.
 */
public record ModelAttempt(
        boolean used,
        List<Candidate> candidates,
        String prompt,
        Map<String, Object> input,
        String outputRaw,
        JsonNode outputJson,
        String error,
        String fallbackReason,
        String parseStrategy,
        int segmentCount
) {
    public static final String DISABLED = "language_model_disabled";
    public static final String CALL_FAILED = "ollama_call_failed";
    public static final String JSON_PARSE_FAILED = "ollama_json_parse_failed";
    public static final String EMPTY_CANDIDATES = "ollama_empty_candidates";
    public static final String CANCELLED = "cancelled";

    public static ModelAttempt disabled() {
        return new ModelAttempt(false, List.of(), "", Map.of(), "", null, null, DISABLED, null, 0);
    }

    public boolean succeeded() {
        return used && fallbackReason == null && !candidates.isEmpty();
    }
}
