package com.example.placescout_backend.service;

import com.example.placescout_backend.model.Candidate;
import com.example.placescout_backend.model.Evidence;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Flattens candidates into JSON-safe rows. Every row carries the full field set; values Jackson
 * cannot write are replaced by their string form.
 */
@Component
public class CandidateSanitizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(CandidateSanitizer.class);
    static final String CIRCULAR = "<<circular>>";

    private final ObjectMapper om;

    public CandidateSanitizer(ObjectMapper om) {
        this.om = om;
    }

    public List<Map<String, Object>> sanitize(List<Candidate> candidates) {
        if (candidates == null) {
            return List.of();
        }
        List<Map<String, Object>> rows = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            rows.add(toRow(c));
        }
        return rows;
    }

    public Map<String, Object> toRow(Candidate c) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", c.getName());
        row.put("category", c.getCategory().wireName());
        row.put("evidence", c.getEvidence().stream().map(Evidence::toMeta).toList());
        row.put("confidence", c.getConfidence());
        row.put("score_breakdown", new LinkedHashMap<>(c.getScoreBreakdown()));
        row.put("address_hint", c.getAddressHint());
        row.put("extraction_method", c.getExtractionMethod().wireName());
        row.put("start_ms", c.getStartMs());
        row.put("end_ms", c.getEndMs());
        row.put("llm_prompt", c.getLlmPrompt());
        row.put("llm_output", c.getLlmOutput() == null ? "" : c.getLlmOutput());
        row.put("places_query", c.getPlacesQuery());
        row.put("resolved_name", c.getResolvedName());
        row.put("place_id", c.getPlaceId());
        row.put("formatted_address", c.getFormattedAddress());
        row.put("latitude", c.getLatitude());
        row.put("longitude", c.getLongitude());
        row.put("places_raw", c.getPlacesRaw());
        row.put("resolution_error", c.getResolutionError());
        row.put("resolution_failed", c.isResolutionFailed());
        c.getExtras().forEach(row::putIfAbsent);

        Map<String, Object> safe = new LinkedHashMap<>();
        row.forEach((k, v) -> safe.put(k, jsonSafe(v)));
        return safe;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> jsonSafeMap(Map<String, ?> values) {
        return values == null ? Map.of() : (Map<String, Object>) jsonSafe(values);
    }

    /**
     * Returns {@code value} as plain JSON types (maps, lists, strings, numbers, booleans, null).
     * A container that contains itself is written as {@value #CIRCULAR}.
     */
    Object jsonSafe(Object value) {
        return jsonSafe(value, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private Object jsonSafe(Object value, Set<Object> path) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
            return String.valueOf(d);
        }
        if (value instanceof Float f && (f.isNaN() || f.isInfinite())) {
            return String.valueOf(f);
        }
        if (value instanceof Number) {
            return value;
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            if (!path.add(value)) {
                LOGGER.debug("circular reference replaced type={}", value.getClass().getName());
                return CIRCULAR;
            }
            try {
                return value instanceof Map<?, ?> map ? safeMap(map, path) : safeList((Collection<?>) value, path);
            } finally {
                path.remove(value);
            }
        }
        if (value instanceof Enum<?> e) {
            return e.name().toLowerCase(Locale.ROOT);
        }
        try {
            JsonNode tree = om.valueToTree(value);
            return om.treeToValue(tree, Object.class);
        } catch (IllegalArgumentException | JsonProcessingException ex) {
            LOGGER.debug("value not serializable type={} error={}", value.getClass().getName(), ex.getMessage());
            return String.valueOf(value);
        }
    }

    private Map<String, Object> safeMap(Map<?, ?> map, Set<Object> path) {
        Map<String, Object> out = new LinkedHashMap<>();
        map.forEach((k, v) -> out.put(String.valueOf(k), jsonSafe(v, path)));
        return out;
    }

    private List<Object> safeList(Collection<?> items, Set<Object> path) {
        List<Object> out = new ArrayList<>(items.size());
        items.forEach(v -> out.add(jsonSafe(v, path)));
        return out;
    }
}
