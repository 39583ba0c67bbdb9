package com.example.placescout_backend.extraction;

import com.example.placescout_backend.model.Candidate;
import com.example.placescout_backend.model.Evidence;
import com.example.placescout_backend.model.ExtractionMethod;
import com.example.placescout_backend.model.PlaceCategory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the model's candidate objects into {@link Candidate}s, merging repeated names.
 */
public class ModelCandidateMapper {
    private static final Logger LOGGER = LoggerFactory.getLogger(ModelCandidateMapper.class);

    static final double DEFAULT_CONFIDENCE = 0.5;
    private static final Set<String> KNOWN_FIELDS = Set.of("name", "category", "evidence", "confidence", "address_hint");

    private final ObjectMapper om;

    public ModelCandidateMapper(ObjectMapper om) {
        this.om = om;
    }

    /**
     * @param items        object entries from the parsed response.
     * @param locationHint used as address hint when the model supplied none.
     * @param prompt       request text, stored on every candidate.
     * @param rawOutput    raw model text, stored on every candidate.
     * @param limit        maximum number of candidates, in model order.
     */
    public List<Candidate> map(List<ObjectNode> items, String locationHint, String prompt, String rawOutput, int limit) {
        Map<String, Candidate> byKey = new LinkedHashMap<>();
        String fallbackHint = locationHint == null || locationHint.isBlank() ? null : locationHint.strip();
        int skipped = 0;

        for (ObjectNode item : items) {
            String name = text(item.get("name"));
            if (name == null) {
                skipped++;
                continue;
            }
            Candidate existing = byKey.get(Candidate.keyOf(name));
            if (existing != null) {
                addEvidence(existing, item.get("evidence"));
                continue;
            }

            Candidate candidate = new Candidate(name, ExtractionMethod.MODEL);
            candidate.setCategory(PlaceCategory.fromLabel(text(item.get("category"))));
            addEvidence(candidate, item.get("evidence"));

            JsonNode conf = item.get("confidence");
            Map<String, Double> terms = new LinkedHashMap<>();
            terms.put("model", conf != null && conf.isNumber() ? conf.asDouble() : DEFAULT_CONFIDENCE);
            candidate.applyScore(terms);

            String hint = text(item.get("address_hint"));
            candidate.setAddressHint(hint != null ? hint : fallbackHint);
            candidate.setLlmPrompt(prompt);
            candidate.setLlmOutput(rawOutput);

            Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!KNOWN_FIELDS.contains(field.getKey())) {
                    candidate.getExtras().put(field.getKey(), om.convertValue(field.getValue(), Object.class));
                }
            }
            byKey.put(candidate.key(), candidate);
        }

        List<Candidate> out = new ArrayList<>(byKey.values());
        if (out.size() > Math.max(0, limit)) {
            out = new ArrayList<>(out.subList(0, Math.max(0, limit)));
        }
        if (skipped > 0) {
            LOGGER.debug("model candidates without usable name skipped={}", skipped);
        }
        return out;
    }

    private static void addEvidence(Candidate candidate, JsonNode evidence) {
        if (evidence == null || !evidence.isArray()) {
            return;
        }
        for (JsonNode e : evidence) {
            if (!e.isObject()) {
                continue;
            }
            String quote = text(e.get("quote"));
            long start = Math.max(0L, e.path("start_ms").asLong(0L));
            long end = Math.max(start, e.path("end_ms").asLong(start));
            candidate.addEvidence(new Evidence.Transcript(quote == null ? "" : quote, start, end));
        }
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }
}
