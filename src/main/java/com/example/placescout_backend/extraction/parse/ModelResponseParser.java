package com.example.placescout_backend.extraction.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recovers structured candidates from model text: local recovery first, then one remote repair
 * request whose answer goes through local recovery again. No further retries.
 */
public class ModelResponseParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(ModelResponseParser.class);

    private final JsonRecovery recovery;

    public ModelResponseParser(ObjectMapper objectMapper) {
        this(new JsonRecovery(objectMapper));
    }

    public ModelResponseParser(JsonRecovery recovery) {
        this.recovery = recovery;
    }

    /**
     * @param rawText model output, possibly wrapped in prose or code fences.
     * @param repair  remote repair call; {@code null} disables the third step.
     */
    public ParseOutcome parse(String rawText, RepairCall repair) {
        Optional<JsonRecovery.Recovered> local = recovery.recover(rawText);
        if (local.isPresent()) {
            LOGGER.debug("model output parsed strategy={}", local.get().strategy());
            return ParseOutcome.parsed(local.get().json(), local.get().strategy());
        }
        if (repair == null) {
            return ParseOutcome.failed("json_parse_failed");
        }

        LOGGER.warn("model output not parseable, requesting repair length={}", rawText == null ? 0 : rawText.length());
        String repaired;
        try {
            repaired = repair.requestRepair(rawText == null ? "" : rawText);
        } catch (RuntimeException ex) {
            LOGGER.warn("model repair call failed type={} message={}", ex.getClass().getSimpleName(), ex.getMessage());
            return ParseOutcome.failed(ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
        }

        Optional<JsonRecovery.Recovered> fixed = recovery.recover(repaired);
        if (fixed.isEmpty()) {
            LOGGER.warn("model repair output still not parseable length={}", repaired == null ? 0 : repaired.length());
            return ParseOutcome.failed("json_parse_failed");
        }
        return ParseOutcome.parsed(fixed.get().json(), ParseOutcome.REPAIR);
    }

    /**
     * Object entries of a top-level {@code candidates} array, or of a top-level array. Anything
     * else yields an empty list.
     */
    public static List<ObjectNode> normalizeCandidates(JsonNode parsed) {
        List<ObjectNode> out = new ArrayList<>();
        if (parsed == null) {
            return out;
        }
        JsonNode items = null;
        if (parsed.isObject() && parsed.path("candidates").isArray()) {
            items = parsed.get("candidates");
        } else if (parsed.isArray()) {
            items = parsed;
        }
        if (items == null) {
            return out;
        }
        for (JsonNode item : items) {
            if (item.isObject()) {
                out.add(((ObjectNode) item).deepCopy());
            }
        }
        return out;
    }
}
