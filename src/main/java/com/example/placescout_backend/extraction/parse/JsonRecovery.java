package com.example.placescout_backend.extraction.parse;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The local half of the JSON recovery chain: a direct parse of the fence-stripped text, then a
 * scan from the first bracket. Both steps are pure and report failure as an empty result.
 */
public class JsonRecovery {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonRecovery.class);

    private static final Pattern LEADING_FENCE = Pattern.compile("^```[A-Za-z0-9_+-]*\\s*");
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\s*```$");

    /**
     * @param json     parsed value.
     * @param strategy name of the step that produced it.
     */
    public record Recovered(JsonNode json, String strategy) {
    }

    private final ObjectMapper strict;
    private final List<Map.Entry<String, JsonRecoveryStep>> chain = List.of(
            Map.entry(ParseOutcome.DIRECT, this::directParse),
            Map.entry(ParseOutcome.SUBSTRING, this::extractFirstJson)
    );

    public JsonRecovery(ObjectMapper objectMapper) {
        this.strict = objectMapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Removes one fenced-code wrapper (three backticks with an optional language tag).
     */
    public static String stripFences(String text) {
        if (text == null) {
            return "";
        }
        String t = text.strip();
        if (t.startsWith("```")) {
            t = LEADING_FENCE.matcher(t).replaceFirst("");
            t = TRAILING_FENCE.matcher(t).replaceFirst("");
        }
        return t.strip();
    }

    /**
     * Applies the local steps in order and returns the first success.
     */
    public Optional<Recovered> recover(String text) {
        for (Map.Entry<String, JsonRecoveryStep> step : chain) {
            Optional<JsonNode> node = step.getValue().recover(text);
            if (node.isPresent()) {
                return Optional.of(new Recovered(node.get(), step.getKey()));
            }
        }
        return Optional.empty();
    }

    public Optional<JsonNode> directParse(String text) {
        return parseStrict(stripFences(text));
    }

    /**
     * Decodes the first complete JSON value that starts at the earliest {@code '{'} or
     * {@code '['}, falling back to the other bracket if that fails.
     */
    public Optional<JsonNode> extractFirstJson(String text) {
        String t = stripFences(text);
        List<Integer> starts = new ArrayList<>(2);
        int brace = t.indexOf('{');
        int bracket = t.indexOf('[');
        if (brace >= 0) {
            starts.add(brace);
        }
        if (bracket >= 0) {
            starts.add(bracket);
        }
        starts.sort(Integer::compare);

        for (int start : starts) {
            String snippet = t.substring(start);
            Optional<String> prefix = decodePrefix(snippet);
            if (prefix.isEmpty()) {
                continue;
            }
            Optional<JsonNode> validated = parseStrict(prefix.get());
            if (validated.isPresent()) {
                return validated;
            }
        }
        return Optional.empty();
    }

    private Optional<String> decodePrefix(String snippet) {
        try (JsonParser parser = strict.createParser(snippet)) {
            if (parser.nextToken() == null) {
                return Optional.empty();
            }
            parser.skipChildren();
            long end = parser.currentLocation().getCharOffset();
            if (end <= 0 || end > snippet.length()) {
                return Optional.empty();
            }
            return Optional.of(snippet.substring(0, (int) end).strip());
        } catch (Exception ex) {
            LOGGER.trace("json prefix decode failed: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    private Optional<JsonNode> parseStrict(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = strict.readTree(text);
            if (node == null || node.isMissingNode()) {
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (Exception ex) {
            LOGGER.trace("json parse failed: {}", ex.getMessage());
            return Optional.empty();
        }
    }
}
