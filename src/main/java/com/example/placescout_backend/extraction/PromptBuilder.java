package com.example.placescout_backend.extraction;

import com.example.placescout_backend.config.ExtractionProperties;
import com.example.placescout_backend.model.Segment;
import com.example.placescout_backend.util.TextNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the extraction and repair prompts and keeps them inside the configured character caps.
 */
public class PromptBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(PromptBuilder.class);

    static final String INPUT_SEPARATOR = "\nInput JSON:\n";
    static final String REPAIR_INSTRUCTION = "Fix the following to valid JSON only. Do not add commentary.\n"
            + "Return ONLY the JSON.\n"
            + "Raw output:\n";

    /**
     * @param instruction  fixed instruction text.
     * @param input        structured input (video id, location hint, transcript).
     * @param text         the complete text sent to the model.
     * @param segmentCount transcript segments that survived the caps.
     */
    public record ModelRequest(String instruction, Map<String, Object> input, String text, int segmentCount) {
    }

    private final ExtractionProperties props;
    private final ObjectMapper om;

    public PromptBuilder(ExtractionProperties props, ObjectMapper om) {
        this.props = props;
        this.om = om;
    }

    public static String instruction(String locationHint) {
        String hintLine = locationHint != null && !locationHint.isBlank()
                ? "Location hint: " + locationHint
                : "Location hint: none";
        return "You are extracting named places (venues/landmarks/areas) from transcript segments. "
                + "Return JSON only. Do not include commentary.\n"
                + "Output schema (JSON only):\n"
                + "{\n"
                + "  \"candidates\": [\n"
                + "    {\n"
                + "      \"name\": string,\n"
                + "      \"category\": \"restaurant\"|\"cafe\"|\"bar\"|\"bakery\"|\"hotel\"|\"attraction\"|\"store\"|\"neighborhood\"|\"park\"|\"transit\"|\"other\",\n"
                + "      \"evidence\": [{\"start_ms\": number, \"end_ms\": number, \"quote\": string}],\n"
                + "      \"confidence\": number,\n"
                + "      \"query_variants\": string[]\n"
                + "    }\n"
                + "  ]\n"
                + "}\n"
                + "Rules:\n"
                + "- Only include items that can be searched in Google Places.\n"
                + "- Every candidate must include evidence quote copied EXACTLY from transcript text.\n"
                + "- Exclude generic phrases (e.g. 'this place', 'a cafe') unless a real name appears.\n"
                + "- Use the location hint to disambiguate.\n"
                + "- Return max 12 candidates.\n"
                + hintLine + "\n"
                + "Transcript segments will be provided as JSON array under key 'transcript'.\n";
    }

    /**
     * Drops trailing segments until the input JSON fits {@code maxInputChars} and the whole
     * request fits {@code maxPromptChars}. The segment-count cap is applied before this.
     */
    public ModelRequest build(String locationHint, List<Segment> segments) {
        String instruction = instruction(locationHint);
        List<Segment> kept = new ArrayList<>(segments == null ? List.of() : segments);
        int original = kept.size();
        while (true) {
            Map<String, Object> input = input(locationHint, kept);
            String inputJson = write(input);
            String text = instruction + INPUT_SEPARATOR + inputJson;
            boolean fits = inputJson.length() <= props.getMaxInputChars() && text.length() <= props.getMaxPromptChars();
            if (fits || kept.isEmpty()) {
                if (kept.size() < original) {
                    LOGGER.info("prompt trimmed to caps segments={}->{} inputChars={} promptChars={}",
                            original, kept.size(), inputJson.length(), text.length());
                }
                return new ModelRequest(instruction, input, text, kept.size());
            }
            kept.remove(kept.size() - 1);
        }
    }

    public String repairPrompt(String rawOutput) {
        return REPAIR_INSTRUCTION + TextNormalizer.truncate(rawOutput == null ? "" : rawOutput, props.getMaxInputChars()) + "\n";
    }

    private static Map<String, Object> input(String locationHint, List<Segment> segments) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("video_id", null);
        input.put("location_hint", locationHint);
        input.put("transcript", List.copyOf(segments));
        return input;
    }

    private String write(Map<String, Object> input) {
        try {
            return om.writeValueAsString(input);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("prompt input not serializable", e);
        }
    }
}
