package com.example.placescout_backend.extraction;

import com.example.placescout_backend.config.ExtractionProperties;
import com.example.placescout_backend.model.Segment;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void requestCarriesInstructionHintAndTranscriptJson() throws Exception {
        PromptBuilder builder = new PromptBuilder(new ExtractionProperties(), om);

        PromptBuilder.ModelRequest request = builder.build("Kyoto", List.of(new Segment(0, 1500, "we ate at Ippudo")));

        assertThat(request.instruction()).contains("Location hint: Kyoto").contains("Return max 12 candidates.");
        assertThat(request.text()).startsWith(request.instruction()).contains("\nInput JSON:\n");
        JsonNode input = om.readTree(request.text().substring(request.text().indexOf("\nInput JSON:\n") + 13));
        assertThat(input.get("video_id").isNull()).isTrue();
        assertThat(input.get("location_hint").asText()).isEqualTo("Kyoto");
        assertThat(input.get("transcript").get(0).get("start_ms").asLong()).isZero();
        assertThat(input.get("transcript").get(0).get("end_ms").asLong()).isEqualTo(1500);
        assertThat(request.segmentCount()).isEqualTo(1);
    }

    @Test
    void missingHintIsSpelledNone() {
        assertThat(PromptBuilder.instruction(null)).contains("Location hint: none");
        assertThat(PromptBuilder.instruction("  ")).contains("Location hint: none");
    }

    @Test
    void dropsTrailingSegmentsUntilInputFitsCharacterCap() {
        ExtractionProperties props = new ExtractionProperties();
        props.setMaxInputChars(400);
        PromptBuilder builder = new PromptBuilder(props, om);
        List<Segment> segments = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            segments.add(new Segment(i * 1000L, i * 1000L + 900, "segment number " + i));
        }

        PromptBuilder.ModelRequest request = builder.build(null, segments);

        String inputJson = request.text().substring(request.text().indexOf("\nInput JSON:\n") + 13);
        assertThat(inputJson.length()).isLessThanOrEqualTo(400);
        assertThat(request.segmentCount()).isBetween(1, 29);
        assertThat(inputJson).contains("segment number 0").doesNotContain("segment number 29");
    }

    @Test
    void promptCapAppliesToWholeRequest() {
        ExtractionProperties props = new ExtractionProperties();
        int instructionLength = PromptBuilder.instruction(null).length();
        props.setMaxPromptChars(instructionLength + 200);
        PromptBuilder builder = new PromptBuilder(props, om);
        List<Segment> segments = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            segments.add(new Segment(i, i + 1, "words words words " + i));
        }

        PromptBuilder.ModelRequest request = builder.build(null, segments);

        assertThat(request.text().length()).isLessThanOrEqualTo(instructionLength + 200);
        assertThat(request.segmentCount()).isLessThan(20);
    }

    @Test
    void repairPromptWrapsTruncatedRawOutput() {
        ExtractionProperties props = new ExtractionProperties();
        props.setMaxInputChars(5);
        PromptBuilder builder = new PromptBuilder(props, om);

        String prompt = builder.repairPrompt("abcdefghij");

        assertThat(prompt).startsWith("Fix the following to valid JSON only").endsWith("Raw output:\nabcde\n");
    }
}
