package com.example.placescout_backend.extraction;

import com.example.placescout_backend.extraction.parse.ModelResponseParser;
import com.example.placescout_backend.model.Candidate;
import com.example.placescout_backend.model.Evidence;
import com.example.placescout_backend.model.ExtractionMethod;
import com.example.placescout_backend.model.PlaceCategory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ModelCandidateMapperTest {

    private final ObjectMapper om = new ObjectMapper();
    private final ModelCandidateMapper mapper = new ModelCandidateMapper(om);

    @Test
    void mapsFieldsAndKeepsUnknownKeysAsExtras() throws Exception {
        List<ObjectNode> items = items("""
                {"candidates":[{"name":" Sushi Dai ","category":"Restaurant","confidence":0.8,
                  "evidence":[{"start_ms":1200,"end_ms":3400,"quote":"we lined up at Sushi Dai"}],
                  "query_variants":["Sushi Dai Tokyo"]}]}
                """);

        List<Candidate> out = mapper.map(items, "Tokyo", "prompt", "raw", 15);

        assertThat(out).hasSize(1);
        Candidate c = out.get(0);
        assertThat(c.getName()).isEqualTo("Sushi Dai");
        assertThat(c.getExtractionMethod()).isEqualTo(ExtractionMethod.MODEL);
        assertThat(c.getCategory()).isEqualTo(PlaceCategory.RESTAURANT);
        assertThat(c.getConfidence()).isEqualTo(0.8);
        assertThat(c.getEvidence()).containsExactly(new Evidence.Transcript("we lined up at Sushi Dai", 1200, 3400));
        assertThat(c.getStartMs()).isEqualTo(1200L);
        assertThat(c.getAddressHint()).isEqualTo("Tokyo");
        assertThat(c.getLlmPrompt()).isEqualTo("prompt");
        assertThat(c.getLlmOutput()).isEqualTo("raw");
        assertThat(c.getExtras()).containsEntry("query_variants", List.of("Sushi Dai Tokyo"));
    }

    @Test
    void defaultsAndClampsConfidenceAndCategory() throws Exception {
        List<ObjectNode> items = items("""
                [{"name":"A","category":"spaceport"},{"name":"B","confidence":3},{"name":"C","confidence":"high"}]
                """);

        List<Candidate> out = mapper.map(items, null, "p", "r", 15);

        assertThat(out.get(0).getCategory()).isEqualTo(PlaceCategory.OTHER);
        assertThat(out.get(0).getConfidence()).isEqualTo(0.5);
        assertThat(out.get(1).getConfidence()).isEqualTo(0.95);
        assertThat(out.get(2).getConfidence()).isEqualTo(0.5);
        assertThat(out.get(0).getAddressHint()).isNull();
    }

    @Test
    void skipsBlankNamesAndMergesCaseInsensitiveDuplicates() throws Exception {
        List<ObjectNode> items = items("""
                [{"name":"  "},{"category":"cafe"},
                 {"name":"Blue Bottle","evidence":[{"quote":"one","start_ms":1,"end_ms":2}]},
                 {"name":"blue bottle","evidence":[{"quote":"two","start_ms":5,"end_ms":6}]}]
                """);

        List<Candidate> out = mapper.map(items, null, "p", "r", 15);

        assertThat(out).hasSize(1);
        assertThat(out.get(0).getName()).isEqualTo("Blue Bottle");
        assertThat(out.get(0).getEvidence()).hasSize(2);
    }

    @Test
    void capsInModelOrder() throws Exception {
        StringBuilder json = new StringBuilder("[");
        for (int i = 0; i < 20; i++) {
            json.append(i == 0 ? "" : ",").append("{\"name\":\"Place ").append(i).append("\"}");
        }
        json.append("]");

        List<Candidate> out = mapper.map(items(json.toString()), null, "p", "r", 15);

        assertThat(out).hasSize(15);
        assertThat(out.get(0).getName()).isEqualTo("Place 0");
        assertThat(out.get(14).getName()).isEqualTo("Place 14");
    }

    private List<ObjectNode> items(String json) throws Exception {
        return ModelResponseParser.normalizeCandidates(om.readTree(json));
    }
}
