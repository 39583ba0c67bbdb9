package com.example.placescout_backend.extraction.parse;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonRecoveryTest {

    private final JsonRecovery recovery = new JsonRecovery(new ObjectMapper());

    @Test
    void stripsOneFenceWithOptionalLanguageTag() {
        assertThat(JsonRecovery.stripFences("```json\n{\"a\":1}\n```")).isEqualTo("{\"a\":1}");
        assertThat(JsonRecovery.stripFences("```\n[1]\n```")).isEqualTo("[1]");
        assertThat(JsonRecovery.stripFences("  {\"a\":1}  ")).isEqualTo("{\"a\":1}");
        assertThat(JsonRecovery.stripFences(null)).isEmpty();
    }

    @Test
    void directParseRejectsTrailingText() {
        assertThat(recovery.directParse("{\"a\":1} trailing")).isEmpty();
        assertThat(recovery.directParse("{\"a\":1}")).isPresent();
        assertThat(recovery.directParse("   ")).isEmpty();
    }

    @Test
    void extractsEarliestBracketFirst() {
        var node = recovery.extractFirstJson("list: [1,2] then {\"a\":1}");

        assertThat(node).isPresent();
        assertThat(node.get().isArray()).isTrue();
    }

    @Test
    void fallsBackToOtherBracketWhenFirstIsBroken() {
        var node = recovery.extractFirstJson("{oops [{\"name\":\"A\"}]");

        assertThat(node).isPresent();
        assertThat(node.get().get(0).get("name").asText()).isEqualTo("A");
    }

    @Test
    void noBracketMeansNoRecovery() {
        assertThat(recovery.extractFirstJson("no json here")).isEmpty();
        assertThat(recovery.recover("no json here")).isEmpty();
    }
}
