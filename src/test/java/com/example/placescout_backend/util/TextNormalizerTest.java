package com.example.placescout_backend.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    @Test
    void replacesUnsupportedCharactersAndCollapsesWhitespace() {
        assertThat(TextNormalizer.normalize("  Café   du\tMonde!! ")).isEqualTo("Caf du Monde");
        assertThat(TextNormalizer.normalize("Joe's Pizza & Co.")).isEqualTo("Joe's Pizza & Co.");
        assertThat(TextNormalizer.normalize("#1 @ramen-bar")).isEqualTo("1 @ramen-bar");
    }

    @Test
    void nullAndEmptyBecomeEmpty() {
        assertThat(TextNormalizer.normalize(null)).isEmpty();
        assertThat(TextNormalizer.normalize("")).isEmpty();
        assertThat(TextNormalizer.normalize("!!!")).isEmpty();
    }

    @Test
    void titleCaseFollowsWordRuns() {
        assertThat(TextNormalizer.isTitleCase("Blue Bottle")).isTrue();
        assertThat(TextNormalizer.isTitleCase("Daisy's Cafe")).isFalse();
        assertThat(TextNormalizer.isTitleCase("Blue bottle")).isFalse();
        assertThat(TextNormalizer.isTitleCase("BLUE")).isFalse();
        assertThat(TextNormalizer.isTitleCase("123")).isFalse();
    }

    @Test
    void countsUpperCaseAndTruncates() {
        assertThat(TextNormalizer.countUpperCase("McDonald")).isEqualTo(2);
        assertThat(TextNormalizer.truncate("abcdef", 3)).isEqualTo("abc");
        assertThat(TextNormalizer.truncate("ab", 3)).isEqualTo("ab");
        assertThat(TextNormalizer.truncate(null, 3)).isNull();
    }
}
