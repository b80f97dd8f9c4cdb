package com.casesentinel.core.matching;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Indicators}.
 */
class IndicatorsTest {

    @Test
    @DisplayName("Should combine lists without case-insensitive duplicates, first seen wins")
    void shouldCombineWithoutDuplicates() {
        List<String> combined = Indicators.combine(
                List.of("Evil.com", "8.8.8.8", "  ", "payload.exe"),
                List.of("evil.COM ", "new.example.org", "PAYLOAD.EXE"));

        assertThat(combined).containsExactly("Evil.com", "8.8.8.8", "payload.exe", "new.example.org");
    }

    @Test
    @DisplayName("Should tolerate null lists when combining")
    void shouldCombineNullLists() {
        assertThat(Indicators.combine(null, List.of("a"))).containsExactly("a");
        assertThat(Indicators.combine(List.of("a"), null)).containsExactly("a");
    }

    @Test
    @DisplayName("Should parse pasted text split on lines and delimiters")
    void shouldParsePastedText() {
        String text = "8.8.8.8, evil.com\n"
                + "a@b.com; c@d.com\r\n"
                + "\n"
                + "hash1 | hash2\n"
                + "single.exe\n";

        assertThat(Indicators.parse(text)).containsExactly(
                "8.8.8.8", "evil.com", "a@b.com", "c@d.com", "hash1", "hash2", "single.exe");
    }

    @Test
    @DisplayName("Should return an empty list for blank text")
    void shouldParseBlankText() {
        assertThat(Indicators.parse(null)).isEmpty();
        assertThat(Indicators.parse("  \n ")).isEmpty();
    }

    @Test
    @DisplayName("Should normalize by trimming and case folding")
    void shouldNormalize() {
        assertThat(Indicators.normalize("  Evil.COM ")).isEqualTo("evil.com");
    }
}
