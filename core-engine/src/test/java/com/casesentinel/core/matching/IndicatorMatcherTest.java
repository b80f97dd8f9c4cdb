package com.casesentinel.core.matching;

import com.casesentinel.core.config.PatternsLoader;
import com.casesentinel.core.model.Dataset;
import com.casesentinel.core.model.IndicatorKind;
import com.casesentinel.core.model.Match;
import com.casesentinel.core.model.MatchKind;
import com.casesentinel.core.model.RecordStore;
import com.casesentinel.core.model.Row;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link IndicatorMatcher}.
 */
class IndicatorMatcherTest {

    private IndicatorMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new IndicatorMatcher(IndicatorClassifier.fromConfig(PatternsLoader.defaults()));
    }

    @Test
    @DisplayName("Should record an exact match when the cell equals the indicator")
    void shouldMatchExactly() {
        Dataset dataset = dataset(Row.of("remote_ip", "8.8.8.8", "host", "WS01"));

        List<Match> matches = matcher.search(dataset, "network", List.of("8.8.8.8"));

        assertThat(matches).singleElement().satisfies(m -> {
            assertThat(m.getMatchKind()).isEqualTo(MatchKind.EXACT);
            assertThat(m.getIndicatorKind()).isEqualTo(IndicatorKind.IP_ADDRESS);
            assertThat(m.getColumn()).isEqualTo("remote_ip");
            assertThat(m.getRowIndex()).isZero();
            assertThat(m.getSource()).isEqualTo("network");
            assertThat(m.getFullRow()).isEqualTo(dataset.getRows().get(0));
        });
    }

    @Test
    @DisplayName("Should match case-insensitively and keep the original cell text")
    void shouldMatchCaseInsensitively() {
        Dataset dataset = dataset(Row.of("file", "PAYLOAD.EXE"));

        List<Match> matches = matcher.search(dataset, "files", List.of("  payload.exe "));

        assertThat(matches).singleElement().satisfies(m -> {
            assertThat(m.getMatchKind()).isEqualTo(MatchKind.EXACT);
            assertThat(m.getMatchedValue()).isEqualTo("PAYLOAD.EXE");
            assertThat(m.getIndicator()).isEqualTo("payload.exe");
        });
    }

    @Test
    @DisplayName("Should record a partial match when the indicator is a substring")
    void shouldMatchPartially() {
        Dataset dataset = dataset(Row.of("cmd", "C:\\Temp\\payload.exe -silent"));

        List<Match> matches = matcher.search(dataset, "procs", List.of("payload.exe"));

        assertThat(matches).singleElement()
                .extracting(Match::getMatchKind).isEqualTo(MatchKind.PARTIAL);
    }

    @Test
    @DisplayName("Should treat indicators literally, not as patterns")
    void shouldMatchLiterally() {
        Dataset dataset = dataset(Row.of("v", "1a2b3c4"));

        assertThat(matcher.search(dataset, "s", List.of("1.2.3.4"))).isEmpty();
    }

    @Test
    @DisplayName("Should match numeric cells exactly but never partially")
    void shouldMatchNumbersExactlyOnly() {
        Dataset dataset = Dataset.ofRows(List.of(
                Row.of("event_id", new BigDecimal("4624")),
                Row.of("event_id", new BigDecimal("14624"))));

        List<Match> matches = matcher.search(dataset, "security", List.of("4624"));

        assertThat(matches).singleElement().satisfies(m -> {
            assertThat(m.getMatchKind()).isEqualTo(MatchKind.EXACT);
            assertThat(m.getRowIndex()).isZero();
            assertThat(m.getMatchedValue()).isEqualTo("4624");
        });
    }

    @Test
    @DisplayName("Should skip blank and duplicate indicators")
    void shouldSkipBlankAndDuplicateIndicators() {
        Dataset dataset = dataset(Row.of("domain", "evil.com"));

        List<Match> matches = matcher.search(dataset, "dns", List.of("", "   ", "evil.com", "EVIL.COM"));

        assertThat(matches).hasSize(1);
    }

    @Test
    @DisplayName("Should emit in indicator, column, row order")
    void shouldEmitInDeterministicOrder() {
        Dataset dataset = Dataset.ofRows(List.of(
                Row.of("a", "evil.com", "b", "x"),
                Row.of("a", "y", "b", "sub.evil.com and 10.0.0.1")));

        List<Match> matches = matcher.search(dataset, "s", List.of("10.0.0.1", "evil.com"));

        assertThat(matches).extracting(m -> m.getIndicator() + "@" + m.getColumn() + ":" + m.getRowIndex())
                .containsExactly("10.0.0.1@b:1", "evil.com@a:0", "evil.com@b:1");
    }

    @Test
    @DisplayName("Should omit sources without matches and keep store order")
    void shouldSearchAcrossStore() {
        RecordStore store = RecordStore.builder()
                .add("second", dataset(Row.of("host", "evil.com")))
                .add("none", dataset(Row.of("host", "good.org")))
                .add("first", dataset(Row.of("url", "http://evil.com/x")))
                .build();

        MatchResult result = matcher.searchAll(store, List.of("evil.com"));

        assertThat(result.getBySource()).containsOnlyKeys("second", "first");
        assertThat(result.getAll()).extracting(Match::getSource).containsExactly("second", "first");
        assertThat(result.total()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should return nothing for an empty indicator list or store")
    void shouldHandleEmptyInputs() {
        RecordStore store = RecordStore.builder().add("s", dataset(Row.of("a", "b"))).build();

        assertThat(matcher.searchAll(store, List.of()).total()).isZero();
        assertThat(matcher.searchAll(RecordStore.empty(), List.of("x")).total()).isZero();
        assertThat(matcher.search(Dataset.empty(), "s", null)).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Dataset dataset(Row... rows) {
        return Dataset.ofRows(List.of(rows));
    }
}
