package com.casesentinel.core.timeline;

import com.casesentinel.core.config.PatternsLoader;
import com.casesentinel.core.model.Row;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TimestampExtractor}.
 */
class TimestampExtractorTest {

    private TimestampExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = TimestampExtractor.fromConfig(PatternsLoader.defaults());
    }

    @ParameterizedTest(name = "[{0}] -> {1}")
    @CsvSource(delimiter = '|', value = {
            "Event occurred 2024-03-15 10:22:05 on host | 2024-03-15 10:22:05",
            "logged 03/15/2024   10:22:05            | 2024-03-15 10:22:05",
            "2024-03-15T10:22:05.123Z                   | 2024-03-15 10:22:05",
            "at 15-03-2024 10:22:05                     | 2024-03-15 10:22:05",
            "1700000000                                 | 2023-11-14 22:13:20",
            "created=1700000000123ms                    | 2023-11-14 22:13:20",
    })
    @DisplayName("Should extract embedded timestamps in canonical form")
    void shouldExtractTimestamps(String text, String expected) {
        assertThat(extractor.extract(text)).contains(expected);
    }

    @Test
    @DisplayName("Should return empty when nothing recognizable is embedded")
    void shouldReturnEmptyWithoutTimestamp() {
        assertThat(extractor.extract("no timestamp here")).isEmpty();
        assertThat(extractor.extract("12345678901")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
        assertThat(extractor.extract("")).isEmpty();
    }

    @Test
    @DisplayName("Should skip a timestamp-shaped value that is not a real date")
    void shouldSkipImpossibleDates() {
        assertThat(extractor.extract("2024-02-30 10:00:00 then 2024-03-01 08:00:00"))
                .contains("2024-03-01 08:00:00");
        assertThat(extractor.extract("2024-13-45 99:99:99")).isEmpty();
    }

    @Test
    @DisplayName("Should prefer textual formats over epoch digits")
    void shouldPreferTextualFormats() {
        assertThat(extractor.extract("1700000000 2024-03-15 10:22:05")).contains("2024-03-15 10:22:05");
    }

    @Test
    @DisplayName("Should render epochs in the configured zone")
    void shouldRenderEpochInZone() {
        TimestampExtractor berlin = new TimestampExtractor(List.of(), ZoneId.of("Europe/Berlin"));

        assertThat(berlin.extract("1700000000")).contains("2023-11-14 23:13:20");
    }

    @Test
    @DisplayName("Should prefer the direct value over fallback columns")
    void shouldPreferDirectValue() {
        Row row = Row.of("timestamp", "2020-01-01 00:00:00", "message", "x");

        assertThat(extractor.resolve("seen 2024-03-15 10:22:05", row)).contains("2024-03-15 10:22:05");
    }

    @Test
    @DisplayName("Should fall back to the first resolvable timestamp column")
    void shouldFallBackToColumns() {
        Row row = Row.of("time", "garbage", "date", "03/15/2024 10:22:05", "timestamp", null);

        assertThat(extractor.resolve("C:\\Windows\\evil.exe", row)).contains("2024-03-15 10:22:05");
    }

    @Test
    @DisplayName("Should read numeric epoch columns")
    void shouldReadNumericEpochColumn() {
        Row row = Row.of("event_time", new BigDecimal("1700000000"));

        assertThat(extractor.resolve(null, row)).contains("2023-11-14 22:13:20");
    }

    @Test
    @DisplayName("Should return empty when neither value nor columns resolve")
    void shouldReturnEmptyWhenUnresolved() {
        assertThat(extractor.resolve("nothing", Row.of("host", "WS01"))).isEmpty();
        assertThat(extractor.resolve("nothing", null)).isEmpty();
    }
}
