package com.casesentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CellValue}, {@link Row} and {@link Dataset}.
 */
class DatasetTest {

    @Test
    @DisplayName("Should type raw values into text, number and null cells")
    void shouldTypeRawValues() {
        assertThat(CellValue.of("abc").isText()).isTrue();
        assertThat(CellValue.of(42).isNumber()).isTrue();
        assertThat(CellValue.of(null).isNull()).isTrue();
        assertThat(CellValue.of(Double.NaN).isText()).isTrue();
    }

    @Test
    @DisplayName("Should render numbers without trailing zeros or exponent")
    void shouldRenderNumbersPlainly() {
        assertThat(CellValue.number(new BigDecimal("1700000000")).asText()).contains("1700000000");
        assertThat(CellValue.number(4625.0).asText()).contains("4625");
        assertThat(CellValue.number(new BigDecimal("1.50")).asText()).contains("1.5");
        assertThat(CellValue.nullValue().asText()).isEmpty();
    }

    @Test
    @DisplayName("Should normalize column names on construction")
    void shouldNormalizeColumnNames() {
        Row row = Row.of("Command Line", "cmd.exe", " Event-ID ", 4688);

        assertThat(row.columns()).containsExactly("command_line", "event_id");
        assertThat(row.text("command_line")).contains("cmd.exe");
        assertThat(row.get("missing").isNull()).isTrue();
    }

    @Test
    @DisplayName("Should reject columns that collide after normalization")
    void shouldRejectCollidingColumns() {
        assertThatThrownBy(() -> Row.of("User Name", "a", "user_name", "b"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("user_name");
    }

    @Test
    @DisplayName("Should return the first alias present with a non-null value")
    void shouldResolveFirstPresentAlias() {
        Row row = Row.of("account", null, "username", "alice", "user", "bob");

        assertThat(row.firstPresent(List.of("account", "user", "username"))).contains("bob");
        assertThat(row.firstPresent(List.of("host", "computer"))).isEmpty();
    }

    @Test
    @DisplayName("Should reject rows whose columns differ from the dataset")
    void shouldRejectMismatchedRows() {
        List<Row> rows = List.of(Row.of("a", 1), Row.of("b", 2));

        assertThatThrownBy(() -> new Dataset(List.of("a"), rows))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Row 1");
    }

    @Test
    @DisplayName("Should return empty for a row index out of bounds")
    void shouldReturnEmptyForOutOfBoundsRow() {
        Dataset dataset = Dataset.ofRows(List.of(Row.of("a", "x")));

        assertThat(dataset.row(0)).isPresent();
        assertThat(dataset.row(1)).isEmpty();
        assertThat(dataset.row(-1)).isEmpty();
    }

    @Test
    @DisplayName("Should report only columns holding text as textual")
    void shouldDetectTextualColumns() {
        Dataset dataset = Dataset.ofRows(List.of(
                Row.of("pid", 4, "name", null),
                Row.of("pid", 8, "name", "svchost.exe")));

        FoldedDataset folded = new FoldedDataset(dataset);

        assertThat(folded.getTextualColumns()).containsExactly("name");
        assertThat(folded.folded("name", 1)).isEqualTo("svchost.exe");
        assertThat(folded.folded("name", 0)).isNull();
    }

    @Test
    @DisplayName("Should keep sources in insertion order and reject duplicates")
    void shouldBuildRecordStoreInOrder() {
        RecordStore store = RecordStore.builder()
                .add("zeta", Dataset.empty())
                .add("alpha", Dataset.empty())
                .build();

        assertThat(store.sourceNames()).containsExactly("zeta", "alpha");
        assertThatThrownBy(() -> RecordStore.builder().add("a", Dataset.empty()).add("a", Dataset.empty()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should render absent timeline fields as empty strings")
    void shouldRenderTimelineRows() {
        Finding finding = Finding.builder()
                .event("IOC Match")
                .artifact("Prefetch")
                .level(ThreatLevel.SUSPICIOUS)
                .build();

        Timeline timeline = new Timeline(List.of(finding));

        assertThat(timeline.getColumns()).containsExactly("Timestamp", "Device Name", "Account", "Event",
                "Artifact", "Event ID", "Analyst", "Comments", "Level");
        assertThat(timeline.toRows().get(0))
                .containsEntry("Timestamp", "")
                .containsEntry("Event", "IOC Match")
                .containsEntry("Level", "Suspicious");
    }
}
