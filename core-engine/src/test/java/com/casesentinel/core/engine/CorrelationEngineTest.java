package com.casesentinel.core.engine;

import com.casesentinel.core.config.PatternsLoader;
import com.casesentinel.core.model.Anomaly;
import com.casesentinel.core.model.AnomalyRuleType;
import com.casesentinel.core.model.Dataset;
import com.casesentinel.core.model.Finding;
import com.casesentinel.core.model.IndicatorKind;
import com.casesentinel.core.model.Match;
import com.casesentinel.core.model.MatchKind;
import com.casesentinel.core.model.RecordStore;
import com.casesentinel.core.model.Row;
import com.casesentinel.core.model.Severity;
import com.casesentinel.core.model.Threat;
import com.casesentinel.core.model.ThreatLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for {@link CorrelationEngine}.
 */
class CorrelationEngineTest {

    private CorrelationEngine engine;

    @BeforeEach
    void setUp() {
        engine = CorrelationEngine.fromConfig(PatternsLoader.defaults(), "jdoe");
    }

    @Test
    @DisplayName("Should flag a temp-dropped executable and match it as an executable indicator")
    void shouldCorrelateProcessList() {
        RecordStore store = RecordStore.builder()
                .add("process_list", Dataset.ofRows(List.of(
                        Row.of("command_line", "C:\\Users\\a\\AppData\\Local\\Temp\\payload.exe"))))
                .build();

        CorrelationResult result = engine.correlate(store, List.of("payload.exe"), List.of());

        List<Anomaly> anomalies = result.getDetection().getAll();
        assertThat(anomalies).filteredOn(a -> a.getRuleType() == AnomalyRuleType.SUSPICIOUS_EXTENSION)
                .singleElement()
                .satisfies(a -> {
                    assertThat(a.getSeverity()).isEqualTo(Severity.MEDIUM);
                    assertThat(a.getPattern()).isEqualTo(".exe");
                });
        assertThat(anomalies).filteredOn(a -> a.getRuleType() == AnomalyRuleType.SUSPICIOUS_PATH)
                .extracting(Anomaly::getPattern)
                .contains("temp")
                .allSatisfy(p -> assertThat(p).isIn("temp", "appdata", "local.*temp"));
        assertThat(anomalies).filteredOn(a -> a.getRuleType() == AnomalyRuleType.SUSPICIOUS_PATH)
                .allSatisfy(a -> assertThat(a.getSeverity()).isEqualTo(Severity.MEDIUM));

        assertThat(result.getMatches().getAll()).singleElement().satisfies(m -> {
            assertThat(m.getIndicatorKind()).isEqualTo(IndicatorKind.EXECUTABLE);
            assertThat(m.getMatchKind()).isEqualTo(MatchKind.PARTIAL);
            assertThat(m.getColumn()).isEqualTo("command_line");
        });

        assertThat(result.getTimeline().getFindings())
                .hasSize(result.getMatches().total() + result.getDetection().total())
                .allSatisfy(f -> {
                    assertThat(f.getArtifact()).isEqualTo("Process List");
                    assertThat(f.getAnalyst()).isEqualTo("jdoe");
                });
    }

    @Test
    @DisplayName("Should record an exact match when a cell holds only the indicator")
    void shouldMatchExactCell() {
        RecordStore store = RecordStore.builder()
                .add("process_list", Dataset.ofRows(List.of(Row.of("image", "payload.exe"))))
                .build();

        CorrelationResult result = engine.correlate(store, List.of("payload.exe"), List.of());

        assertThat(result.getMatches().getAll()).singleElement()
                .extracting(Match::getMatchKind).isEqualTo(MatchKind.EXACT);
    }

    @Test
    @DisplayName("Should feed matches, anomalies and threats into one ordered timeline")
    void shouldBuildTimeline() {
        RecordStore store = RecordStore.builder()
                .add("security_log", Dataset.ofRows(List.of(
                        Row.of("timestamp", "2024-03-15 12:00:00", "computer", "WS01",
                                "process_name", "notepad.exe"),
                        Row.of("timestamp", "2024-03-15 08:00:00", "computer", "WS02",
                                "process_name", "rundll32 10.0.0.5"))))
                .build();
        Threat threat = Threat.builder()
                .description("Lateral movement")
                .severity(Severity.HIGH)
                .source("security_log")
                .build();

        CorrelationResult result = engine.correlate(store, List.of("10.0.0.5"), List.of(threat));

        List<Finding> findings = result.getTimeline().getFindings();
        assertThat(findings).extracting(Finding::getTimestamp)
                .containsExactly("2024-03-15 08:00:00", "2024-03-15 12:00:00", null);
        assertThat(findings.get(0).getEvent()).startsWith("IOC Match: 10.0.0.5");
        assertThat(findings.get(1).getEvent()).isEqualTo("Found suspicious extension .exe in process_name");
        assertThat(findings.get(2).getLevel()).isEqualTo(ThreatLevel.MALICIOUS);
        assertThat(findings.get(2).getArtifact()).isEqualTo("Security Event Log");

        assertThat(result.getMatchSummary().getTotal()).isEqualTo(1);
        assertThat(result.getAnomalySummary().getTotal()).isEqualTo(1);
        assertThat(result.getThreats()).containsExactly(threat);
    }

    @Test
    @DisplayName("Should return empty results for an empty store")
    void shouldHandleEmptyStore() {
        CorrelationResult result = engine.correlate(RecordStore.empty(), List.of("x"), null);

        assertThat(result.getDetection().total()).isZero();
        assertThat(result.getMatches().total()).isZero();
        assertThat(result.getTimeline().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should be reusable across runs")
    void shouldBeReusable() {
        RecordStore store = RecordStore.builder()
                .add("files", Dataset.ofRows(List.of(Row.of("name", "dropper.exe"))))
                .build();

        CorrelationResult first = engine.correlate(store, List.of(), List.of());
        CorrelationResult second = engine.correlate(store, List.of(), List.of());

        assertThat(second.getTimeline().getFindings()).containsExactlyElementsOf(first.getTimeline().getFindings());
    }
}
