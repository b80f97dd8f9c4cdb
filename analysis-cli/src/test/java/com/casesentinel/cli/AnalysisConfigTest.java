package com.casesentinel.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalysisConfig}.
 */
class AnalysisConfigTest {

    @Test
    @DisplayName("Should apply defaults when only the input directory is set")
    void shouldApplyDefaults() {
        AnalysisConfig config = AnalysisConfig.fromEnvironment(Map.of("INPUT_DIR", "/cases/42"), new String[0]);

        assertThat(config.getInputDir()).isEqualTo("/cases/42");
        assertThat(config.getOutputDir()).isEqualTo("reports");
        assertThat(config.getAnalystName()).isEqualTo("analyst");
        assertThat(config.getIocText()).isEmpty();
        assertThat(config.getPatternsConfigPath()).isEmpty();
        assertThat(config.getTimelineZone()).isEqualTo(ZoneId.of("UTC"));
    }

    @Test
    @DisplayName("Should let the first argument override INPUT_DIR")
    void shouldPreferArgument() {
        AnalysisConfig config = AnalysisConfig.fromEnvironment(
                Map.of("INPUT_DIR", "/from/env"), new String[]{"/from/args"});

        assertThat(config.getInputDir()).isEqualTo("/from/args");
    }

    @Test
    @DisplayName("Should read every variable from the environment")
    void shouldReadEnvironment() {
        AnalysisConfig config = AnalysisConfig.fromEnvironment(Map.of(
                "INPUT_DIR", "in",
                "OUTPUT_DIR", "out",
                "ANALYST_NAME", "jdoe",
                "IOCS", "8.8.8.8",
                "IOC_FILE", "iocs.txt",
                "INTEL_FILE", "intel.json",
                "THREATS_FILE", "threats.json",
                "PATTERNS_CONFIG_PATH", "patterns.yml",
                "TIMELINE_ZONE", "Europe/Berlin"), null);

        assertThat(config.getOutputDir()).isEqualTo("out");
        assertThat(config.getAnalystName()).isEqualTo("jdoe");
        assertThat(config.getIocText()).isEqualTo("8.8.8.8");
        assertThat(config.getIocFile()).isEqualTo("iocs.txt");
        assertThat(config.getIntelFile()).isEqualTo("intel.json");
        assertThat(config.getThreatsFile()).isEqualTo("threats.json");
        assertThat(config.getPatternsConfigPath()).isEqualTo("patterns.yml");
        assertThat(config.getTimelineZone()).isEqualTo(ZoneId.of("Europe/Berlin"));
    }

    @Test
    @DisplayName("Should reject a missing input directory")
    void shouldRejectMissingInput() {
        assertThatThrownBy(() -> AnalysisConfig.fromEnvironment(Map.of(), new String[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("inputDir");
    }

    @Test
    @DisplayName("Should reject an unknown time zone")
    void shouldRejectBadZone() {
        assertThatThrownBy(() -> AnalysisConfig.fromEnvironment(
                Map.of("INPUT_DIR", "in", "TIMELINE_ZONE", "Mars/Olympus"), new String[0]))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("TIMELINE_ZONE");
    }

    @Test
    @DisplayName("Should reject a blank analyst name in the builder")
    void shouldRejectBlankAnalyst() {
        assertThatThrownBy(() -> new AnalysisConfig.Builder().inputDir("in").analystName(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("analystName");
    }
}
