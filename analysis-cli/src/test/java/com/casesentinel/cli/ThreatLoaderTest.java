package com.casesentinel.cli;

import com.casesentinel.core.model.Severity;
import com.casesentinel.core.model.Threat;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ThreatLoader}.
 */
class ThreatLoaderTest {

    @TempDir
    Path dir;

    private final ThreatLoader loader = new ThreatLoader();

    @Test
    @DisplayName("Should flatten threats and tag them with their result's source")
    void shouldLoadThreats() {
        Path file = resource("analysis-results.json");

        List<Threat> threats = loader.load(file);

        assertThat(threats).extracting(Threat::getType).containsExactly("Lateral Movement", "Recon", "C2");
        assertThat(threats).extracting(Threat::getSource)
                .containsExactly("security_log", "security_log", "proxy_override");
        assertThat(threats.get(0).getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(threats.get(0).getRowIndex()).isEqualTo(3);
        assertThat(threats.get(0).getIndicators()).containsExactly("10.0.0.5");
        assertThat(threats.get(1).getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(threats.get(2).getSeverity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    @DisplayName("Should keep the producer's text for an unknown severity")
    void shouldKeepUnknownSeverityText() {
        List<Threat> threats = loader.load(resource("analysis-results.json"));

        assertThat(threats).extracting(Threat::getReportedSeverity)
                .containsExactly(null, "bogus", null);

        JsonNode json = new ObjectMapper().valueToTree(threats);
        assertThat(json.get(1).get("severity").asText()).isEqualTo("medium");
        assertThat(json.get(1).get("reported_severity").asText()).isEqualTo("bogus");
        assertThat(json.get(2).has("reported_severity")).isFalse();
    }

    @Test
    @DisplayName("Should throw for a file that is not a results array")
    void shouldRejectMalformedFile() throws IOException {
        Path file = dir.resolve("threats.json");
        Files.writeString(file, "{\"threats\": []}");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to parse threats file");
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldRejectMissingFile() {
        assertThatThrownBy(() -> loader.load(dir.resolve("nope.json")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Path resource(String name) {
        try {
            return Path.of(ThreatLoaderTest.class.getClassLoader().getResource(name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
