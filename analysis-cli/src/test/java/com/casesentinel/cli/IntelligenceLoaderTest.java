package com.casesentinel.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link IntelligenceLoader}.
 */
class IntelligenceLoaderTest {

    @TempDir
    Path dir;

    private final IntelligenceLoader loader = new IntelligenceLoader();

    @Test
    @DisplayName("Should flatten indicator categories in document order")
    void shouldLoadReport() {
        Path file = resource("intel-apt29.json");

        IntelligenceReport report = loader.load(file);

        assertThat(report.getThreatActor()).isEqualTo("APT29");
        assertThat(report.getTtps()).singleElement()
                .extracting(IntelligenceReport.Ttp::getTechnique).isEqualTo("T1059");
        assertThat(report.getSources()).containsExactly("vendor blog");
        assertThat(report.allIndicators())
                .containsExactly("185.1.1.1", "185.1.1.2", "evil.example.com", "beacon.dll", "ok.exe");
    }

    @Test
    @DisplayName("Should return no indicators when iocs are absent")
    void shouldHandleMissingIocs() throws IOException {
        Path file = dir.resolve("intel.json");
        Files.writeString(file, "{\"threat_actor\": \"Nobody\"}");

        assertThat(loader.load(file).allIndicators()).isEmpty();
    }

    @Test
    @DisplayName("Should throw for malformed JSON")
    void shouldRejectMalformedJson() throws IOException {
        Path file = dir.resolve("intel.json");
        Files.writeString(file, "{not json");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to parse intelligence file");
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldRejectMissingFile() {
        assertThatThrownBy(() -> loader.load(dir.resolve("missing.json")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Path resource(String name) {
        try {
            return Path.of(IntelligenceLoaderTest.class.getClassLoader().getResource(name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
