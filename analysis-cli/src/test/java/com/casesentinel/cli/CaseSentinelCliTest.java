package com.casesentinel.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link CaseSentinelCli}.
 */
class CaseSentinelCliTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should analyse a directory of exports and write both reports")
    void shouldRunAnalysis() throws IOException {
        Path input = Files.createDirectories(dir.resolve("exports"));
        write(input.resolve("process_list.csv"),
                "timestamp,command_line\n2024-03-01 09:00:00,C:\\Users\\a\\AppData\\Local\\Temp\\payload.exe\n");
        write(input.resolve("security_log.csv"),
                "timestamp,source_ip,account_name\n2024-03-01 08:00:00,10.0.0.5,alice\n");

        AnalysisConfig config = new AnalysisConfig.Builder()
                .inputDir(input.toString())
                .outputDir(dir.resolve("out").toString())
                .analystName("jdoe")
                .iocText("10.0.0.5\npayload.exe")
                .threatsFile(resource("analysis-results.json").toString())
                .build();

        ReportWriter.ReportFiles files = CaseSentinelCli.run(config);

        assertThat(files.getJsonReport()).exists().hasParent(dir.resolve("out"));
        assertThat(files.getTimelineCsv()).exists();

        JsonNode summary = new ObjectMapper().readTree(files.getJsonReport().toFile()).get("summary");
        assertThat(summary.get("total_sources_analyzed").asInt()).isEqualTo(2);
        assertThat(summary.get("total_matches").asInt()).isEqualTo(2);
        assertThat(summary.get("total_anomalies").asInt()).isPositive();
        assertThat(summary.get("total_threats").asInt()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should fail when no CSV export could be ingested")
    void shouldRejectEmptyInput() throws IOException {
        Path input = Files.createDirectories(dir.resolve("empty"));
        write(input.resolve("readme.txt"), "nothing here");

        AnalysisConfig config = new AnalysisConfig.Builder()
                .inputDir(input.toString())
                .outputDir(dir.resolve("out").toString())
                .build();

        assertThatThrownBy(() -> CaseSentinelCli.run(config))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No data ingested");
        assertThat(dir.resolve("out")).doesNotExist();
    }

    @Test
    @DisplayName("Should combine pasted, file and intelligence indicators without duplicates")
    void shouldCombineIndicators() throws IOException {
        Path iocFile = write(dir.resolve("iocs.txt"), "185.1.1.1\nmalware.exe\n");

        AnalysisConfig config = new AnalysisConfig.Builder()
                .inputDir(dir.toString())
                .iocText("10.0.0.5, EVIL.example.com")
                .iocFile(iocFile.toString())
                .intelFile(resource("intel-apt29.json").toString())
                .build();

        assertThat(CaseSentinelCli.loadIndicators(config)).containsExactly(
                "10.0.0.5", "EVIL.example.com", "185.1.1.1", "malware.exe",
                "185.1.1.2", "beacon.dll", "ok.exe");
    }

    @Test
    @DisplayName("Should reject a missing IOC file")
    void shouldRejectMissingIocFile() {
        AnalysisConfig config = new AnalysisConfig.Builder()
                .inputDir(dir.toString())
                .iocFile(dir.resolve("missing.txt").toString())
                .build();

        assertThatThrownBy(() -> CaseSentinelCli.loadIndicators(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("IOC file not found");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Path write(Path file, String content) throws IOException {
        return Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private static Path resource(String name) {
        try {
            return Path.of(CaseSentinelCliTest.class.getClassLoader().getResource(name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
