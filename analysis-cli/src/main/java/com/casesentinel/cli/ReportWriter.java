package com.casesentinel.cli;

import com.casesentinel.core.engine.CorrelationResult;
import com.casesentinel.core.model.Anomaly;
import com.casesentinel.core.model.Match;
import com.casesentinel.core.model.RecordStore;
import com.casesentinel.core.model.Threat;
import com.casesentinel.core.model.Timeline;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes the JSON case report and the timeline CSV of a correlation run.
 *
 * <h3>Files</h3>
 * <ul>
 * <li>{@code forensic_report_<yyyyMMdd_HHmmss>.json}: generation instant,
 * summary counts, match and anomaly summaries, matches, anomalies, threats
 * and the timeline rows.</li>
 * <li>{@code forensic_report_<yyyyMMdd_HHmmss>.txt}: the same case summary
 * as plain text for reading, with numbered match, anomaly and threat
 * sections.</li>
 * <li>{@code timeline_<yyyyMMdd_HHmmss>.csv}: the timeline with header
 * {@code Timestamp, Device Name, Account, Event, Artifact, Event ID, Analyst,
 * Comments, Level}. An empty timeline produces the header only.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class ReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ReportWriter.class);

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final DateTimeFormatter TEXT_STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String RULE = "=".repeat(80);
    private static final String SECTION_RULE = "-".repeat(80);

    private final Path outputDir;
    private final Clock clock;
    private final ObjectMapper jsonMapper;
    private final CsvMapper csvMapper;
    private final CsvSchema timelineSchema;

    public ReportWriter(Path outputDir) {
        this(outputDir, Clock.systemDefaultZone());
    }

    /**
     * @param outputDir directory the reports are written to; created when
     *                  missing
     * @param clock     source of the generation instant and file stamps
     */
    public ReportWriter(Path outputDir, Clock clock) {
        this.outputDir = Objects.requireNonNull(outputDir, "Output directory must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");

        this.jsonMapper = new ObjectMapper();
        jsonMapper.registerModule(new JavaTimeModule());
        jsonMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        jsonMapper.enable(SerializationFeature.INDENT_OUTPUT);

        this.csvMapper = new CsvMapper();
        CsvSchema.Builder schema = CsvSchema.builder();
        for (String column : Timeline.COLUMNS) {
            schema.addColumn(column);
        }
        this.timelineSchema = schema.build().withHeader();
    }

    /**
     * @param result  the correlation result
     * @param store   the analysed datasets
     * @param analyst analyst name recorded in the report
     * @return paths of the written files
     * @throws UncheckedIOException if a file cannot be written
     */
    public ReportFiles write(CorrelationResult result, RecordStore store, String analyst) {
        Objects.requireNonNull(result, "CorrelationResult must not be null");
        Objects.requireNonNull(store, "RecordStore must not be null");

        Instant now = clock.instant();
        String stamp = FILE_STAMP.format(LocalDateTime.ofInstant(now, clock.getZone()));
        try {
            Files.createDirectories(outputDir);
            Path json = outputDir.resolve("forensic_report_" + stamp + ".json");
            Path text = outputDir.resolve("forensic_report_" + stamp + ".txt");
            Path csv = outputDir.resolve("timeline_" + stamp + ".csv");

            jsonMapper.writeValue(json.toFile(), report(result, store, analyst, now));
            LOG.info("JSON report saved to {}", json);

            Files.write(text, textReport(result, store, analyst, LocalDateTime.ofInstant(now, clock.getZone())),
                    StandardCharsets.UTF_8);
            LOG.info("Text report saved to {}", text);

            writeTimeline(result.getTimeline(), csv);
            LOG.info("Timeline saved to {} ({} entries)", csv, result.getTimeline().size());

            return new ReportFiles(json, text, csv);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write reports to " + outputDir, e);
        }
    }

    /**
     * Write a timeline as CSV.
     *
     * @param timeline the timeline
     * @param file     target file, overwritten if present
     * @throws IOException if the file cannot be written
     */
    public void writeTimeline(Timeline timeline, Path file) throws IOException {
        List<Map<String, String>> rows = timeline.toRows();
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            if (rows.isEmpty()) {
                // jackson writes the header lazily with the first row
                out.write(String.join(String.valueOf(timelineSchema.getColumnSeparator()), Timeline.COLUMNS));
                out.write(timelineSchema.getLineSeparator());
                return;
            }
            csvMapper.writer(timelineSchema).writeValues(out).writeAll(rows).close();
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Map<String, Object> report(CorrelationResult result, RecordStore store,
                                              String analyst, Instant generatedAt) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_sources_analyzed", store.size());
        summary.put("total_matches", result.getMatches().total());
        summary.put("total_anomalies", result.getDetection().total());
        summary.put("total_threats", result.getThreats().size());
        summary.put("timeline_entries", result.getTimeline().size());

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("generated_at", generatedAt);
        report.put("analyst", analyst);
        report.put("sources", store.sourceNames());
        report.put("summary", summary);
        report.put("match_summary", result.getMatchSummary());
        report.put("anomaly_summary", result.getAnomalySummary());
        report.put("ioc_matches", result.getMatches().getAll());
        report.put("pattern_based_anomalies", result.getDetection().getAll());
        report.put("all_threats", result.getThreats());
        report.put("timeline", result.getTimeline().toRows());
        return report;
    }

    static List<String> textReport(CorrelationResult result, RecordStore store,
                                   String analyst, LocalDateTime generatedAt) {
        List<String> lines = new ArrayList<>();
        lines.add(RULE);
        lines.add("CASE SENTINEL FORENSIC ANALYSIS REPORT");
        lines.add(RULE);
        lines.add("Generated: " + TEXT_STAMP.format(generatedAt));
        lines.add("Analyst: " + analyst);
        lines.add("");

        List<Match> matches = result.getMatches().getAll();
        List<Anomaly> anomalies = result.getDetection().getAll();
        List<Threat> threats = result.getThreats();

        lines.add("SUMMARY");
        lines.add(SECTION_RULE);
        lines.add("Sources Analyzed: " + store.size());
        lines.add("IOC Matches: " + matches.size());
        lines.add("Pattern-based Anomalies: " + anomalies.size());
        lines.add("Threats: " + threats.size());
        lines.add("Timeline Entries: " + result.getTimeline().size());
        lines.add("");

        if (!matches.isEmpty()) {
            lines.add("IOC MATCHES");
            lines.add(SECTION_RULE);
            int n = 1;
            for (Match m : matches) {
                lines.add(n++ + ". [" + m.getMatchKind().name() + "] "
                        + m.getIndicator() + " (" + m.getIndicatorKind().wireName() + ")");
                lines.add("   Source: " + m.getSource());
                lines.add("   Column: " + m.getColumn() + ", row " + m.getRowIndex());
                lines.add("   Value: " + m.getMatchedValue());
                lines.add("");
            }
        }

        if (!anomalies.isEmpty()) {
            lines.add("PATTERN-BASED ANOMALIES");
            lines.add(SECTION_RULE);
            int n = 1;
            for (Anomaly a : anomalies) {
                lines.add(n++ + ". [" + a.getSeverity().name() + "] " + a.getDescription());
                lines.add("   Source: " + a.getSource());
                lines.add("   Column: " + a.getColumn());
                lines.add("   Value: " + a.getValue());
                lines.add("");
            }
        }

        if (!threats.isEmpty()) {
            lines.add("THREATS");
            lines.add(SECTION_RULE);
            int n = 1;
            for (Threat t : threats) {
                lines.add(n++ + ". [" + t.getSeverity().name() + "] "
                        + (t.getType() != null ? t.getType() : "unknown"));
                lines.add("   Source: " + (t.getSource() != null ? t.getSource() : "unknown"));
                lines.add("   Description: " + (t.getDescription() != null ? t.getDescription() : "No description"));
                if (!t.getIndicators().isEmpty()) {
                    lines.add("   Indicators: " + String.join(", ", t.getIndicators()));
                }
                if (t.getRecommendation() != null && !t.getRecommendation().isBlank()) {
                    lines.add("   Recommendation: " + t.getRecommendation());
                }
                lines.add("");
            }
        }

        lines.add(RULE);
        return lines;
    }

    /**
     * Paths of one run's report files.
     */
    public static final class ReportFiles {
        private final Path jsonReport;
        private final Path textReport;
        private final Path timelineCsv;

        ReportFiles(Path jsonReport, Path textReport, Path timelineCsv) {
            this.jsonReport = jsonReport;
            this.textReport = textReport;
            this.timelineCsv = timelineCsv;
        }

        public Path getJsonReport() {
            return jsonReport;
        }

        public Path getTextReport() {
            return textReport;
        }

        public Path getTimelineCsv() {
            return timelineCsv;
        }

        @Override
        public String toString() {
            return "ReportFiles{json=" + jsonReport + ", text=" + textReport + ", timeline=" + timelineCsv + '}';
        }
    }
}
