package com.casesentinel.cli;

import com.casesentinel.core.config.PatternsConfig;
import com.casesentinel.core.config.PatternsLoader;
import com.casesentinel.core.engine.CorrelationEngine;
import com.casesentinel.core.engine.CorrelationResult;
import com.casesentinel.core.matching.Indicators;
import com.casesentinel.core.model.RecordStore;
import com.casesentinel.core.model.Threat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Main entry point for a Case Sentinel analysis run.
 *
 * <h3>Run</h3>
 *
 * <pre>
 *   CSV exports (INPUT_DIR)
 *     → CsvIngester → RecordStore
 *     → indicators (IOCS + IOC_FILE + INTEL_FILE, deduplicated)
 *     → threats (THREATS_FILE)
 *     → CorrelationEngine (anomalies, matches, timeline)
 *     → ReportWriter (OUTPUT_DIR: JSON report + timeline CSV)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * All configuration is resolved from environment variables via
 * {@link AnalysisConfig}; the first argument may name the input directory.
 * </p>
 *
 * @since 1.0.0
 */
public final class CaseSentinelCli {

        private static final Logger LOG = LoggerFactory.getLogger(CaseSentinelCli.class);

        private CaseSentinelCli() {
                // entry-point class — not instantiable
        }

        public static void main(String[] args) {
                // 1. Load configuration
                AnalysisConfig config = AnalysisConfig.fromEnvironment(args);
                LOG.info("Starting Case Sentinel with config: {}", config);

                ReportWriter.ReportFiles files = run(config);
                LOG.info("Analysis complete: {}", files);
        }

        /**
         * Execute one analysis run.
         *
         * @param config the run configuration
         * @return the written report files
         * @throws IllegalStateException if no dataset could be ingested
         */
        static ReportWriter.ReportFiles run(AnalysisConfig config) {
                // 2. Load detection patterns
                PatternsConfig patterns = loadPatterns(config);

                // 3. Ingest CSV exports
                RecordStore store = new CsvIngester().ingestAll(Path.of(config.getInputDir()));
                if (store.isEmpty()) {
                        throw new IllegalStateException(
                                        "No data ingested from " + config.getInputDir()
                                                        + ". Provide a directory containing CSV exports.");
                }

                // 4. Assemble indicators and external threats
                List<String> indicators = loadIndicators(config);
                List<Threat> threats = loadThreats(config);

                // 5. Correlate
                CorrelationEngine engine = CorrelationEngine.fromConfig(
                                patterns, config.getAnalystName(), config.getTimelineZone());
                CorrelationResult result = engine.correlate(store, indicators, threats);

                // 6. Report
                return new ReportWriter(Path.of(config.getOutputDir()))
                                .write(result, store, config.getAnalystName());
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static PatternsConfig loadPatterns(AnalysisConfig config) {
                String path = config.getPatternsConfigPath();
                if (!path.isEmpty()) {
                        return PatternsLoader.fromFile(path);
                }
                return PatternsLoader.load();
        }

        static List<String> loadIndicators(AnalysisConfig config) {
                List<String> known = new ArrayList<>(Indicators.parse(config.getIocText()));
                if (!config.getIocFile().isEmpty()) {
                        known.addAll(Indicators.parse(readText(Path.of(config.getIocFile()))));
                }

                List<String> osint = List.of();
                if (!config.getIntelFile().isEmpty()) {
                        osint = new IntelligenceLoader().load(Path.of(config.getIntelFile())).allIndicators();
                }

                List<String> combined = Indicators.combine(known, osint);
                LOG.info("Using {} indicator(s): {} provided, {} from intelligence",
                                combined.size(), known.size(), osint.size());
                return combined;
        }

        private static List<Threat> loadThreats(AnalysisConfig config) {
                if (config.getThreatsFile().isEmpty()) {
                        return List.of();
                }
                return new ThreatLoader().load(Path.of(config.getThreatsFile()));
        }

        private static String readText(Path file) {
                if (!Files.isRegularFile(file)) {
                        throw new IllegalArgumentException("IOC file not found: " + file);
                }
                try {
                        return Files.readString(file, StandardCharsets.UTF_8);
                } catch (IOException e) {
                        throw new UncheckedIOException("Failed to read IOC file " + file, e);
                }
        }
}
