package com.casesentinel.cli;

import com.casesentinel.core.model.Threat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads externally produced analysis results and flattens their threats.
 *
 * <pre>
 * [
 *   {"source": "security_log", "threats": [
 *       {"type": "Lateral movement", "severity": "high", "description": "...",
 *        "indicators": ["10.0.0.5"], "recommendation": "Isolate host", "row_index": 3}
 *   ]}
 * ]
 * </pre>
 *
 * <p>
 * Each threat without its own {@code source} inherits the enclosing
 * result's. Unknown severities fall back to medium; they are logged and
 * the original text is kept on the threat.
 * </p>
 *
 * @since 1.0.0
 */
public class ThreatLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ThreatLoader.class);

    private static final TypeReference<List<AnalysisResult>> RESULTS = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public ThreatLoader() {
        this.mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @param file the analysis-results file
     * @return all threats, in document order
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file is malformed
     */
    public List<Threat> load(Path file) {
        Objects.requireNonNull(file, "Threats file must not be null");
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Threats file not found: " + file);
        }
        List<AnalysisResult> results;
        try {
            results = mapper.readValue(file.toFile(), RESULTS);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to parse threats file " + file + ": " + e.getMessage(), e);
        }

        List<Threat> threats = new ArrayList<>();
        if (results != null) {
            for (AnalysisResult result : results) {
                if (result == null) {
                    continue;
                }
                for (Threat threat : result.threats) {
                    if (threat == null) {
                        continue;
                    }
                    if (threat.getSource() == null) {
                        threat.setSource(result.source);
                    }
                    if (threat.getReportedSeverity() != null) {
                        LOG.warn("Unknown severity '{}' on threat '{}' from {}; treated as {}",
                                threat.getReportedSeverity(), threat.getType(), threat.getSource(),
                                threat.getSeverity());
                    }
                    threats.add(threat);
                }
            }
        }
        LOG.info("Loaded {} threat(s) from {}", threats.size(), file);
        return threats;
    }

    /** One entry of the results file. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class AnalysisResult {
        public String source;
        public List<Threat> threats = new ArrayList<>();

        public void setThreats(List<Threat> threats) {
            this.threats = threats != null ? threats : new ArrayList<>();
        }
    }
}
