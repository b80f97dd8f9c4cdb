package com.casesentinel.cli;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads an {@link IntelligenceReport} from a JSON file.
 *
 * @since 1.0.0
 */
public class IntelligenceLoader {

    private static final Logger LOG = LoggerFactory.getLogger(IntelligenceLoader.class);

    private final ObjectMapper mapper;

    public IntelligenceLoader() {
        this.mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @param file the intelligence file
     * @return the parsed report
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file is not a valid report
     */
    public IntelligenceReport load(Path file) {
        Objects.requireNonNull(file, "Intelligence file must not be null");
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Intelligence file not found: " + file);
        }
        try {
            IntelligenceReport report = mapper.readValue(file.toFile(), IntelligenceReport.class);
            if (report == null) {
                throw new IllegalStateException("Intelligence file is empty: " + file);
            }
            LOG.info("Loaded intelligence for [{}]: {} TTP(s), {} indicator(s)",
                    report.getThreatActor(), report.getTtps().size(), report.allIndicators().size());
            return report;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to parse intelligence file " + file + ": " + e.getMessage(), e);
        }
    }
}
