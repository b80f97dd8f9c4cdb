package com.casesentinel.cli;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration for one Case Sentinel analysis run.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults;
 * the first command-line argument, when given, overrides {@code INPUT_DIR}.
 * </p>
 *
 * <h3>Variables</h3>
 * <table>
 * <caption>Environment</caption>
 * <tr><th>Name</th><th>Default</th></tr>
 * <tr><td>{@code INPUT_DIR}</td><td>required</td></tr>
 * <tr><td>{@code OUTPUT_DIR}</td><td>{@code reports}</td></tr>
 * <tr><td>{@code ANALYST_NAME}</td><td>{@code analyst}</td></tr>
 * <tr><td>{@code IOCS}</td><td>none; pasted indicator text</td></tr>
 * <tr><td>{@code IOC_FILE}</td><td>none</td></tr>
 * <tr><td>{@code INTEL_FILE}</td><td>none</td></tr>
 * <tr><td>{@code THREATS_FILE}</td><td>none</td></tr>
 * <tr><td>{@code PATTERNS_CONFIG_PATH}</td><td>bundled tables</td></tr>
 * <tr><td>{@code TIMELINE_ZONE}</td><td>{@code UTC}</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class AnalysisConfig {

    // ---------------------------------------------------------------
    // Input / output
    // ---------------------------------------------------------------
    private final String inputDir;
    private final String outputDir;
    private final String analystName;

    // ---------------------------------------------------------------
    // Indicators and external threats
    // ---------------------------------------------------------------
    private final String iocText;
    private final String iocFile;
    private final String intelFile;
    private final String threatsFile;

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------
    private final String patternsConfigPath;
    private final ZoneId timelineZone;

    private AnalysisConfig(Builder b) {
        this.inputDir = b.inputDir;
        this.outputDir = b.outputDir;
        this.analystName = b.analystName;
        this.iocText = b.iocText;
        this.iocFile = b.iocFile;
        this.intelFile = b.intelFile;
        this.threatsFile = b.threatsFile;
        this.patternsConfigPath = b.patternsConfigPath;
        this.timelineZone = b.timelineZone;
    }

    // ---------------------------------------------------------------
    // Factory — resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build an {@link AnalysisConfig} from the process environment.
     *
     * @param args command-line arguments; the first one, if any, is the
     *             input directory
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is missing
     */
    public static AnalysisConfig fromEnvironment(String[] args) {
        return fromEnvironment(System.getenv(), args);
    }

    static AnalysisConfig fromEnvironment(Map<String, String> env, String[] args) {
        String inputDir = args != null && args.length > 0 ? args[0] : env(env, "INPUT_DIR", "");
        try {
            return new Builder()
                    .inputDir(inputDir)
                    .outputDir(env(env, "OUTPUT_DIR", "reports"))
                    .analystName(env(env, "ANALYST_NAME", "analyst"))
                    .iocText(env(env, "IOCS", ""))
                    .iocFile(env(env, "IOC_FILE", ""))
                    .intelFile(env(env, "INTEL_FILE", ""))
                    .threatsFile(env(env, "THREATS_FILE", ""))
                    .patternsConfigPath(env(env, "PATTERNS_CONFIG_PATH", ""))
                    .timelineZone(ZoneId.of(env(env, "TIMELINE_ZONE", "UTC")))
                    .build();
        } catch (DateTimeException e) {
            throw new IllegalStateException(
                    "Failed to parse TIMELINE_ZONE: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getInputDir() {
        return inputDir;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public String getAnalystName() {
        return analystName;
    }

    /**
     * @return pasted indicator text, empty when none
     */
    public String getIocText() {
        return iocText;
    }

    public String getIocFile() {
        return iocFile;
    }

    public String getIntelFile() {
        return intelFile;
    }

    public String getThreatsFile() {
        return threatsFile;
    }

    public String getPatternsConfigPath() {
        return patternsConfigPath;
    }

    public ZoneId getTimelineZone() {
        return timelineZone;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AnalysisConfig}.
     *
     * <p>
     * {@link #build()} requires a non-blank input directory, output
     * directory and analyst name. Optional paths default to empty strings.
     * </p>
     */
    public static class Builder {
        private String inputDir;
        private String outputDir = "reports";
        private String analystName = "analyst";
        private String iocText = "";
        private String iocFile = "";
        private String intelFile = "";
        private String threatsFile = "";
        private String patternsConfigPath = "";
        private ZoneId timelineZone = ZoneId.of("UTC");

        public Builder inputDir(String v) {
            this.inputDir = v;
            return this;
        }

        public Builder outputDir(String v) {
            this.outputDir = v;
            return this;
        }

        public Builder analystName(String v) {
            this.analystName = v;
            return this;
        }

        public Builder iocText(String v) {
            this.iocText = v;
            return this;
        }

        public Builder iocFile(String v) {
            this.iocFile = v;
            return this;
        }

        public Builder intelFile(String v) {
            this.intelFile = v;
            return this;
        }

        public Builder threatsFile(String v) {
            this.threatsFile = v;
            return this;
        }

        public Builder patternsConfigPath(String v) {
            this.patternsConfigPath = v;
            return this;
        }

        public Builder timelineZone(ZoneId v) {
            this.timelineZone = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link AnalysisConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public AnalysisConfig build() {
            requireNonBlank(inputDir, "inputDir (INPUT_DIR or first argument)");
            requireNonBlank(outputDir, "outputDir");
            requireNonBlank(analystName, "analystName");
            Objects.requireNonNull(timelineZone, "timelineZone required");

            iocText = orEmpty(iocText);
            iocFile = orEmpty(iocFile);
            intelFile = orEmpty(intelFile);
            threatsFile = orEmpty(threatsFile);
            patternsConfigPath = orEmpty(patternsConfigPath);

            return new AnalysisConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }

        private static String orEmpty(String value) {
            return value != null ? value.trim() : "";
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "AnalysisConfig{" +
                "inputDir='" + inputDir + '\'' +
                ", outputDir='" + outputDir + '\'' +
                ", analystName='" + analystName + '\'' +
                ", iocText=" + (iocText.isEmpty() ? "none" : "provided") +
                ", iocFile='" + iocFile + '\'' +
                ", intelFile='" + intelFile + '\'' +
                ", threatsFile='" + threatsFile + '\'' +
                ", patternsConfigPath='" + patternsConfigPath + '\'' +
                ", timelineZone=" + timelineZone +
                '}';
    }
}
