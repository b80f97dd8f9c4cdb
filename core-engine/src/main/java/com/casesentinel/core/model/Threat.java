package com.casesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Structured threat record produced outside the engine (for example by an
 * analyst-facing assessment service) and merged into the timeline.
 *
 * <p>
 * Unknown JSON properties are ignored. A missing severity is treated as
 * {@link Severity#MEDIUM}. A severity text outside {@link Severity} is also
 * read as medium, and the text itself is kept as
 * {@link #getReportedSeverity()} so that reports still show what the
 * producer sent.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Threat {

    private String type;
    private Severity severity = Severity.MEDIUM;
    private String reportedSeverity;
    private String description;
    private List<String> indicators = new ArrayList<>();
    private String recommendation;

    /** Source dataset the threat was raised against. */
    private String source;

    /** Optional row of {@link #source} used to enrich the finding. */
    private Integer rowIndex;

    /** No-arg constructor required by Jackson. */
    public Threat() {
    }

    private Threat(Builder builder) {
        this.type = builder.type;
        this.severity = builder.severity != null ? builder.severity : Severity.MEDIUM;
        this.description = builder.description;
        setIndicators(builder.indicators);
        this.recommendation = builder.recommendation;
        this.source = builder.source;
        this.rowIndex = builder.rowIndex;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Threat} instances.
     */
    public static class Builder {
        private String type;
        private Severity severity;
        private String description;
        private List<String> indicators;
        private String recommendation;
        private String source;
        private Integer rowIndex;

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder indicators(List<String> indicators) {
            this.indicators = indicators;
            return this;
        }

        public Builder recommendation(String recommendation) {
            this.recommendation = recommendation;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder rowIndex(Integer rowIndex) {
            this.rowIndex = rowIndex;
            return this;
        }

        public Threat build() {
            return new Threat(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    @JsonProperty("type")
    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    @JsonProperty("severity")
    public Severity getSeverity() {
        return severity;
    }

    @JsonIgnore
    public void setSeverity(Severity severity) {
        this.severity = severity != null ? severity : Severity.MEDIUM;
        this.reportedSeverity = null;
    }

    /**
     * Set the severity from producer text, parsed leniently.
     *
     * @param value severity text in any case; may be {@code null}
     */
    @JsonSetter("severity")
    public void setSeverityText(String value) {
        this.severity = Severity.parse(value);
        boolean recognised = value == null || value.isBlank()
                || severity.wireName().equalsIgnoreCase(value.trim());
        this.reportedSeverity = recognised ? null : value;
    }

    /**
     * @return the producer's severity text when it was not a known
     *         severity, otherwise {@code null}
     */
    @JsonProperty("reported_severity")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getReportedSeverity() {
        return reportedSeverity;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    /**
     * @return unmodifiable list of indicator strings, never {@code null}
     */
    @JsonProperty("indicators")
    public List<String> getIndicators() {
        return Collections.unmodifiableList(indicators);
    }

    public void setIndicators(List<String> indicators) {
        this.indicators = indicators != null ? new ArrayList<>(indicators) : new ArrayList<>();
    }

    @JsonProperty("recommendation")
    public String getRecommendation() {
        return recommendation;
    }

    public void setRecommendation(String recommendation) {
        this.recommendation = recommendation;
    }

    @JsonProperty("source")
    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    @JsonProperty("row_index")
    public Integer getRowIndex() {
        return rowIndex;
    }

    public void setRowIndex(Integer rowIndex) {
        this.rowIndex = rowIndex;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Threat that))
            return false;
        return Objects.equals(type, that.type)
                && severity == that.severity
                && Objects.equals(description, that.description)
                && Objects.equals(source, that.source)
                && Objects.equals(rowIndex, that.rowIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, severity, description, source, rowIndex);
    }

    @Override
    public String toString() {
        return "Threat{" +
                "type='" + type + '\'' +
                ", severity=" + severity +
                ", source='" + source + '\'' +
                ", rowIndex=" + rowIndex +
                ", description='" + description + '\'' +
                '}';
    }
}
