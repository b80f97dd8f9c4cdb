package com.casesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A heuristic suspicion hit on one cell of a source dataset.
 *
 * <p>
 * One anomaly is emitted per (rule pattern, column, row). A cell matching
 * several patterns yields several anomalies.
 * </p>
 *
 * @since 1.0.0
 */
public final class Anomaly {

    private final String source;
    private final AnomalyRuleType ruleType;
    private final Severity severity;
    private final String column;
    private final String value;
    private final int rowIndex;
    private final String pattern;
    private final String description;

    private Anomaly(Builder builder) {
        this.source = Objects.requireNonNull(builder.source, "source must not be null");
        this.ruleType = Objects.requireNonNull(builder.ruleType, "ruleType must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.column = Objects.requireNonNull(builder.column, "column must not be null");
        this.value = builder.value != null ? builder.value : "";
        this.rowIndex = builder.rowIndex;
        this.pattern = builder.pattern;
        this.description = builder.description != null ? builder.description : "";
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Anomaly} instances.
     */
    public static class Builder {
        private String source;
        private AnomalyRuleType ruleType;
        private Severity severity;
        private String column;
        private String value;
        private int rowIndex;
        private String pattern;
        private String description;

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder ruleType(AnomalyRuleType ruleType) {
            this.ruleType = ruleType;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder column(String column) {
            this.column = column;
            return this;
        }

        public Builder value(String value) {
            this.value = value;
            return this;
        }

        public Builder rowIndex(int rowIndex) {
            this.rowIndex = rowIndex;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    @JsonProperty("source")
    public String getSource() {
        return source;
    }

    @JsonProperty("rule_type")
    public AnomalyRuleType getRuleType() {
        return ruleType;
    }

    @JsonProperty("severity")
    public Severity getSeverity() {
        return severity;
    }

    @JsonProperty("column")
    public String getColumn() {
        return column;
    }

    /** The case-folded cell value that was tested. */
    @JsonProperty("value")
    public String getValue() {
        return value;
    }

    @JsonProperty("row_index")
    public int getRowIndex() {
        return rowIndex;
    }

    @JsonProperty("pattern")
    public String getPattern() {
        return pattern;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return rowIndex == that.rowIndex
                && source.equals(that.source)
                && ruleType == that.ruleType
                && column.equals(that.column)
                && Objects.equals(pattern, that.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, ruleType, column, rowIndex, pattern);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "source='" + source + '\'' +
                ", ruleType=" + ruleType +
                ", severity=" + severity +
                ", column='" + column + '\'' +
                ", rowIndex=" + rowIndex +
                ", pattern='" + pattern + '\'' +
                '}';
    }
}
