package com.casesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * An indicator found in one cell of a source dataset.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code source}, {@code indicator}, {@code column}
 * and {@code matchKind} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class Match {

    private final String source;
    private final String indicator;
    private final IndicatorKind indicatorKind;
    private final MatchKind matchKind;
    private final String column;
    private final int rowIndex;
    private final String matchedValue;
    private final Row fullRow;

    private Match(Builder builder) {
        this.source = Objects.requireNonNull(builder.source, "source must not be null");
        this.indicator = Objects.requireNonNull(builder.indicator, "indicator must not be null");
        this.indicatorKind = builder.indicatorKind != null ? builder.indicatorKind : IndicatorKind.UNKNOWN;
        this.matchKind = Objects.requireNonNull(builder.matchKind, "matchKind must not be null");
        this.column = Objects.requireNonNull(builder.column, "column must not be null");
        this.rowIndex = builder.rowIndex;
        this.matchedValue = builder.matchedValue != null ? builder.matchedValue : "";
        this.fullRow = builder.fullRow;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Match} instances.
     */
    public static class Builder {
        private String source;
        private String indicator;
        private IndicatorKind indicatorKind;
        private MatchKind matchKind;
        private String column;
        private int rowIndex;
        private String matchedValue;
        private Row fullRow;

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder indicator(String indicator) {
            this.indicator = indicator;
            return this;
        }

        public Builder indicatorKind(IndicatorKind indicatorKind) {
            this.indicatorKind = indicatorKind;
            return this;
        }

        public Builder matchKind(MatchKind matchKind) {
            this.matchKind = matchKind;
            return this;
        }

        public Builder column(String column) {
            this.column = column;
            return this;
        }

        public Builder rowIndex(int rowIndex) {
            this.rowIndex = rowIndex;
            return this;
        }

        public Builder matchedValue(String matchedValue) {
            this.matchedValue = matchedValue;
            return this;
        }

        public Builder fullRow(Row fullRow) {
            this.fullRow = fullRow;
            return this;
        }

        public Match build() {
            return new Match(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("source")
    public String getSource() {
        return source;
    }

    /** The indicator as supplied by the caller (not case-folded). */
    @JsonProperty("indicator")
    public String getIndicator() {
        return indicator;
    }

    @JsonProperty("indicator_kind")
    public IndicatorKind getIndicatorKind() {
        return indicatorKind;
    }

    @JsonProperty("match_kind")
    public MatchKind getMatchKind() {
        return matchKind;
    }

    @JsonProperty("column")
    public String getColumn() {
        return column;
    }

    @JsonProperty("row_index")
    public int getRowIndex() {
        return rowIndex;
    }

    @JsonProperty("matched_value")
    public String getMatchedValue() {
        return matchedValue;
    }

    /** Snapshot of the row the indicator was found in; may be {@code null}. */
    @JsonProperty("full_row")
    public Row getFullRow() {
        return fullRow;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Match that))
            return false;
        return rowIndex == that.rowIndex
                && source.equals(that.source)
                && indicator.equals(that.indicator)
                && matchKind == that.matchKind
                && column.equals(that.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, indicator, matchKind, column, rowIndex);
    }

    @Override
    public String toString() {
        return "Match{" +
                "source='" + source + '\'' +
                ", indicator='" + indicator + '\'' +
                ", indicatorKind=" + indicatorKind +
                ", matchKind=" + matchKind +
                ", column='" + column + '\'' +
                ", rowIndex=" + rowIndex +
                '}';
    }
}
