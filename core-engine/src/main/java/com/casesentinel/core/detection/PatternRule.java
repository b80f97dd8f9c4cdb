package com.casesentinel.core.detection;

import com.casesentinel.core.model.Anomaly;
import com.casesentinel.core.model.AnomalyRuleType;
import com.casesentinel.core.model.FoldedDataset;
import com.casesentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base class for rules that test a fixed list of patterns against cell text.
 *
 * <p>
 * Iteration order is column, then pattern, then row. Only text cells are
 * tested; numeric and null cells of a textual column are non-matches.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class PatternRule implements AnomalyRule {

    private static final Logger LOG = LoggerFactory.getLogger(PatternRule.class);

    private final AnomalyRuleType type;
    private final Severity severity;
    private final List<String> patterns;
    private final String descriptionFormat;

    /**
     * @param type              rule family
     * @param severity          severity of every emitted anomaly
     * @param patterns          the patterns, in evaluation order
     * @param descriptionFormat {@link String#format} template receiving the
     *                          pattern and the column name
     */
    protected PatternRule(AnomalyRuleType type, Severity severity, List<String> patterns,
            String descriptionFormat) {
        this.type = Objects.requireNonNull(type, "Rule type must not be null");
        this.severity = Objects.requireNonNull(severity, "Severity must not be null");
        this.patterns = List.copyOf(Objects.requireNonNull(patterns, "Patterns must not be null"));
        this.descriptionFormat = Objects.requireNonNull(descriptionFormat, "Description format must not be null");
    }

    /**
     * @param foldedText   lowercased cell text
     * @param patternIndex index into {@link #getPatterns()}
     * @return {@code true} if the pattern hits the text
     */
    protected abstract boolean matches(String foldedText, int patternIndex);

    @Override
    public List<Anomaly> scan(FoldedDataset data, String source) {
        Objects.requireNonNull(data, "Dataset must not be null");
        Objects.requireNonNull(source, "Source name must not be null");

        List<Anomaly> anomalies = new ArrayList<>();
        for (String column : data.getTextualColumns()) {
            for (int p = 0; p < patterns.size(); p++) {
                String pattern = patterns.get(p);
                for (int row = 0; row < data.size(); row++) {
                    if (!data.isText(column, row)) {
                        LOG.trace("Rule [{}]: {}[{}] is not text – skipping", type, column, row);
                        continue;
                    }
                    String value = data.folded(column, row);
                    if (matches(value, p)) {
                        anomalies.add(Anomaly.builder()
                                .source(source)
                                .ruleType(type)
                                .severity(severity)
                                .column(column)
                                .value(value)
                                .rowIndex(row)
                                .pattern(pattern)
                                .description(String.format(descriptionFormat, pattern, column))
                                .build());
                    }
                }
            }
        }
        if (!anomalies.isEmpty()) {
            LOG.debug("Rule [{}] fired {} time(s) on {}", type, anomalies.size(), source);
        }
        return anomalies;
    }

    @Override
    public AnomalyRuleType getType() {
        return type;
    }

    @Override
    public Severity getSeverity() {
        return severity;
    }

    public List<String> getPatterns() {
        return patterns;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{type=" + type + ", severity=" + severity
                + ", patterns=" + patterns + '}';
    }
}
