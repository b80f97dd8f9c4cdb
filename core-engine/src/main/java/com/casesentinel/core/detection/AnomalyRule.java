package com.casesentinel.core.detection;

import com.casesentinel.core.model.Anomaly;
import com.casesentinel.core.model.AnomalyRuleType;
import com.casesentinel.core.model.FoldedDataset;
import com.casesentinel.core.model.Severity;

import java.util.List;

/**
 * Contract for one family of heuristic suspicion patterns.
 *
 * <p>
 * Implementations are stateless: scanning the same dataset twice yields the
 * same anomalies in the same order.
 * </p>
 */
public interface AnomalyRule {

    /**
     * Scan every text cell of every textual column.
     *
     * @param data   case-folded view of the dataset
     * @param source source name recorded on each anomaly
     * @return one anomaly per (pattern, column, row) hit; empty if nothing
     *         matched
     */
    List<Anomaly> scan(FoldedDataset data, String source);

    /**
     * @return the rule family
     */
    AnomalyRuleType getType();

    /**
     * @return the fixed severity of every anomaly this rule emits
     */
    Severity getSeverity();
}
