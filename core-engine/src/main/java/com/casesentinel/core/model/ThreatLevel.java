package com.casesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Timeline classification of a finding.
 *
 * @since 1.0.0
 */
public enum ThreatLevel {
    SUSPICIOUS("Suspicious"),
    MALICIOUS("Malicious");

    private final String label;

    ThreatLevel(String label) {
        this.label = label;
    }

    /**
     * High and critical severities are malicious; everything else is
     * suspicious.
     *
     * @param severity the severity
     * @return the level
     */
    public static ThreatLevel fromSeverity(Severity severity) {
        return severity == Severity.HIGH || severity == Severity.CRITICAL ? MALICIOUS : SUSPICIOUS;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
