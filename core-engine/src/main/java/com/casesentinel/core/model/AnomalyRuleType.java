package com.casesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Heuristic rule families of the anomaly detector.
 *
 * @since 1.0.0
 */
public enum AnomalyRuleType {
    SUSPICIOUS_EXTENSION("suspicious_extension"),
    SUSPICIOUS_KEYWORD("suspicious_keyword"),
    SUSPICIOUS_PATH("suspicious_path");

    private final String wireName;

    AnomalyRuleType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * @param name wire name such as {@code suspicious_path} (case-insensitive)
     * @return the rule type
     * @throws IllegalArgumentException if the name is unknown
     */
    public static AnomalyRuleType fromWireName(String name) {
        if (name != null) {
            String lower = name.trim().toLowerCase(Locale.ROOT);
            for (AnomalyRuleType type : values()) {
                if (type.wireName.equals(lower)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown anomaly rule type: '" + name
                + "'. Supported: suspicious_extension, suspicious_keyword, suspicious_path");
    }

    @Override
    public String toString() {
        return wireName;
    }
}
