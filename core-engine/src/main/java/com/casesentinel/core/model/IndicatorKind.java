package com.casesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Inferred type of an indicator of compromise.
 *
 * @since 1.0.0
 */
public enum IndicatorKind {
    IP_ADDRESS("ip_address"),
    HASH("hash"),
    DOMAIN("domain"),
    EMAIL("email"),
    EXECUTABLE("executable"),
    UNKNOWN("unknown");

    private final String wireName;

    IndicatorKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
