package com.casesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether an indicator equals a cell or is contained in it.
 *
 * @since 1.0.0
 */
public enum MatchKind {
    EXACT("exact"),
    PARTIAL("partial");

    private final String wireName;

    MatchKind(String wireName) {
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
