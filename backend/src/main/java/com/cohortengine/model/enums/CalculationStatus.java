package com.cohortengine.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a cohort materialization attempt.
 */
public enum CalculationStatus {
    RUNNING("running"),
    COMMITTED("committed"),
    FAILED("failed"),
    SUPERSEDED("superseded");

    private final String value;

    CalculationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
