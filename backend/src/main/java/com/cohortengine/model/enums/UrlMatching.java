package com.cohortengine.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How an action step compares the event's current URL.
 */
public enum UrlMatching {
    CONTAINS("contains"),
    EXACT("exact"),
    REGEX("regex");

    private final String value;

    UrlMatching(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static UrlMatching fromValue(String value) {
        if (value == null) {
            return CONTAINS;
        }
        for (UrlMatching matching : values()) {
            if (matching.value.equalsIgnoreCase(value)) {
                return matching;
            }
        }
        throw new IllegalArgumentException("Unknown UrlMatching: " + value);
    }
}
