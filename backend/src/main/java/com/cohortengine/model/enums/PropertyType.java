package com.cohortengine.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of property filters inside a cohort group.
 */
public enum PropertyType {
    EVENT("event"),
    PERSON("person"),
    COHORT("cohort"),
    ELEMENT("element"),
    STATIC_COHORT("static-cohort"),
    PRECALCULATED_COHORT("precalculated-cohort");

    private final String value;

    PropertyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static PropertyType fromValue(String value) {
        for (PropertyType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown PropertyType: " + value);
    }
}
