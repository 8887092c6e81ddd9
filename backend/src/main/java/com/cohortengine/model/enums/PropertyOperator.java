package com.cohortengine.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison operators for property filters.
 */
public enum PropertyOperator {
    EXACT("exact"),
    IS_NOT("is_not"),
    ICONTAINS("icontains"),
    NOT_ICONTAINS("not_icontains"),
    REGEX("regex"),
    NOT_REGEX("not_regex"),
    GT("gt"),
    LT("lt"),
    IS_SET("is_set"),
    IS_NOT_SET("is_not_set");

    private final String value;

    PropertyOperator(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * True for operators that match the complement of another operator.
     */
    public boolean isNegative() {
        return this == IS_NOT || this == NOT_ICONTAINS || this == NOT_REGEX || this == IS_NOT_SET;
    }

    public static PropertyOperator fromValue(String value) {
        if (value == null) {
            return EXACT;
        }
        for (PropertyOperator op : values()) {
            if (op.value.equalsIgnoreCase(value)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown PropertyOperator: " + value);
    }
}
