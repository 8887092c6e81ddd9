package com.cohortengine.model.enums;

import com.cohortengine.exception.InvalidCountOperatorException;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operators for "performed event N times" clauses.
 */
public enum CountOperator {
    GTE("gte", ">="),
    LTE("lte", "<="),
    EQ("eq", "=");

    private final String value;
    private final String sql;

    CountOperator(String value, String sql) {
        this.value = value;
        this.sql = sql;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getSql() {
        return sql;
    }

    /**
     * Parses a count operator; an absent operator means exact match.
     *
     * @throws InvalidCountOperatorException for anything other than gte, lte, eq or null
     */
    public static CountOperator fromValue(String value) {
        if (value == null) {
            return EQ;
        }
        for (CountOperator op : values()) {
            if (op.value.equals(value)) {
                return op;
            }
        }
        throw new InvalidCountOperatorException(value);
    }
}
