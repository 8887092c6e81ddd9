package com.cohortengine.exception;

public class InvalidCountOperatorException extends CohortValidationException {

    public InvalidCountOperatorException(String operator) {
        super("count_operator must be gte, lte, eq, or absent; got: " + operator);
    }
}
