package com.cohortengine.exception;

/**
 * Malformed cohort JSON or a clause missing required fields.
 */
public class InvalidCohortDefinitionException extends CohortValidationException {

    public InvalidCohortDefinitionException(String message) {
        super(message);
    }

    public InvalidCohortDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
