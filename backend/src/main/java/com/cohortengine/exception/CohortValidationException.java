package com.cohortengine.exception;

/**
 * A cohort definition that cannot be compiled. Raised before any membership write.
 */
public class CohortValidationException extends RuntimeException {

    public CohortValidationException(String message) {
        super(message);
    }

    public CohortValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
