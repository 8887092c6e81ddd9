package com.cohortengine.exception;

public class MissingActionException extends CohortValidationException {

    private final long actionId;

    public MissingActionException(long actionId) {
        super("Action not found: " + actionId);
        this.actionId = actionId;
    }

    public long getActionId() {
        return actionId;
    }
}
