package com.acme.dcm.domain.model;

/**
 * Thrown when a state machine transition is attempted from a state that does not allow it.
 */
public class InvalidStateException extends RuntimeException {
    private final String currentState;
    private final String expectedState;
    private final String operation;

    public InvalidStateException(String currentState, String expectedState, String operation) {
        super(String.format("Cannot %s in state %s (requires %s)", operation, currentState, expectedState));
        this.currentState = currentState;
        this.expectedState = expectedState;
        this.operation = operation;
    }

    public String getCurrentState() {
        return currentState;
    }

    public String getExpectedState() {
        return expectedState;
    }

    public String getOperation() {
        return operation;
    }
}
