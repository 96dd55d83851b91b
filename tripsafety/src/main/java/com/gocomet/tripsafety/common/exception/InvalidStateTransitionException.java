package com.gocomet.tripsafety.common.exception;

/**
 * Thrown when a conditional state transition finds the record in a state
 * the transition does not start from.
 */
public class InvalidStateTransitionException extends RuntimeException {

    private final String currentState;

    public InvalidStateTransitionException(String entity, String currentState, String targetState) {
        super(String.format("Cannot transition %s from %s to %s", entity, currentState, targetState));
        this.currentState = currentState;
    }

    public String getCurrentState() {
        return currentState;
    }
}
