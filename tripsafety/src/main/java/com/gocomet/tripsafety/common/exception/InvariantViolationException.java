package com.gocomet.tripsafety.common.exception;

/**
 * A programming invariant was about to be broken (for example notifying for an
 * alert that is not durably stored). The operation is aborted, never retried.
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
