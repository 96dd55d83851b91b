package com.gocomet.tripsafety.common.exception;

import lombok.Getter;

/**
 * The circuit for a dependency is open (or a half-open trial is already running),
 * so the call was short-circuited without touching the dependency.
 */
@Getter
public class CircuitOpenException extends RuntimeException {

    private final String dependency;
    private final long retryAfterSeconds;

    public CircuitOpenException(String dependency, long retryAfterSeconds) {
        super(String.format("Dependency '%s' unavailable (circuit open)", dependency));
        this.dependency = dependency;
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
