package com.gocomet.tripsafety.admission.model;

import java.time.Instant;

/**
 * Point-in-time view of a dependency's breaker as read from the shared store.
 * {@code version} is bumped on every state change and drives compare-and-set.
 */
public record BreakerSnapshot(
        String dependency,
        CircuitState state,
        long failures,
        long version,
        Instant changedAt) {

    public static BreakerSnapshot closed(String dependency) {
        return new BreakerSnapshot(dependency, CircuitState.CLOSED, 0, 0, Instant.EPOCH);
    }
}
