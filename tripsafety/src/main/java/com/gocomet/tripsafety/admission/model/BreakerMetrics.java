package com.gocomet.tripsafety.admission.model;

import java.time.Instant;

/**
 * Breaker state as shared by all instances, plus the call counters of this
 * instance since it started or the circuit was last reset.
 */
public record BreakerMetrics(
        String dependency,
        CircuitState state,
        long consecutiveFailures,
        Instant stateChangedAt,
        long totalCalls,
        long successfulCalls,
        long failedCalls,
        long rejectedCalls,
        Instant lastFailureAt,
        String lastError) {
}
