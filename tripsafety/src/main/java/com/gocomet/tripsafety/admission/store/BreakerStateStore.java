package com.gocomet.tripsafety.admission.store;

import com.gocomet.tripsafety.admission.model.BreakerSnapshot;
import com.gocomet.tripsafety.admission.model.CircuitState;

import java.time.Instant;

/**
 * Shared circuit-breaker state, one record per dependency.
 */
public interface BreakerStateStore {

    /**
     * Returns the stored snapshot, or a CLOSED snapshot at version 0 if none exists.
     */
    BreakerSnapshot load(String dependency);

    /**
     * Writes the new state only if the stored version still equals {@code expected.version()}.
     */
    boolean compareAndSet(BreakerSnapshot expected, CircuitState next, long failures, Instant changedAt);

    long incrementFailures(String dependency);

    void resetFailures(String dependency);
}
