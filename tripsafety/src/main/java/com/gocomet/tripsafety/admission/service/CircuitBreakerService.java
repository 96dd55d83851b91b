package com.gocomet.tripsafety.admission.service;

import com.gocomet.tripsafety.admission.config.AdmissionProperties;
import com.gocomet.tripsafety.admission.model.BreakerMetrics;
import com.gocomet.tripsafety.admission.model.BreakerSnapshot;
import com.gocomet.tripsafety.admission.model.CircuitState;
import com.gocomet.tripsafety.admission.store.BreakerStateStore;
import com.gocomet.tripsafety.common.exception.CircuitOpenException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Circuit breakers for external dependencies, with state kept in the shared
 * store so every instance sees the same circuit.
 *
 * CLOSED: calls pass, consecutive failures counted
 * OPEN: calls rejected without invoking the dependency until the cooldown elapses
 * HALF_OPEN: exactly one trial call; success closes, failure re-opens with a fresh cooldown
 *
 * The single trial is whoever wins the OPEN → HALF_OPEN compare-and-set.
 * Call counters are kept per instance; only the circuit itself is shared.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CircuitBreakerService {

    private static final int MAX_RESET_ATTEMPTS = 5;

    private final BreakerStateStore stateStore;
    private final AdmissionProperties properties;
    private final Clock clock;

    private final Map<String, CallStats> callStats = new ConcurrentHashMap<>();

    /**
     * Run {@code call} through the breaker for {@code dependency}. Any runtime
     * exception thrown by the call counts as a failure and is rethrown.
     *
     * @throws CircuitOpenException if the circuit rejects the call
     */
    public <T> T execute(String dependency, Supplier<T> call) {
        CallStats stats = statsOf(dependency);
        stats.total.incrementAndGet();
        Permit permit;
        try {
            permit = acquire(dependency);
        } catch (CircuitOpenException ex) {
            stats.rejected.incrementAndGet();
            throw ex;
        }

        T result;
        try {
            result = call.get();
        } catch (RuntimeException ex) {
            stats.failed.incrementAndGet();
            stats.lastFailureAt = clock.instant();
            stats.lastError = ex.getMessage();
            onFailure(permit);
            throw ex;
        }
        stats.successful.incrementAndGet();
        onSuccess(permit);
        return result;
    }

    public void run(String dependency, Runnable call) {
        execute(dependency, () -> {
            call.run();
            return null;
        });
    }

    public CircuitState currentState(String dependency) {
        return stateStore.load(dependency).state();
    }

    public Map<String, CircuitState> snapshot(Collection<String> dependencies) {
        Map<String, CircuitState> states = new LinkedHashMap<>();
        for (String dependency : dependencies) {
            states.put(dependency, currentState(dependency));
        }
        return states;
    }

    public BreakerMetrics metrics(String dependency) {
        BreakerSnapshot snapshot = stateStore.load(dependency);
        CallStats stats = statsOf(dependency);
        return new BreakerMetrics(
                dependency,
                snapshot.state(),
                snapshot.failures(),
                Instant.EPOCH.equals(snapshot.changedAt()) ? null : snapshot.changedAt(),
                stats.total.get(),
                stats.successful.get(),
                stats.failed.get(),
                stats.rejected.get(),
                stats.lastFailureAt,
                stats.lastError);
    }

    public List<BreakerMetrics> metrics(Collection<String> dependencies) {
        return dependencies.stream().map(this::metrics).toList();
    }

    /**
     * Operator override: forces the circuit CLOSED with no failures counted, on
     * every instance, and clears this instance's call counters.
     */
    public BreakerMetrics reset(String dependency) {
        for (int attempt = 0; attempt < MAX_RESET_ATTEMPTS; attempt++) {
            BreakerSnapshot current = stateStore.load(dependency);
            if (stateStore.compareAndSet(current, CircuitState.CLOSED, 0, clock.instant())) {
                callStats.remove(dependency);
                log.warn("Circuit '{}' reset by operator, {} → CLOSED", dependency, current.state());
                return metrics(dependency);
            }
        }
        throw new IllegalStateException("Circuit '" + dependency + "' kept changing, reset not applied");
    }

    private CallStats statsOf(String dependency) {
        return callStats.computeIfAbsent(dependency, d -> new CallStats());
    }

    private Permit acquire(String dependency) {
        BreakerSnapshot snapshot = stateStore.load(dependency);
        Instant now = clock.instant();
        Duration cooldown = properties.getCircuitBreaker().getCooldown();

        switch (snapshot.state()) {
            case CLOSED:
                return new Permit(snapshot, false);
            case OPEN: {
                Instant retryAt = snapshot.changedAt().plus(cooldown);
                if (now.isBefore(retryAt)) {
                    throw new CircuitOpenException(dependency, secondsUntil(now, retryAt));
                }
                if (stateStore.compareAndSet(snapshot, CircuitState.HALF_OPEN, snapshot.failures(), now)) {
                    log.info("Circuit '{}' OPEN → HALF_OPEN, running trial call", dependency);
                    return new Permit(snapshot, true);
                }
                throw new CircuitOpenException(dependency, cooldown.toSeconds());
            }
            case HALF_OPEN: {
                // a trial that never reported back is taken over after another cooldown
                Instant staleAt = snapshot.changedAt().plus(cooldown);
                if (!now.isBefore(staleAt)
                        && stateStore.compareAndSet(snapshot, CircuitState.HALF_OPEN, snapshot.failures(), now)) {
                    log.warn("Circuit '{}' trial call went silent, starting a new trial", dependency);
                    return new Permit(snapshot, true);
                }
                throw new CircuitOpenException(dependency, secondsUntil(now, staleAt));
            }
            default:
                throw new IllegalStateException("Unknown circuit state " + snapshot.state());
        }
    }

    private void onSuccess(Permit permit) {
        String dependency = permit.snapshot().dependency();
        if (permit.trial()) {
            BreakerSnapshot current = stateStore.load(dependency);
            if (current.state() == CircuitState.HALF_OPEN
                    && stateStore.compareAndSet(current, CircuitState.CLOSED, 0, clock.instant())) {
                log.info("Circuit '{}' HALF_OPEN → CLOSED", dependency);
            }
        } else if (permit.snapshot().failures() > 0) {
            stateStore.resetFailures(dependency);
        }
    }

    private void onFailure(Permit permit) {
        String dependency = permit.snapshot().dependency();
        Instant now = clock.instant();
        if (permit.trial()) {
            BreakerSnapshot current = stateStore.load(dependency);
            if (current.state() == CircuitState.HALF_OPEN
                    && stateStore.compareAndSet(current, CircuitState.OPEN, current.failures(), now)) {
                log.warn("Circuit '{}' trial failed, HALF_OPEN → OPEN", dependency);
            }
            return;
        }

        long failures = stateStore.incrementFailures(dependency);
        if (failures >= properties.getCircuitBreaker().getFailureThreshold()) {
            BreakerSnapshot current = stateStore.load(dependency);
            if (current.state() == CircuitState.CLOSED
                    && stateStore.compareAndSet(current, CircuitState.OPEN, failures, now)) {
                log.warn("Circuit '{}' CLOSED → OPEN after {} consecutive failures", dependency, failures);
            }
        }
    }

    private static long secondsUntil(Instant now, Instant until) {
        return Math.max(1, (long) Math.ceil(Duration.between(now, until).toMillis() / 1000.0));
    }

    private record Permit(BreakerSnapshot snapshot, boolean trial) {
    }

    private static final class CallStats {
        private final AtomicLong total = new AtomicLong();
        private final AtomicLong successful = new AtomicLong();
        private final AtomicLong failed = new AtomicLong();
        private final AtomicLong rejected = new AtomicLong();
        private volatile Instant lastFailureAt;
        private volatile String lastError;
    }
}
