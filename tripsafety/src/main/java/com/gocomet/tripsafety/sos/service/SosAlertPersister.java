package com.gocomet.tripsafety.sos.service;

import com.gocomet.tripsafety.admission.service.CircuitBreakerService;
import com.gocomet.tripsafety.common.exception.InvariantViolationException;
import com.gocomet.tripsafety.common.exception.SosPersistenceException;
import com.gocomet.tripsafety.sos.config.SosProperties;
import com.gocomet.tripsafety.sos.model.SosAlert;
import com.gocomet.tripsafety.sos.model.SosState;
import com.gocomet.tripsafety.sos.repository.SosAlertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

/**
 * Durable write of a new alert, retried with exponential backoff behind the
 * "sos-store" circuit breaker. A write only counts once a fresh read returns it.
 *
 * If another trigger for the same trip got its alert in first, the unique
 * active_trip_id column rejects this one and the open alert is returned instead;
 * callers tell the two apart by id.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SosAlertPersister {

    public static final String DEPENDENCY = "sos-store";

    private final SosAlertRepository alertRepository;
    private final CircuitBreakerService circuitBreakerService;
    private final SosProperties properties;

    /**
     * @return the alert as read back from the store, or the trip's already open alert
     * @throws SosPersistenceException when every attempt failed
     */
    public SosAlert persist(SosAlert alert) {
        ExponentialBackOff backOff = new ExponentialBackOff(
                properties.getPersistInitialBackoff().toMillis(), 2.0);
        backOff.setMaxInterval(properties.getPersistMaxBackoff().toMillis());
        BackOffExecution execution = backOff.start();

        int maxAttempts = Math.max(1, properties.getPersistMaxAttempts());
        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return circuitBreakerService.execute(DEPENDENCY, () -> writeAndReadBack(alert));
            } catch (InvariantViolationException e) {
                throw e;
            } catch (RuntimeException e) {
                lastError = e;
                log.warn("SOS persist attempt {}/{} for trip {} failed: {}",
                        attempt, maxAttempts, alert.getTripId(), e.getMessage());
            }
            if (attempt < maxAttempts && !sleep(execution.nextBackOff())) {
                break;
            }
        }
        log.error("SOS alert {} for trip {} could not be persisted", alert.getId(), alert.getTripId(), lastError);
        throw new SosPersistenceException(alert.getTripId(), maxAttempts, lastError);
    }

    private SosAlert writeAndReadBack(SosAlert alert) {
        // id is assigned up front, so a retry after an ambiguous failure rewrites the same row
        try {
            alertRepository.saveAndFlush(alert);
        } catch (DataIntegrityViolationException e) {
            SosAlert open = alertRepository.findFirstByTripIdAndStateInOrderByTriggeredAtDesc(
                    alert.getTripId(), SosState.OPEN).orElseThrow(() -> e);
            log.info("Trip {} already has open alert {}, dropping alert {}", alert.getTripId(), open.getId(), alert.getId());
            return open;
        }
        SosAlert stored = alertRepository.findById(alert.getId())
                .orElseThrow(() -> new IllegalStateException("Alert " + alert.getId() + " not visible after write"));
        if (stored.getState() != alert.getState()) {
            throw new InvariantViolationException(String.format(
                    "Alert %s read back in state %s, expected %s", alert.getId(), stored.getState(), alert.getState()));
        }
        return stored;
    }

    private static boolean sleep(long millis) {
        if (millis == BackOffExecution.STOP) {
            return false;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
