package com.gocomet.tripsafety.sos.service;

import com.gocomet.tripsafety.admission.config.AdmissionProperties;
import com.gocomet.tripsafety.admission.model.CircuitState;
import com.gocomet.tripsafety.admission.service.CircuitBreakerService;
import com.gocomet.tripsafety.common.exception.InvariantViolationException;
import com.gocomet.tripsafety.common.exception.SosPersistenceException;
import com.gocomet.tripsafety.sos.config.SosProperties;
import com.gocomet.tripsafety.sos.model.SosAlert;
import com.gocomet.tripsafety.sos.model.SosState;
import com.gocomet.tripsafety.sos.model.TriggeredByRole;
import com.gocomet.tripsafety.sos.repository.SosAlertRepository;
import com.gocomet.tripsafety.support.InMemoryBreakerStateStore;
import com.gocomet.tripsafety.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SosAlertPersisterTest {

    private static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");

    private SosAlertRepository repository;
    private CircuitBreakerService breaker;
    private SosAlertPersister persister;
    private SosAlert alert;

    @BeforeEach
    void setUp() {
        repository = mock(SosAlertRepository.class);
        MutableClock clock = new MutableClock(T0);
        breaker = new CircuitBreakerService(new InMemoryBreakerStateStore(), new AdmissionProperties(), clock);

        SosProperties properties = new SosProperties();
        properties.setPersistMaxAttempts(4);
        properties.setPersistInitialBackoff(Duration.ofMillis(1));
        properties.setPersistMaxBackoff(Duration.ofMillis(4));
        persister = new SosAlertPersister(repository, breaker, properties);

        alert = SosAlert.builder()
                .id(UUID.randomUUID())
                .tripId(UUID.randomUUID())
                .triggeredBy("rider-1")
                .triggeredByRole(TriggeredByRole.PASSENGER)
                .lat(12.97)
                .lng(77.59)
                .state(SosState.PERSISTED)
                .triggeredAt(T0)
                .persistedAt(T0)
                .build();
    }

    @Test
    void persist_transientFailures_retriedUntilStored() {
        when(repository.saveAndFlush(any()))
                .thenThrow(new DataAccessResourceFailureException("connection reset"))
                .thenThrow(new DataAccessResourceFailureException("connection reset"))
                .thenAnswer(invocation -> invocation.getArgument(0));
        when(repository.findById(alert.getId())).thenReturn(Optional.of(alert));

        SosAlert stored = persister.persist(alert);

        assertEquals(alert.getId(), stored.getId());
        verify(repository, times(3)).saveAndFlush(alert);
        assertEquals(CircuitState.CLOSED, breaker.currentState(SosAlertPersister.DEPENDENCY));
    }

    @Test
    void persist_storeDown_throwsAfterMaxAttempts() {
        when(repository.saveAndFlush(any())).thenThrow(new DataAccessResourceFailureException("database down"));

        SosPersistenceException error = assertThrows(SosPersistenceException.class, () -> persister.persist(alert));

        assertInstanceOf(DataAccessResourceFailureException.class, error.getCause());
        verify(repository, times(4)).saveAndFlush(alert);
    }

    @Test
    void persist_writeNotVisible_countsAsFailure() {
        when(repository.saveAndFlush(any())).thenAnswer(invocation -> invocation.getArgument(0));
        when(repository.findById(alert.getId())).thenReturn(Optional.empty());

        assertThrows(SosPersistenceException.class, () -> persister.persist(alert));
        verify(repository, times(4)).findById(alert.getId());
    }

    @Test
    void persist_readBackInOtherState_failsWithoutRetry() {
        SosAlert resolved = SosAlert.builder()
                .id(alert.getId())
                .tripId(alert.getTripId())
                .state(SosState.RESOLVED)
                .build();
        when(repository.saveAndFlush(any())).thenAnswer(invocation -> invocation.getArgument(0));
        when(repository.findById(alert.getId())).thenReturn(Optional.of(resolved));

        assertThrows(InvariantViolationException.class, () -> persister.persist(alert));
        verify(repository, times(1)).saveAndFlush(alert);
    }

    @Test
    void persist_tripAlreadyHasOpenAlert_returnsThatAlert() {
        SosAlert open = SosAlert.builder()
                .id(UUID.randomUUID())
                .tripId(alert.getTripId())
                .state(SosState.NOTIFYING)
                .triggeredAt(T0.minusSeconds(1))
                .build();
        when(repository.saveAndFlush(any()))
                .thenThrow(new DataIntegrityViolationException("unique constraint on active_trip_id"));
        when(repository.findFirstByTripIdAndStateInOrderByTriggeredAtDesc(alert.getTripId(), SosState.OPEN))
                .thenReturn(Optional.of(open));

        SosAlert stored = persister.persist(alert);

        assertSame(open, stored);
        verify(repository, times(1)).saveAndFlush(alert);
        verify(repository, never()).findById(any());
    }

    @Test
    void persist_constraintViolationWithoutOpenAlert_isRetriedThenFails() {
        when(repository.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("duplicate key"));
        when(repository.findFirstByTripIdAndStateInOrderByTriggeredAtDesc(alert.getTripId(), SosState.OPEN))
                .thenReturn(Optional.empty());

        SosPersistenceException error = assertThrows(SosPersistenceException.class, () -> persister.persist(alert));

        assertInstanceOf(DataIntegrityViolationException.class, error.getCause());
    }
}
