package com.gocomet.tripsafety.admission.service;

import com.gocomet.tripsafety.admission.config.AdmissionProperties;
import com.gocomet.tripsafety.admission.model.EndpointClass;
import com.gocomet.tripsafety.admission.model.RateLimitDecision;
import com.gocomet.tripsafety.admission.store.CounterStore;
import com.gocomet.tripsafety.common.exception.RateLimitExceededException;
import com.gocomet.tripsafety.support.InMemoryCounterStore;
import com.gocomet.tripsafety.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RateLimiterServiceTest {

    private MutableClock clock;
    private InMemoryCounterStore counterStore;
    private RateLimiterService rateLimiter;

    @BeforeEach
    void setUp() {
        // start exactly on a window boundary
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        counterStore = new InMemoryCounterStore();

        rateLimiter = new RateLimiterService(counterStore, properties(), clock);
    }

    private static AdmissionProperties properties() {
        AdmissionProperties properties = new AdmissionProperties();
        properties.getRateLimit().setWindow(Duration.ofSeconds(60));
        properties.getRateLimit().setStandardLimit(3);
        properties.getRateLimit().setCriticalLimit(5);
        return properties;
    }

    @Test
    void tryAcquire_rejectsOnceLimitReached() {
        for (int i = 0; i < 3; i++) {
            assertTrue(rateLimiter.tryAcquire("rider-1", EndpointClass.STANDARD).allowed());
        }

        RateLimitDecision rejected = rateLimiter.tryAcquire("rider-1", EndpointClass.STANDARD);

        assertFalse(rejected.allowed());
        assertEquals(60, rejected.retryAfterSeconds());
    }

    @Test
    void tryAcquire_rejectedCallDoesNotConsumeQuota() {
        for (int i = 0; i < 5; i++) {
            rateLimiter.tryAcquire("rider-1", EndpointClass.STANDARD);
        }

        long windowIndex = clock.millis() / 60_000;
        assertEquals(3L, counterStore.get("rl:standard:rider-1:" + windowIndex));
    }

    @Test
    void tryAcquire_actorsAreIsolated() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.tryAcquire("rider-1", EndpointClass.STANDARD);
        }
        assertFalse(rateLimiter.tryAcquire("rider-1", EndpointClass.STANDARD).allowed());

        RateLimitDecision other = rateLimiter.tryAcquire("rider-2", EndpointClass.STANDARD);

        assertTrue(other.allowed(), "Exhausting one actor's quota must not affect another actor");
        assertEquals(2, other.remaining());
    }

    @Test
    void tryAcquire_criticalTierHasItsOwnHigherBudget() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.tryAcquire("rider-1", EndpointClass.STANDARD);
        }

        for (int i = 0; i < 5; i++) {
            assertTrue(rateLimiter.tryAcquire("rider-1", EndpointClass.CRITICAL).allowed());
        }
        assertFalse(rateLimiter.tryAcquire("rider-1", EndpointClass.CRITICAL).allowed());
    }

    @Test
    void tryAcquire_previousWindowWeighsLessAsTimePasses() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.tryAcquire("rider-1", EndpointClass.STANDARD);
        }

        // 30s into the next window half of the previous count still applies: floor(3 * 0.5) = 1
        clock.advance(Duration.ofSeconds(90));
        assertTrue(rateLimiter.tryAcquire("rider-1", EndpointClass.STANDARD).allowed());
        assertTrue(rateLimiter.tryAcquire("rider-1", EndpointClass.STANDARD).allowed());
        RateLimitDecision third = rateLimiter.tryAcquire("rider-1", EndpointClass.STANDARD);

        assertFalse(third.allowed());
        assertEquals(30, third.retryAfterSeconds());
    }

    @Test
    void tryAcquire_fullWindowLaterQuotaIsRestored() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.tryAcquire("rider-1", EndpointClass.STANDARD);
        }

        clock.advance(Duration.ofSeconds(120));

        for (int i = 0; i < 3; i++) {
            assertTrue(rateLimiter.tryAcquire("rider-1", EndpointClass.STANDARD).allowed());
        }
    }

    @Test
    void check_throwsWithRetryAfter() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.check("rider-1", EndpointClass.STANDARD);
        }
        clock.advance(Duration.ofSeconds(45));

        RateLimitExceededException ex = assertThrows(RateLimitExceededException.class,
                () -> rateLimiter.check("rider-1", EndpointClass.STANDARD));

        assertEquals(EndpointClass.STANDARD, ex.getEndpointClass());
        assertEquals(15, ex.getRetryAfterSeconds());
    }

    @Test
    void tryAcquire_storeUnreachable_criticalCallAdmitted() {
        RateLimiterService unreachable = new RateLimiterService(downStore(), properties(), clock);

        RateLimitDecision decision = unreachable.check("rider-1", EndpointClass.CRITICAL);

        assertTrue(decision.allowed());
        assertEquals(5, decision.limit());
    }

    @Test
    void tryAcquire_storeUnreachable_standardCallFails() {
        RateLimiterService unreachable = new RateLimiterService(downStore(), properties(), clock);

        assertThrows(RedisConnectionFailureException.class,
                () -> unreachable.tryAcquire("rider-1", EndpointClass.STANDARD));
    }

    private static CounterStore downStore() {
        CounterStore store = mock(CounterStore.class);
        when(store.increment(anyString(), any())).thenThrow(new RedisConnectionFailureException("Unable to connect to Redis"));
        return store;
    }
}
