package com.gocomet.tripsafety.admission.service;

import com.gocomet.tripsafety.admission.config.AdmissionProperties;
import com.gocomet.tripsafety.admission.model.EndpointClass;
import com.gocomet.tripsafety.admission.model.RateLimitDecision;
import com.gocomet.tripsafety.admission.store.CounterStore;
import com.gocomet.tripsafety.common.exception.RateLimitExceededException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Sliding-window counter per (actor, endpoint class).
 *
 * Each window is a fixed bucket in the shared counter store; the estimate for
 * "the last window length" is the current bucket plus the previous bucket
 * weighted by how much of it still overlaps the sliding window.
 * Keys embed the actor, so one actor's traffic never touches another's counters.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RateLimiterService {

    private static final String KEY_PREFIX = "rl:";

    private final CounterStore counterStore;
    private final AdmissionProperties properties;
    private final Clock clock;

    /**
     * When the counter store is unreachable CRITICAL calls are admitted without
     * counting; STANDARD calls get the store's exception.
     */
    public RateLimitDecision tryAcquire(String actor, EndpointClass endpointClass) {
        long limit = limitFor(endpointClass);
        try {
            return countAndJudge(actor, endpointClass, limit);
        } catch (RuntimeException e) {
            if (endpointClass != EndpointClass.CRITICAL) {
                throw e;
            }
            log.warn("Rate limit store unavailable, admitting CRITICAL call from {}: {}", actor, e.getMessage());
            return RateLimitDecision.allow(limit, limit);
        }
    }

    private RateLimitDecision countAndJudge(String actor, EndpointClass endpointClass, long limit) {
        Duration window = properties.getRateLimit().getWindow();
        long windowMs = window.toMillis();
        long nowMs = clock.millis();
        long windowIndex = nowMs / windowMs;
        long elapsedMs = nowMs % windowMs;

        String currentKey = key(endpointClass, actor, windowIndex);
        String previousKey = key(endpointClass, actor, windowIndex - 1);

        // count first, then judge; a rejected call gives its slot back
        long current = counterStore.increment(currentKey, window.multipliedBy(2));
        long previous = counterStore.get(previousKey);
        double overlap = (double) (windowMs - elapsedMs) / windowMs;
        long estimated = (long) Math.floor(previous * overlap) + current;

        if (estimated > limit) {
            counterStore.decrement(currentKey);
            long retryAfter = Math.max(1, (long) Math.ceil((windowMs - elapsedMs) / 1000.0));
            log.warn("Rate limit hit: actor={}, class={}, estimated={}, limit={}, retryAfter={}s",
                    actor, endpointClass, estimated, limit, retryAfter);
            return RateLimitDecision.reject(limit, retryAfter);
        }
        return RateLimitDecision.allow(limit, limit - estimated);
    }

    /**
     * Same as {@link #tryAcquire} but throws on rejection.
     */
    public RateLimitDecision check(String actor, EndpointClass endpointClass) {
        RateLimitDecision decision = tryAcquire(actor, endpointClass);
        if (!decision.allowed()) {
            throw new RateLimitExceededException(endpointClass, decision.retryAfterSeconds());
        }
        return decision;
    }

    public long limitFor(EndpointClass endpointClass) {
        return switch (endpointClass) {
            case CRITICAL -> properties.getRateLimit().getCriticalLimit();
            case STANDARD -> properties.getRateLimit().getStandardLimit();
        };
    }

    private static String key(EndpointClass endpointClass, String actor, long windowIndex) {
        return KEY_PREFIX + endpointClass.name().toLowerCase() + ":" + actor + ":" + windowIndex;
    }
}
