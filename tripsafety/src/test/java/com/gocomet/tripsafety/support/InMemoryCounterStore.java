package com.gocomet.tripsafety.support;

import com.gocomet.tripsafety.admission.store.CounterStore;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counters without expiry; tests move the clock across windows instead.
 */
public class InMemoryCounterStore implements CounterStore {

    private final Map<String, Long> counters = new ConcurrentHashMap<>();

    @Override
    public long increment(String key, Duration ttl) {
        return counters.merge(key, 1L, Long::sum);
    }

    @Override
    public long decrement(String key) {
        return counters.merge(key, -1L, Long::sum);
    }

    @Override
    public long get(String key) {
        return counters.getOrDefault(key, 0L);
    }

    public Map<String, Long> counters() {
        return counters;
    }
}
