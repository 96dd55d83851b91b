package com.gocomet.tripsafety.admission.store;

import java.time.Duration;

/**
 * Shared integer counters. Each method is a single atomic operation on the store.
 */
public interface CounterStore {

    /**
     * Increment and return the new value; a freshly created key gets {@code ttl}.
     */
    long increment(String key, Duration ttl);

    long decrement(String key);

    /**
     * Current value, 0 when the key is absent or expired.
     */
    long get(String key);
}
