package com.gocomet.tripsafety.tracking.store;

import com.gocomet.tripsafety.tracking.model.LocationSample;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Last-known-position store keyed by trip.
 */
public interface LocationStore {

    /**
     * Atomically store {@code sample} only if its capturedAt is strictly newer than
     * the stored one, refreshing the entry's TTL. Returns whether the write was accepted.
     */
    boolean putIfNewer(LocationSample sample, Duration ttl);

    Optional<LocationSample> find(UUID tripId);

    void evict(UUID tripId);
}
