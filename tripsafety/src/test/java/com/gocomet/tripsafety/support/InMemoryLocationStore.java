package com.gocomet.tripsafety.support;

import com.gocomet.tripsafety.tracking.model.LocationSample;
import com.gocomet.tripsafety.tracking.store.LocationStore;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryLocationStore implements LocationStore {

    private final Map<UUID, LocationSample> samples = new ConcurrentHashMap<>();
    private volatile boolean down;

    @Override
    public boolean putIfNewer(LocationSample sample, Duration ttl) {
        if (down) {
            throw new IllegalStateException("store down");
        }
        boolean[] written = new boolean[1];
        samples.compute(sample.tripId(), (id, current) -> {
            written[0] = sample.isNewerThan(current);
            return written[0] ? sample : current;
        });
        return written[0];
    }

    @Override
    public Optional<LocationSample> find(UUID tripId) {
        return Optional.ofNullable(samples.get(tripId));
    }

    @Override
    public void evict(UUID tripId) {
        samples.remove(tripId);
    }

    public void setDown(boolean down) {
        this.down = down;
    }
}
