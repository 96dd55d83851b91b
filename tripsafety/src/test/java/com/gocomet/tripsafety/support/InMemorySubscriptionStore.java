package com.gocomet.tripsafety.support;

import com.gocomet.tripsafety.tracking.model.Subscription;
import com.gocomet.tripsafety.tracking.store.SubscriptionStore;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Shared by every simulated instance in a test, like the real Redis registry.
 */
public class InMemorySubscriptionStore implements SubscriptionStore {

    private final Map<UUID, Map<String, Subscription>> byTrip = new LinkedHashMap<>();

    @Override
    public synchronized void add(Subscription subscription) {
        byTrip.computeIfAbsent(subscription.tripId(), id -> new LinkedHashMap<>())
                .put(subscription.connectionId(), subscription);
    }

    @Override
    public synchronized boolean remove(UUID tripId, String connectionId) {
        Map<String, Subscription> subs = byTrip.get(tripId);
        return subs != null && subs.remove(connectionId) != null;
    }

    @Override
    public synchronized List<Subscription> findByTrip(UUID tripId) {
        return new ArrayList<>(byTrip.getOrDefault(tripId, Map.of()).values());
    }

    @Override
    public synchronized Set<UUID> tripsForConnection(String connectionId) {
        Set<UUID> trips = new HashSet<>();
        byTrip.forEach((tripId, subs) -> {
            if (subs.containsKey(connectionId)) {
                trips.add(tripId);
            }
        });
        return trips;
    }

    @Override
    public synchronized int removeTrip(UUID tripId) {
        Map<String, Subscription> removed = byTrip.remove(tripId);
        return removed == null ? 0 : removed.size();
    }
}
