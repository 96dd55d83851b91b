package com.gocomet.tripsafety.tracking.store;

import com.gocomet.tripsafety.tracking.model.Subscription;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Shared registry of which connections watch which trip.
 */
public interface SubscriptionStore {

    void add(Subscription subscription);

    boolean remove(UUID tripId, String connectionId);

    List<Subscription> findByTrip(UUID tripId);

    Set<UUID> tripsForConnection(String connectionId);

    /**
     * Drop every subscription of the trip, returning how many were removed.
     */
    int removeTrip(UUID tripId);
}
