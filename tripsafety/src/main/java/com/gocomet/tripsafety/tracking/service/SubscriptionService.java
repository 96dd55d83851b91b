package com.gocomet.tripsafety.tracking.service;

import com.gocomet.tripsafety.tracking.config.TrackingProperties;
import com.gocomet.tripsafety.tracking.event.LocalFanoutDispatcher;
import com.gocomet.tripsafety.tracking.model.LocationSample;
import com.gocomet.tripsafety.tracking.model.Subscription;
import com.gocomet.tripsafety.tracking.store.SubscriptionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Registry of which live connections watch which trip. Rows are owned by the
 * instance that holds the connection, and the fan-out dispatcher only forwards
 * to trips this instance owns a row for.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionService {

    private final SubscriptionStore subscriptionStore;
    private final LocationCacheService locationCacheService;
    private final LocalFanoutDispatcher dispatcher;
    private final TrackingProperties properties;
    private final Clock clock;

    /**
     * Registers the connection and returns the last known sample, if any,
     * so the client can render a position before the next update arrives.
     */
    public Optional<LocationSample> subscribe(UUID tripId, String connectionId) {
        subscriptionStore.add(new Subscription(tripId, connectionId, properties.getInstanceId(), clock.instant()));
        log.debug("Connection {} subscribed to trip {} on instance {}", connectionId, tripId, properties.getInstanceId());
        return locationCacheService.get(tripId);
    }

    public boolean unsubscribe(UUID tripId, String connectionId) {
        boolean removed = subscriptionStore.remove(tripId, connectionId);
        log.debug("Connection {} unsubscribed from trip {} (removed={})", connectionId, tripId, removed);
        return removed;
    }

    /**
     * Drops every subscription held by a connection that went away.
     */
    public int unsubscribeAll(String connectionId) {
        Set<UUID> tripIds = subscriptionStore.tripsForConnection(connectionId);
        int removed = 0;
        for (UUID tripId : tripIds) {
            if (subscriptionStore.remove(tripId, connectionId)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Connection {} closed, removed {} subscriptions", connectionId, removed);
        }
        return removed;
    }

    public int closeTrip(UUID tripId) {
        int removed = subscriptionStore.removeTrip(tripId);
        dispatcher.forgetTrip(tripId);
        log.info("Trip {} closed, removed {} subscriptions", tripId, removed);
        return removed;
    }
}
