package com.gocomet.tripsafety.trip.service;

import com.gocomet.tripsafety.tracking.config.TrackingProperties;
import com.gocomet.tripsafety.tracking.service.LocationCacheService;
import com.gocomet.tripsafety.tracking.service.SubscriptionService;
import com.gocomet.tripsafety.trip.store.TripWindowStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Opens and closes the window during which a trip may be tracked.
 * A completed trip is remembered for a while so late SOS triggers can be refused.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TripLifecycleService {

    private final TripWindowStore tripWindowStore;
    private final SubscriptionService subscriptionService;
    private final LocationCacheService locationCacheService;
    private final TrackingProperties properties;

    public void tripStarted(UUID tripId) {
        tripWindowStore.open(tripId, properties.getMaxTripDuration());
        log.info("Trip {} started, tracking window open", tripId);
    }

    public void tripCompleted(UUID tripId) {
        tripWindowStore.close(tripId, properties.getCompletedTripRetention());
        subscriptionService.closeTrip(tripId);
        locationCacheService.evict(tripId);
        log.info("Trip {} completed, tracking window closed", tripId);
    }

    public boolean isActive(UUID tripId) {
        return tripWindowStore.isOpen(tripId);
    }
}
