package com.gocomet.tripsafety.tracking.service;

import com.gocomet.tripsafety.common.exception.TripNotActiveException;
import com.gocomet.tripsafety.tracking.model.LocationSample;
import com.gocomet.tripsafety.trip.store.TripWindowStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for the live-tracking operations exposed over REST and STOMP.
 * Both need the trip's lifecycle window to be open.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackingService {

    private final SubscriptionService subscriptionService;
    private final LocationCacheService locationCacheService;
    private final TripWindowStore tripWindowStore;

    public Optional<LocationSample> subscribeToTrip(UUID tripId, String connectionId) {
        if (!tripWindowStore.isOpen(tripId)) {
            throw new TripNotActiveException(tripId, "subscribe");
        }
        return subscriptionService.subscribe(tripId, connectionId);
    }

    public boolean unsubscribeFromTrip(UUID tripId, String connectionId) {
        return subscriptionService.unsubscribe(tripId, connectionId);
    }

    /**
     * Best effort: returns false instead of throwing when the sample is not kept.
     */
    public boolean ingestLocation(UUID tripId, LocationSample sample) {
        if (!tripId.equals(sample.tripId())) {
            log.warn("Sample trip {} does not match path trip {}", sample.tripId(), tripId);
            return false;
        }
        boolean open;
        try {
            open = tripWindowStore.isOpen(tripId);
        } catch (RuntimeException e) {
            log.warn("Trip window lookup failed for {}, dropping sample: {}", tripId, e.getMessage());
            return false;
        }
        if (!open) {
            log.debug("Trip {} is not active, ignoring sample", tripId);
            return false;
        }
        return locationCacheService.put(sample);
    }

    public Optional<LocationSample> lastKnownLocation(UUID tripId) {
        return locationCacheService.get(tripId);
    }
}
