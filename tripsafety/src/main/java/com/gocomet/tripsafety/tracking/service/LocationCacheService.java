package com.gocomet.tripsafety.tracking.service;

import com.gocomet.tripsafety.common.event.SosEvent;
import com.gocomet.tripsafety.common.event.SosLocationSampledEvent;
import com.gocomet.tripsafety.common.message.TrackingMessage;
import com.gocomet.tripsafety.tracking.config.TrackingProperties;
import com.gocomet.tripsafety.tracking.event.BroadcastBus;
import com.gocomet.tripsafety.tracking.model.LocationSample;
import com.gocomet.tripsafety.tracking.store.LocationStore;
import com.gocomet.tripsafety.trip.store.TripWindowStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Last known position per trip.
 *
 * A write is kept only if its capturedAt is strictly newer than what is stored,
 * so the cache converges on the newest sample whatever order writes arrive in.
 * Every accepted write is published on the broadcast bus; a failed publish is
 * logged and does not undo the write. Nothing on this path throws to the caller.
 *
 * While the trip has an open SOS alert, accepted samples also go to operator
 * dashboards and are published locally for the alert's continuous tracking.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LocationCacheService {

    private final LocationStore locationStore;
    private final BroadcastBus broadcastBus;
    private final TripWindowStore tripWindowStore;
    private final TrackingProperties properties;
    private final Clock clock;
    private final ApplicationEventPublisher eventPublisher;

    public boolean put(LocationSample sample) {
        if (!isValid(sample)) {
            log.warn("Rejecting out-of-range location sample for trip {}: {}",
                    sample == null ? null : sample.tripId(), sample);
            return false;
        }

        boolean accepted;
        try {
            accepted = locationStore.putIfNewer(sample, properties.getLocationTtl());
        } catch (RuntimeException e) {
            log.warn("Location store unavailable, dropping sample for trip {}: {}",
                    sample.tripId(), e.getMessage());
            return false;
        }

        if (!accepted) {
            log.debug("Discarded stale sample for trip {} captured at {}", sample.tripId(), sample.capturedAt());
            return false;
        }
        log.debug("Cached sample for trip {} captured at {}", sample.tripId(), sample.capturedAt());

        long now = clock.millis();
        if (!broadcastBus.publish(TrackingMessage.location(sample, now))) {
            log.warn("Location for trip {} cached but not broadcast", sample.tripId());
        }
        publishToOperatorsIfSosActive(sample, now);
        return true;
    }

    public Optional<LocationSample> get(UUID tripId) {
        try {
            return locationStore.find(tripId);
        } catch (RuntimeException e) {
            log.warn("Location store unavailable reading trip {}: {}", tripId, e.getMessage());
            return Optional.empty();
        }
    }

    public void evict(UUID tripId) {
        locationStore.evict(tripId);
        log.debug("Evicted cached location for trip {}", tripId);
    }

    private void publishToOperatorsIfSosActive(LocationSample sample, long now) {
        Optional<UUID> alertId;
        try {
            alertId = tripWindowStore.findSosActiveAlert(sample.tripId());
        } catch (RuntimeException e) {
            log.warn("Cannot read SOS flag for trip {}: {}", sample.tripId(), e.getMessage());
            return;
        }
        alertId.ifPresent(id -> {
            broadcastBus.publish(TrackingMessage.sosEvent(sample.tripId(),
                    SosEvent.locationUpdate(id, sample, clock.instant()), now));
            eventPublisher.publishEvent(new SosLocationSampledEvent(id, sample));
        });
    }

    static boolean isValid(LocationSample sample) {
        return sample != null
                && sample.tripId() != null
                && sample.capturedAt() != null
                && sample.lat() >= -90 && sample.lat() <= 90
                && sample.lng() >= -180 && sample.lng() <= 180
                && sample.speed() >= 0
                && sample.heading() >= 0 && sample.heading() < 360;
    }
}
