package com.gocomet.tripsafety.tracking.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gocomet.tripsafety.common.message.TrackingMessage;
import com.gocomet.tripsafety.tracking.config.TrackingProperties;
import com.gocomet.tripsafety.tracking.model.LocationSample;
import com.gocomet.tripsafety.tracking.store.SubscriptionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessageSendingOperations;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Forwards bus messages to the STOMP connections held by this instance.
 *
 * Trip clients subscribe to /topic/trips/{tripId}; operator dashboards to
 * /topic/operators/sos. A location message is forwarded only when this instance
 * owns at least one subscription for the trip and the sample is newer than the
 * last one forwarded here, so redelivered duplicates are dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalFanoutDispatcher {

    public static final String TRIP_DESTINATION_PREFIX = "/topic/trips/";
    public static final String OPERATOR_SOS_DESTINATION = "/topic/operators/sos";

    private final SimpMessageSendingOperations messagingTemplate;
    private final SubscriptionStore subscriptionStore;
    private final TrackingProperties trackingProperties;
    private final ObjectMapper objectMapper;

    // last capturedAt forwarded per trip by this instance
    private final Map<UUID, Instant> lastForwarded = new ConcurrentHashMap<>();

    /**
     * @return whether the message was pushed to local connections
     */
    public boolean dispatch(TrackingMessage message) {
        if (message.isLocation()) {
            return dispatchLocation(message);
        }
        messagingTemplate.convertAndSend(OPERATOR_SOS_DESTINATION, message);
        log.debug("Forwarded sosEvent for trip {} to operator dashboards", message.getTripId());
        return true;
    }

    public void forgetTrip(UUID tripId) {
        lastForwarded.remove(tripId);
    }

    private boolean dispatchLocation(TrackingMessage message) {
        LocationSample sample = objectMapper.convertValue(message.getPayload(), LocationSample.class);
        UUID tripId = sample.tripId();

        boolean hasLocalSubscriber = subscriptionStore.findByTrip(tripId).stream()
                .anyMatch(s -> trackingProperties.getInstanceId().equals(s.instanceId()));
        if (!hasLocalSubscriber) {
            lastForwarded.remove(tripId);
            return false;
        }

        boolean[] fresh = new boolean[1];
        lastForwarded.compute(tripId, (id, previous) -> {
            fresh[0] = sample.isNewerThan(previous);
            return fresh[0] ? sample.capturedAt() : previous;
        });
        if (!fresh[0]) {
            log.debug("Dropping duplicate/stale location for trip {} captured at {}", tripId, sample.capturedAt());
            return false;
        }

        messagingTemplate.convertAndSend(TRIP_DESTINATION_PREFIX + tripId,
                TrackingMessage.location(sample, message.getTs()));
        return true;
    }
}
