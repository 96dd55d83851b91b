package com.gocomet.tripsafety.common.event;

import com.gocomet.tripsafety.tracking.model.LocationSample;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A change on an SOS alert, pushed to operator dashboards and appended to the
 * "sos-events" Kafka topic.
 *
 * Keyed by alertId so every event of one alert lands in the same partition
 * and replays in order.
 *
 * Event flow:
 * TRIGGERED → NOTIFYING → (ACKNOWLEDGED | ESCALATED) → RESOLVED
 * LOCATION_UPDATE and CHANNEL_RESULT may arrive at any point while the alert is open.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SosEvent {

    private String eventId;
    private UUID alertId;
    private UUID tripId;
    private EventType eventType;
    private String state;
    private String actor;            // who caused the change, null for system transitions
    private LocationSample location; // only on TRIGGERED and LOCATION_UPDATE
    private String detail;
    private Instant timestamp;

    public enum EventType {
        TRIGGERED,
        NOTIFYING,
        CHANNEL_RESULT,
        ACKNOWLEDGED,
        ESCALATED,
        RESOLVED,
        LOCATION_UPDATE
    }

    public static SosEvent of(EventType type, UUID alertId, UUID tripId, String state,
                              String actor, Instant timestamp) {
        return SosEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .alertId(alertId)
                .tripId(tripId)
                .eventType(type)
                .state(state)
                .actor(actor)
                .timestamp(timestamp)
                .build();
    }

    public static SosEvent locationUpdate(UUID alertId, LocationSample sample, Instant timestamp) {
        return SosEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .alertId(alertId)
                .tripId(sample.tripId())
                .eventType(EventType.LOCATION_UPDATE)
                .location(sample)
                .timestamp(timestamp)
                .build();
    }
}
