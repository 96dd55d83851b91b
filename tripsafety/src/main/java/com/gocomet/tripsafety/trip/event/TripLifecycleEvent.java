package com.gocomet.tripsafety.trip.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Start/end signal of a trip, produced by the trip service onto the
 * "trip-lifecycle" topic keyed by tripId.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TripLifecycleEvent {

    private UUID tripId;
    private EventType eventType;
    private Instant timestamp;

    public enum EventType {
        STARTED,
        COMPLETED
    }
}
