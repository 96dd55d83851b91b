package com.gocomet.tripsafety.tracking.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A live connection's interest in a trip. The instance holding the physical
 * connection owns the row.
 */
public record Subscription(
        UUID tripId,
        String connectionId,
        String instanceId,
        Instant subscribedAt) {
}
