package com.gocomet.tripsafety.tracking.model;

import java.time.Instant;
import java.util.UUID;

/**
 * One position reading for a trip. Freshness is compared on millisecond
 * precision of {@code capturedAt}, the same precision the shared cache stores.
 */
public record LocationSample(
        UUID tripId,
        double lat,
        double lng,
        double speed,
        double heading,
        Instant capturedAt) {

    public boolean isNewerThan(Instant other) {
        return other == null || capturedAt.toEpochMilli() > other.toEpochMilli();
    }

    public boolean isNewerThan(LocationSample other) {
        return other == null || isNewerThan(other.capturedAt());
    }
}
