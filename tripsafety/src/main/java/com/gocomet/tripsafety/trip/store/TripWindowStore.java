package com.gocomet.tripsafety.trip.store;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Shared per-trip flags driven by lifecycle signals and the SOS coordinator.
 */
public interface TripWindowStore {

    void open(UUID tripId, Duration maxDuration);

    /**
     * Closes the window and remembers the trip as completed for {@code retention}.
     */
    void close(UUID tripId, Duration retention);

    boolean isOpen(UUID tripId);

    boolean isCompleted(UUID tripId);

    void markSosActive(UUID tripId, UUID alertId);

    void clearSosActive(UUID tripId);

    Optional<UUID> findSosActiveAlert(UUID tripId);
}
