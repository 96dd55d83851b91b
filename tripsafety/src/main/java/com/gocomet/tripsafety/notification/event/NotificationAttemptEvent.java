package com.gocomet.tripsafety.notification.event;

import com.gocomet.tripsafety.notification.model.ChannelType;

import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of one delivery attempt, published as a Spring application event.
 * {@code terminal} is true when the job will not be tried again.
 */
public record NotificationAttemptEvent(
        UUID jobId,
        UUID alertId,
        ChannelType channel,
        boolean success,
        int attempt,
        boolean terminal,
        String error,
        Instant attemptedAt) {
}
