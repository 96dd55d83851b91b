package com.gocomet.tripsafety.notification.channel;

import com.gocomet.tripsafety.notification.model.ChannelType;
import com.gocomet.tripsafety.notification.model.NotificationJob;

/**
 * Delivers claimed jobs of one {@link ChannelType}. Implementations throw
 * {@link ChannelDeliveryException} (or any runtime exception) on failure; the
 * queue decides whether to retry.
 */
public interface NotificationChannel {

    ChannelType type();

    /**
     * Circuit breaker guarding this channel's provider, or null if delivery
     * stays inside this service and needs no breaker.
     */
    default String dependency() {
        return type().name().toLowerCase();
    }

    void deliver(NotificationJob job);
}
