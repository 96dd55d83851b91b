package com.gocomet.tripsafety.notification.channel;

import com.gocomet.tripsafety.notification.model.ChannelType;

/**
 * A provider refused or timed out. Transient: the queue retries with backoff.
 */
public class ChannelDeliveryException extends RuntimeException {

    public ChannelDeliveryException(ChannelType channel, String reason) {
        super(String.format("%s delivery failed: %s", channel, reason));
    }
}
