package com.gocomet.tripsafety.tracking.event;

import com.gocomet.tripsafety.common.message.TrackingMessage;

/**
 * Best-effort publish/subscribe channel between service instances.
 * Never blocks and never queues: if the bus cannot take a message it is dropped.
 */
public interface BroadcastBus {

    String LOCATION_CHANNEL_PREFIX = "trip:location:";
    String LOCATION_CHANNEL_PATTERN = LOCATION_CHANNEL_PREFIX + "*";
    String SOS_CHANNEL = "sos:events";

    /**
     * @return false if the message was dropped
     */
    boolean publish(TrackingMessage message);
}
