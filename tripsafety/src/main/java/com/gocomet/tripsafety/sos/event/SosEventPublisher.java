package com.gocomet.tripsafety.sos.event;

import com.gocomet.tripsafety.common.event.SosEvent;
import com.gocomet.tripsafety.common.message.TrackingMessage;
import com.gocomet.tripsafety.tracking.event.BroadcastBus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Sends an SOS event to both sinks: live operator dashboards over the
 * broadcast bus and the Kafka audit log.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SosEventPublisher {

    private final BroadcastBus broadcastBus;
    private final SosEventProducer sosEventProducer;
    private final Clock clock;

    public void announce(SosEvent event) {
        if (!broadcastBus.publish(TrackingMessage.sosEvent(event.getTripId(), event, clock.millis()))) {
            log.warn("SosEvent [{}] for alert {} not broadcast to dashboards", event.getEventType(), event.getAlertId());
        }
        sosEventProducer.publish(event);
    }
}
