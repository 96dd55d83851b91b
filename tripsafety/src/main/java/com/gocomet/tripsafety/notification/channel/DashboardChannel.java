package com.gocomet.tripsafety.notification.channel;

import com.gocomet.tripsafety.common.message.TrackingMessage;
import com.gocomet.tripsafety.notification.model.ChannelType;
import com.gocomet.tripsafety.notification.model.NotificationJob;
import com.gocomet.tripsafety.tracking.event.BroadcastBus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pushes the alert to operator dashboards. The alert goes out on the broadcast
 * bus so that every instance forwards it to the operators connected to it on
 * /topic/operators/sos. A bus that does not take the message is a failed delivery.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DashboardChannel implements NotificationChannel {

    public static final String MESSAGE_TYPE = "sosAlert";

    private final BroadcastBus broadcastBus;
    private final Clock clock;

    @Override
    public ChannelType type() {
        return ChannelType.DASHBOARD;
    }

    @Override
    public void deliver(NotificationJob job) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", MESSAGE_TYPE);
        message.put("alertId", job.getAlertId());
        message.put("subject", job.getSubject());
        message.put("payload", job.getPayload());

        if (!broadcastBus.publish(TrackingMessage.sosEvent(null, message, clock.millis()))) {
            throw new ChannelDeliveryException(type(), "broadcast bus did not take the alert");
        }
        log.debug("Published alert {} for operator dashboards", job.getAlertId());
    }
}
