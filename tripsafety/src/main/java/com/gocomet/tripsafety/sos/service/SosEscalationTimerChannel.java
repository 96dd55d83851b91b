package com.gocomet.tripsafety.sos.service;

import com.gocomet.tripsafety.notification.channel.NotificationChannel;
import com.gocomet.tripsafety.notification.model.ChannelType;
import com.gocomet.tripsafety.notification.model.NotificationJob;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * The escalation timer is a delayed job in the delivery queue, so a restart
 * never loses a pending escalation. When it comes due it hands the alert back
 * to the coordinator.
 */
@Component
@RequiredArgsConstructor
public class SosEscalationTimerChannel implements NotificationChannel {

    private final SosAlertService sosAlertService;

    @Override
    public ChannelType type() {
        return ChannelType.SOS_ESCALATION_TIMER;
    }

    @Override
    public String dependency() {
        return null;
    }

    @Override
    public void deliver(NotificationJob job) {
        sosAlertService.onEscalationTimer(job.getAlertId());
    }
}
