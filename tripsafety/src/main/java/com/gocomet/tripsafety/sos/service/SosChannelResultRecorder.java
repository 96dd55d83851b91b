package com.gocomet.tripsafety.sos.service;

import com.gocomet.tripsafety.common.event.SosEvent;
import com.gocomet.tripsafety.notification.event.NotificationAttemptEvent;
import com.gocomet.tripsafety.notification.model.ChannelType;
import com.gocomet.tripsafety.sos.event.SosEventPublisher;
import com.gocomet.tripsafety.sos.model.ChannelResultStatus;
import com.gocomet.tripsafety.sos.model.SosAlert;
import com.gocomet.tripsafety.sos.model.SosChannelResult;
import com.gocomet.tripsafety.sos.repository.SosAlertRepository;
import com.gocomet.tripsafety.sos.repository.SosChannelResultRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * Folds delivery attempts of SOS jobs into one result row per (alert, channel).
 * Several contacts share a channel, so the row keeps the best outcome seen:
 * once SUCCESS it stays SUCCESS.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SosChannelResultRecorder {

    private final SosChannelResultRepository resultRepository;
    private final SosAlertRepository alertRepository;
    private final SosEventPublisher eventPublisher;

    @EventListener
    public void onAttempt(NotificationAttemptEvent event) {
        if (event.alertId() == null || event.channel() == ChannelType.SOS_ESCALATION_TIMER) {
            return;
        }
        SosChannelResult result;
        try {
            result = upsert(event);
        } catch (DataIntegrityViolationException e) {
            // another worker inserted the row for this channel first
            result = upsert(event);
        }
        log.info("SOS alert {} channel {} → {} (attempt {})",
                event.alertId(), event.channel(), result.getStatus(), event.attempt());

        SosEvent sosEvent = SosEvent.of(SosEvent.EventType.CHANNEL_RESULT, event.alertId(),
                alertRepository.findById(event.alertId()).map(SosAlert::getTripId).orElse(null),
                null, null, event.attemptedAt());
        sosEvent.setDetail(event.channel() + ":" + result.getStatus());
        eventPublisher.announce(sosEvent);
    }

    private SosChannelResult upsert(NotificationAttemptEvent event) {
        SosChannelResult result = resultRepository.findByAlertIdAndChannel(event.alertId(), event.channel())
                .orElseGet(() -> SosChannelResult.builder()
                        .alertId(event.alertId())
                        .channel(event.channel())
                        .status(ChannelResultStatus.FAILURE)
                        .build());

        result.setAttempts(result.getAttempts() + 1);
        result.setAttemptedAt(event.attemptedAt());
        if (event.success()) {
            result.setStatus(ChannelResultStatus.SUCCESS);
            result.setLastError(null);
        } else if (result.getStatus() != ChannelResultStatus.SUCCESS) {
            result.setLastError(event.error());
        }
        return resultRepository.saveAndFlush(result);
    }
}
