package com.gocomet.tripsafety.sos.event;

import com.gocomet.tripsafety.common.event.SosEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

/**
 * Appends SOS alert events to the "sos-events" Kafka topic.
 *
 * KEY = alertId, so every event of one alert lands in the same partition and
 * the audit trail replays in order.
 *
 * The audit log is not on the safety path: the alert record in the database is
 * the source of truth, so a failed append is logged and never fails the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SosEventProducer {

    private final KafkaTemplate<String, SosEvent> kafkaTemplate;

    @Value("${app.kafka.topics.sos-events}")
    private String topic;

    public void publish(SosEvent event) {
        String key = event.getAlertId().toString();
        try {
            kafkaTemplate.send(topic, key, event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("❌ Failed to publish SosEvent [{}] for alert {}",
                                    event.getEventType(), event.getAlertId(), ex);
                        } else {
                            log.info("📤 Published SosEvent [{}] for alert {} → partition {}, offset {}",
                                    event.getEventType(),
                                    event.getAlertId(),
                                    result.getRecordMetadata().partition(),
                                    result.getRecordMetadata().offset());
                        }
                    });
        } catch (RuntimeException e) {
            log.error("❌ Kafka unavailable, SosEvent [{}] for alert {} not audited",
                    event.getEventType(), event.getAlertId(), e);
        }
    }
}
