package com.gocomet.tripsafety.trip.event;

import com.gocomet.tripsafety.trip.service.TripLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

/**
 * Consumes trip start/end signals from the "trip-lifecycle" topic.
 *
 * Consumer group: "trip-safety-lifecycle"
 * Keyed by tripId, so STARTED is always seen before COMPLETED for the same trip.
 * Both handlers are idempotent; redelivery after a rebalance is harmless.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TripLifecycleConsumer {

    private final TripLifecycleService tripLifecycleService;

    @KafkaListener(topics = "${app.kafka.topics.trip-lifecycle}", groupId = "trip-safety-lifecycle")
    public void consume(
            @Payload TripLifecycleEvent event,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset) {

        log.info("📥 TripLifecycleEvent [{}] — tripId={} | partition={}, offset={}",
                event.getEventType(), event.getTripId(), partition, offset);

        if (event.getTripId() == null || event.getEventType() == null) {
            log.warn("   ↳ Ignoring malformed lifecycle event {}", event);
            return;
        }

        switch (event.getEventType()) {
            case STARTED -> tripLifecycleService.tripStarted(event.getTripId());
            case COMPLETED -> tripLifecycleService.tripCompleted(event.getTripId());
        }
    }
}
