package com.gocomet.tripsafety.tracking.controller;

import com.gocomet.tripsafety.admission.model.EndpointClass;
import com.gocomet.tripsafety.admission.service.RateLimiterService;
import com.gocomet.tripsafety.common.message.TrackingMessage;
import com.gocomet.tripsafety.tracking.service.TrackingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.messaging.simp.annotation.SubscribeMapping;
import org.springframework.stereotype.Controller;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

/**
 * STOMP side of live tracking.
 *
 * A client SUBSCRIBEs to /app/trips/{tripId}; the reply frame carries the last
 * known sample and the connection is registered for the trip. Live updates then
 * arrive on /topic/trips/{tripId}.
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class TrackingStompController {

    private final TrackingService trackingService;
    private final RateLimiterService rateLimiterService;
    private final Clock clock;

    @SubscribeMapping("/trips/{tripId}")
    public TrackingMessage subscribe(@DestinationVariable UUID tripId, SimpMessageHeaderAccessor headers) {
        String connectionId = headers.getSessionId();
        rateLimiterService.check(actorOf(headers, connectionId), EndpointClass.CRITICAL);
        return trackingService.subscribeToTrip(tripId, connectionId)
                .map(sample -> TrackingMessage.location(sample, clock.millis()))
                .orElseGet(() -> TrackingMessage.builder()
                        .type(TrackingMessage.TYPE_LOCATION)
                        .tripId(tripId)
                        .ts(clock.millis())
                        .build());
    }

    @MessageExceptionHandler
    @SendToUser(destinations = "/queue/errors", broadcast = false)
    public Map<String, String> handleError(RuntimeException ex) {
        log.warn("STOMP subscription rejected: {}", ex.getMessage());
        return Map.of(
                "error", ex.getClass().getSimpleName(),
                "message", String.valueOf(ex.getMessage()));
    }

    private static String actorOf(SimpMessageHeaderAccessor headers, String connectionId) {
        String actor = headers.getFirstNativeHeader("X-Actor-Id");
        return actor != null && !actor.isBlank() ? actor.trim() : "session:" + connectionId;
    }
}
