package com.gocomet.tripsafety.tracking.controller;

import com.gocomet.tripsafety.tracking.service.SubscriptionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * Cleans up the registry when a socket goes away, so other instances stop
 * counting this one as a subscriber.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TrackingSessionListener {

    private final SubscriptionService subscriptionService;

    @EventListener
    public void onDisconnect(SessionDisconnectEvent event) {
        try {
            subscriptionService.unsubscribeAll(event.getSessionId());
        } catch (RuntimeException e) {
            log.warn("Could not clean up subscriptions of session {}: {}", event.getSessionId(), e.getMessage());
        }
    }
}
