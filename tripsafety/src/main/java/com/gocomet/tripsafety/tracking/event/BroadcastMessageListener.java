package com.gocomet.tripsafety.tracking.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gocomet.tripsafety.common.message.TrackingMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Receives every bus message on this instance (pattern trip:location:* and
 * channel sos:events) and hands it to the local dispatcher.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BroadcastMessageListener implements MessageListener {

    private final LocalFanoutDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String channel = new String(message.getChannel(), StandardCharsets.UTF_8);
        try {
            TrackingMessage trackingMessage = objectMapper.readValue(message.getBody(), TrackingMessage.class);
            dispatcher.dispatch(trackingMessage);
        } catch (Exception e) {
            // a bad message must not kill the listener container thread
            log.warn("Discarding unreadable message on {}: {}", channel, e.getMessage());
        }
    }
}
