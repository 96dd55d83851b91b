package com.gocomet.tripsafety.tracking.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gocomet.tripsafety.common.message.TrackingMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes tracking messages on Redis pub/sub.
 *
 * location  → trip:location:{tripId}
 * sosEvent  → sos:events
 *
 * Redis pub/sub keeps no backlog, which is what location streaming wants:
 * a subscriber that misses an update simply gets the next one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RedisBroadcastBus implements BroadcastBus {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public boolean publish(TrackingMessage message) {
        String channel = message.isLocation()
                ? LOCATION_CHANNEL_PREFIX + message.getTripId()
                : SOS_CHANNEL;
        try {
            redisTemplate.convertAndSend(channel, objectMapper.writeValueAsString(message));
            log.debug("Published {} for trip {} on {}", message.getType(), message.getTripId(), channel);
            return true;
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize {} message for trip {}", message.getType(), message.getTripId(), e);
            return false;
        } catch (RuntimeException e) {
            log.warn("Broadcast bus unreachable, dropping {} for trip {}: {}",
                    message.getType(), message.getTripId(), e.getMessage());
            return false;
        }
    }
}
