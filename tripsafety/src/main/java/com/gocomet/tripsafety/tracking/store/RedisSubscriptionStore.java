package com.gocomet.tripsafety.tracking.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gocomet.tripsafety.tracking.config.TrackingProperties;
import com.gocomet.tripsafety.tracking.model.Subscription;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.serializer.SerializationException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Subscriptions in Redis:
 * subs:trip:{tripId}        hash, field = connectionId, value = subscription JSON
 * subs:conn:{connectionId}  set of tripIds, for cleanup on disconnect
 *
 * Both keys expire after the maximum trip duration, refreshed on every subscribe,
 * so entries left by a crashed instance do not outlive the trip.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RedisSubscriptionStore implements SubscriptionStore {

    private static final String TRIP_KEY_PREFIX = "subs:trip:";
    private static final String CONNECTION_KEY_PREFIX = "subs:conn:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final TrackingProperties trackingProperties;

    @Override
    public void add(Subscription subscription) {
        String tripKey = TRIP_KEY_PREFIX + subscription.tripId();
        String connectionKey = CONNECTION_KEY_PREFIX + subscription.connectionId();
        redisTemplate.opsForHash().put(tripKey, subscription.connectionId(), toJson(subscription));
        redisTemplate.opsForSet().add(connectionKey, subscription.tripId().toString());

        Duration ttl = trackingProperties.getMaxTripDuration();
        redisTemplate.expire(tripKey, ttl);
        redisTemplate.expire(connectionKey, ttl);
    }

    @Override
    public boolean remove(UUID tripId, String connectionId) {
        Long removed = redisTemplate.opsForHash().delete(TRIP_KEY_PREFIX + tripId, connectionId);
        redisTemplate.opsForSet().remove(CONNECTION_KEY_PREFIX + connectionId, tripId.toString());
        return removed != null && removed > 0;
    }

    @Override
    public List<Subscription> findByTrip(UUID tripId) {
        Map<Object, Object> entries = redisTemplate.opsForHash().entries(TRIP_KEY_PREFIX + tripId);
        List<Subscription> subscriptions = new ArrayList<>(entries.size());
        for (Object json : entries.values()) {
            try {
                subscriptions.add(objectMapper.readValue(json.toString(), Subscription.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable subscription for trip {}: {}", tripId, e.getMessage());
            }
        }
        return subscriptions;
    }

    @Override
    public Set<UUID> tripsForConnection(String connectionId) {
        Set<String> members = redisTemplate.opsForSet().members(CONNECTION_KEY_PREFIX + connectionId);
        Set<UUID> tripIds = new HashSet<>();
        if (members != null) {
            members.forEach(id -> tripIds.add(UUID.fromString(id)));
        }
        return tripIds;
    }

    @Override
    public int removeTrip(UUID tripId) {
        String tripKey = TRIP_KEY_PREFIX + tripId;
        Set<Object> connectionIds = redisTemplate.opsForHash().keys(tripKey);
        for (Object connectionId : connectionIds) {
            redisTemplate.opsForSet().remove(CONNECTION_KEY_PREFIX + connectionId, tripId.toString());
        }
        redisTemplate.delete(tripKey);
        return connectionIds.size();
    }

    private String toJson(Subscription subscription) {
        try {
            return objectMapper.writeValueAsString(subscription);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Cannot serialize subscription", e);
        }
    }
}
