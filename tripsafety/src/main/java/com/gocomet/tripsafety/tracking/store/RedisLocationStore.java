package com.gocomet.tripsafety.tracking.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gocomet.tripsafety.tracking.model.LocationSample;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.data.redis.serializer.SerializationException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Trip locations as Redis hashes {@code loc:trip:{tripId}} holding the sample
 * JSON and its capturedAt millis. The compare-and-write runs as one Lua script,
 * so concurrent writers from different instances can never regress a trip's position.
 * Entries expire on their own once a trip stops sending.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RedisLocationStore implements LocationStore {

    private static final String KEY_PREFIX = "loc:trip:";
    private static final RedisScript<Long> PUT_IF_NEWER_SCRIPT =
            RedisScript.of(new ClassPathResource("scripts/location-put-if-newer.lua"), Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public boolean putIfNewer(LocationSample sample, Duration ttl) {
        Long written = redisTemplate.execute(PUT_IF_NEWER_SCRIPT,
                List.of(KEY_PREFIX + sample.tripId()),
                String.valueOf(sample.capturedAt().toEpochMilli()),
                toJson(sample),
                String.valueOf(ttl.toMillis()));
        return written != null && written == 1L;
    }

    @Override
    public Optional<LocationSample> find(UUID tripId) {
        Object json = redisTemplate.opsForHash().get(KEY_PREFIX + tripId, "sample");
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json.toString(), LocationSample.class));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable cached location for trip {}: {}", tripId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void evict(UUID tripId) {
        redisTemplate.delete(KEY_PREFIX + tripId);
    }

    private String toJson(LocationSample sample) {
        try {
            return objectMapper.writeValueAsString(sample);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Cannot serialize location sample", e);
        }
    }
}
