package com.gocomet.tripsafety.trip.store;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class RedisTripWindowStore implements TripWindowStore {

    private static final String OPEN_PREFIX = "trip:open:";
    private static final String COMPLETED_PREFIX = "trip:completed:";
    private static final String SOS_PREFIX = "trip:sos:";

    private final StringRedisTemplate redisTemplate;

    @Override
    public void open(UUID tripId, Duration maxDuration) {
        redisTemplate.opsForValue().set(OPEN_PREFIX + tripId, "1", maxDuration);
    }

    @Override
    public void close(UUID tripId, Duration retention) {
        redisTemplate.delete(OPEN_PREFIX + tripId);
        redisTemplate.opsForValue().set(COMPLETED_PREFIX + tripId, "1", retention);
    }

    @Override
    public boolean isOpen(UUID tripId) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(OPEN_PREFIX + tripId));
    }

    @Override
    public boolean isCompleted(UUID tripId) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(COMPLETED_PREFIX + tripId));
    }

    @Override
    public void markSosActive(UUID tripId, UUID alertId) {
        redisTemplate.opsForValue().set(SOS_PREFIX + tripId, alertId.toString());
    }

    @Override
    public void clearSosActive(UUID tripId) {
        redisTemplate.delete(SOS_PREFIX + tripId);
    }

    @Override
    public Optional<UUID> findSosActiveAlert(UUID tripId) {
        String alertId = redisTemplate.opsForValue().get(SOS_PREFIX + tripId);
        return Optional.ofNullable(alertId).map(UUID::fromString);
    }
}
