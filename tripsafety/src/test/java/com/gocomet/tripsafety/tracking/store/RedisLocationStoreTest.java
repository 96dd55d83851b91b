package com.gocomet.tripsafety.tracking.store;

import com.gocomet.tripsafety.support.RedisContainers;
import com.gocomet.tripsafety.support.TestJson;
import com.gocomet.tripsafety.tracking.model.LocationSample;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class RedisLocationStoreTest {

    private static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");
    private static final Duration TTL = Duration.ofMinutes(5);

    @Container
    static final GenericContainer<?> redis = RedisContainers.redis();

    private static LettuceConnectionFactory connectionFactory;
    private static StringRedisTemplate redisTemplate;
    private static RedisLocationStore store;

    private final UUID tripId = UUID.randomUUID();

    @BeforeAll
    static void connect() {
        connectionFactory = RedisContainers.connect(redis);
        redisTemplate = RedisContainers.template(connectionFactory);
        store = new RedisLocationStore(redisTemplate, TestJson.mapper());
    }

    @AfterAll
    static void disconnect() {
        connectionFactory.destroy();
    }

    @Test
    void putIfNewer_outOfOrderArrivals_keepNewestSample() {
        assertTrue(store.putIfNewer(sampleAt(5, 12.971), TTL));
        assertFalse(store.putIfNewer(sampleAt(3, 12.972), TTL));
        assertTrue(store.putIfNewer(sampleAt(8, 12.973), TTL));

        LocationSample stored = store.find(tripId).orElseThrow();
        assertEquals(T0.plusSeconds(8), stored.capturedAt());
        assertEquals(12.973, stored.lat(), 1e-9);
    }

    @Test
    void putIfNewer_sameCapturedAt_firstWriteWins() {
        assertTrue(store.putIfNewer(sampleAt(5, 12.971), TTL));

        assertFalse(store.putIfNewer(sampleAt(5, 12.999), TTL));

        assertEquals(12.971, store.find(tripId).orElseThrow().lat(), 1e-9);
    }

    @Test
    void putIfNewer_expiresAfterIdleWindow() {
        store.putIfNewer(sampleAt(1, 12.97), TTL);

        Long ttlMillis = redisTemplate.getExpire("loc:trip:" + tripId, TimeUnit.MILLISECONDS);
        assertNotNull(ttlMillis);
        assertTrue(ttlMillis > 0 && ttlMillis <= TTL.toMillis(), "ttl was " + ttlMillis);
    }

    @Test
    void evict_removesTripLocation() {
        store.putIfNewer(sampleAt(1, 12.97), TTL);

        store.evict(tripId);

        assertTrue(store.find(tripId).isEmpty());
        assertTrue(store.putIfNewer(sampleAt(0, 12.97), TTL), "an evicted trip accepts any sample");
    }

    private LocationSample sampleAt(int seconds, double lat) {
        return new LocationSample(tripId, lat, 77.59, 8, 90, T0.plusSeconds(seconds));
    }
}
