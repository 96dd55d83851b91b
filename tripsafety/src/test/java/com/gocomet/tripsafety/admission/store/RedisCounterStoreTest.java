package com.gocomet.tripsafety.admission.store;

import com.gocomet.tripsafety.support.RedisContainers;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class RedisCounterStoreTest {

    @Container
    static final GenericContainer<?> redis = RedisContainers.redis();

    private static LettuceConnectionFactory connectionFactory;
    private static StringRedisTemplate redisTemplate;
    private static RedisCounterStore store;

    private final String key = "rl:standard:rider-1:" + UUID.randomUUID();

    @BeforeAll
    static void connect() {
        connectionFactory = RedisContainers.connect(redis);
        redisTemplate = RedisContainers.template(connectionFactory);
        store = new RedisCounterStore(redisTemplate);
    }

    @AfterAll
    static void disconnect() {
        connectionFactory.destroy();
    }

    @Test
    void increment_firstCallSetsWindowTtl() {
        assertEquals(1, store.increment(key, Duration.ofSeconds(120)));

        Long ttlMillis = redisTemplate.getExpire(key, TimeUnit.MILLISECONDS);
        assertNotNull(ttlMillis);
        assertTrue(ttlMillis > 0 && ttlMillis <= 120_000, "ttl was " + ttlMillis);
    }

    @Test
    void increment_laterCallsKeepOriginalTtl() {
        store.increment(key, Duration.ofSeconds(60));

        assertEquals(2, store.increment(key, Duration.ofHours(1)));

        Long ttlMillis = redisTemplate.getExpire(key, TimeUnit.MILLISECONDS);
        assertNotNull(ttlMillis);
        assertTrue(ttlMillis > 0 && ttlMillis <= 60_000, "ttl was extended to " + ttlMillis);
    }

    @Test
    void decrement_givesBackOneSlot() {
        store.increment(key, Duration.ofSeconds(60));
        store.increment(key, Duration.ofSeconds(60));

        assertEquals(1, store.decrement(key));
        assertEquals(1, store.get(key));
    }

    @Test
    void get_missingKey_isZero() {
        assertEquals(0, store.get(key));
    }
}
