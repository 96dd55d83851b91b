package com.gocomet.tripsafety.admission.store;

import lombok.RequiredArgsConstructor;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

@Component
@RequiredArgsConstructor
public class RedisCounterStore implements CounterStore {

    private static final RedisScript<Long> INCREMENT_SCRIPT =
            RedisScript.of(new ClassPathResource("scripts/counter-increment.lua"), Long.class);

    private final StringRedisTemplate redisTemplate;

    @Override
    public long increment(String key, Duration ttl) {
        // INCR and PEXPIRE in one script so a counter can never outlive its window
        Long value = redisTemplate.execute(INCREMENT_SCRIPT, List.of(key), String.valueOf(ttl.toMillis()));
        return value != null ? value : 0L;
    }

    @Override
    public long decrement(String key) {
        Long value = redisTemplate.opsForValue().decrement(key);
        return value != null ? value : 0L;
    }

    @Override
    public long get(String key) {
        String value = redisTemplate.opsForValue().get(key);
        return value != null ? Long.parseLong(value) : 0L;
    }
}
