package com.gocomet.tripsafety.admission.store;

import com.gocomet.tripsafety.admission.model.BreakerSnapshot;
import com.gocomet.tripsafety.admission.model.CircuitState;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Breaker state as a Redis hash {@code cb:{dependency}} with fields
 * state, failures, version, changedAt.
 */
@Component
@RequiredArgsConstructor
public class RedisBreakerStateStore implements BreakerStateStore {

    private static final String KEY_PREFIX = "cb:";
    private static final RedisScript<Long> CAS_SCRIPT =
            RedisScript.of(new ClassPathResource("scripts/breaker-cas.lua"), Long.class);

    private final StringRedisTemplate redisTemplate;

    @Override
    public BreakerSnapshot load(String dependency) {
        Map<Object, Object> fields = redisTemplate.opsForHash().entries(KEY_PREFIX + dependency);
        if (fields.isEmpty()) {
            return BreakerSnapshot.closed(dependency);
        }
        return new BreakerSnapshot(
                dependency,
                CircuitState.valueOf(stringField(fields, "state", CircuitState.CLOSED.name())),
                Long.parseLong(stringField(fields, "failures", "0")),
                Long.parseLong(stringField(fields, "version", "0")),
                Instant.ofEpochMilli(Long.parseLong(stringField(fields, "changedAt", "0"))));
    }

    @Override
    public boolean compareAndSet(BreakerSnapshot expected, CircuitState next, long failures, Instant changedAt) {
        Long swapped = redisTemplate.execute(CAS_SCRIPT,
                List.of(KEY_PREFIX + expected.dependency()),
                String.valueOf(expected.version()),
                next.name(),
                String.valueOf(failures),
                String.valueOf(changedAt.toEpochMilli()));
        return swapped != null && swapped == 1L;
    }

    @Override
    public long incrementFailures(String dependency) {
        return redisTemplate.opsForHash().increment(KEY_PREFIX + dependency, "failures", 1);
    }

    @Override
    public void resetFailures(String dependency) {
        redisTemplate.opsForHash().put(KEY_PREFIX + dependency, "failures", "0");
    }

    private static String stringField(Map<Object, Object> fields, String name, String fallback) {
        Object value = fields.get(name);
        return value != null ? value.toString() : fallback;
    }
}
