package com.smsgate.ratelimit;

import com.smsgate.config.SmsGateProperties;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * {@link CounterStore} on Redis. Calls block on the reactive template with a bounded timeout.
 */
@Component
public class RedisCounterStore implements CounterStore {

    // INCR, then attach the window TTL if the key has none (first hit or a key that lost its TTL)
    private static final String INCREMENT_AND_EXPIRE_SCRIPT = """
            local current = redis.call('INCR', KEYS[1])
            if redis.call('TTL', KEYS[1]) < 0 then
                redis.call('EXPIRE', KEYS[1], ARGV[1])
            end
            return current
            """;

    private static final String TTL_SCRIPT = "return redis.call('TTL', KEYS[1])";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final DefaultRedisScript<Long> incrementAndExpireScript;
    private final DefaultRedisScript<Long> ttlScript;
    private final Duration timeout;

    public RedisCounterStore(ReactiveRedisTemplate<String, String> redisTemplate,
                             SmsGateProperties properties) {
        this.redisTemplate = redisTemplate;
        this.incrementAndExpireScript = new DefaultRedisScript<>(INCREMENT_AND_EXPIRE_SCRIPT, Long.class);
        this.ttlScript = new DefaultRedisScript<>(TTL_SCRIPT, Long.class);
        this.timeout = properties.getRedis().getCommandTimeout();
    }

    @Override
    public long increment(String key) {
        return required("INCR " + key, () -> redisTemplate.opsForValue().increment(key).block(timeout));
    }

    @Override
    public void expire(String key, long seconds) {
        call("EXPIRE " + key, () -> redisTemplate.expire(key, Duration.ofSeconds(seconds)).block(timeout));
    }

    @Override
    public long incrementAndExpire(String key, long seconds) {
        return required("INCR+EXPIRE " + key, () -> redisTemplate.execute(
                incrementAndExpireScript,
                List.of(key),
                List.of(String.valueOf(seconds))
        ).blockFirst(timeout));
    }

    @Override
    public long get(String key) {
        String value = call("GET " + key, () -> redisTemplate.opsForValue().get(key).block(timeout));
        if (value == null) return 0;
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new StoreUnavailableException("Counter " + key + " holds a non-numeric value", e);
        }
    }

    @Override
    public long ttlRemaining(String key) {
        return required("TTL " + key, () -> redisTemplate.execute(ttlScript, List.of(key), List.of())
                .blockFirst(timeout));
    }

    @Override
    public long delete(String... keys) {
        Long deleted = call("DEL", () -> redisTemplate.delete(keys).block(timeout));
        return deleted != null ? deleted : 0;
    }

    @Override
    public List<String> keysWithPrefix(String prefix) {
        ScanOptions options = ScanOptions.scanOptions().match(escapeGlob(prefix) + "*").count(100).build();
        List<String> keys = call("SCAN " + prefix, () -> redisTemplate.scan(options).collectList().block(timeout));
        return keys != null ? keys : List.of();
    }

    static String escapeGlob(String value) {
        return value.replaceAll("([*?\\[\\]\\\\])", "\\\\$1");
    }

    private long required(String command, Supplier<Long> supplier) {
        Long result = call(command, supplier);
        if (result == null) {
            throw new StoreUnavailableException("Redis returned no result for " + command);
        }
        return result;
    }

    private <T> T call(String command, Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("Redis command failed: " + command, e);
        }
    }
}
