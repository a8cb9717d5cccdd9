package com.roomkeeper.backend.modules.pickup.application;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

/**
 * Shared store for deployments with several instances. The window is the key's TTL, set together with the
 * first increment so a counter can never outlive its window.
 */
@Component
@ConditionalOnProperty(prefix = "app.pickup.rate-limit", name = "store", havingValue = "redis")
public class RedisPickupAttemptStore implements PickupAttemptStore {

    private static final Logger log = LoggerFactory.getLogger(RedisPickupAttemptStore.class);

    static final RedisScript<Long> INCREMENT_SCRIPT = new DefaultRedisScript<>("""
            local count = redis.call('INCR', KEYS[1])
            if redis.call('PTTL', KEYS[1]) < 0 then
                redis.call('PEXPIRE', KEYS[1], ARGV[1])
            end
            return count
            """, Long.class);

    static final RedisScript<Long> DECREMENT_SCRIPT = new DefaultRedisScript<>("""
            if redis.call('EXISTS', KEYS[1]) == 0 then
                return 0
            end
            local count = redis.call('DECR', KEYS[1])
            if count <= 0 then
                redis.call('DEL', KEYS[1])
            end
            return count
            """, Long.class);

    private static final long TTL_NO_EXPIRY = -1L;

    private final StringRedisTemplate redisTemplate;
    private final Duration window;

    public RedisPickupAttemptStore(StringRedisTemplate redisTemplate, PickupRateLimitProperties properties) {
        this.redisTemplate = redisTemplate;
        this.window = properties.window();
    }

    @Override
    public long increment(String key, Duration window) {
        Long count = redisTemplate.execute(INCREMENT_SCRIPT, List.of(key), String.valueOf(window.toMillis()));
        return count == null ? 0 : count;
    }

    @Override
    public void decrement(String key) {
        redisTemplate.execute(DECREMENT_SCRIPT, List.of(key));
    }

    @Override
    public long currentCount(String key) {
        String value = redisTemplate.opsForValue().get(key);
        if (value == null) {
            return 0;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ex) {
            throw new IllegalStateException("Unexpected value under rate limit key " + key, ex);
        }
    }

    /**
     * A counter found without a TTL (written by an older release or by hand) gets a fresh window here.
     */
    @Override
    public Optional<Duration> remainingWindow(String key) {
        Long ttlSeconds = redisTemplate.getExpire(key, TimeUnit.SECONDS);
        if (ttlSeconds == null) {
            return Optional.empty();
        }
        if (ttlSeconds == TTL_NO_EXPIRY) {
            log.warn("Rate limit key {} had no expiry; starting a {} window now", key, window);
            redisTemplate.expire(key, window);
            return Optional.of(window);
        }
        if (ttlSeconds <= 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofSeconds(ttlSeconds));
    }

    @Override
    public void clear(String key) {
        redisTemplate.delete(key);
    }
}
