package com.roomkeeper.backend.modules.pickup.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class RedisPickupAttemptStoreTest {

    private static final String KEY = "pickup-attempts:9b0c6a52-1d7e-4c3f-8a2b-5e6f7a8b9c0d:10.0.0.5";
    private static final Duration WINDOW = Duration.ofMinutes(15);

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisPickupAttemptStore store;

    @BeforeEach
    void setUp() {
        store = new RedisPickupAttemptStore(redisTemplate,
                new PickupRateLimitProperties(5, 15, PickupRateLimitProperties.Store.REDIS, Duration.ofMinutes(5)));
    }

    @Test
    @DisplayName("increment and expiry run as one script with the window in milliseconds")
    void incrementIsSingleScript() {
        when(redisTemplate.execute(eq(RedisPickupAttemptStore.INCREMENT_SCRIPT), eq(List.of(KEY)), eq("900000")))
                .thenReturn(1L);

        assertThat(store.increment(KEY, WINDOW)).isEqualTo(1);
        verify(redisTemplate, never()).expire(any(String.class), any(Duration.class));
        verify(redisTemplate, never()).opsForValue();
    }

    @Test
    @DisplayName("the increment script sets the expiry whenever the key has none")
    void incrementScriptRepairsMissingExpiry() {
        String script = RedisPickupAttemptStore.INCREMENT_SCRIPT.getScriptAsString();

        assertThat(script).contains("INCR").contains("PTTL").contains("< 0").contains("PEXPIRE");
        assertThat(RedisPickupAttemptStore.INCREMENT_SCRIPT.getResultType()).isEqualTo(Long.class);
    }

    @Test
    @DisplayName("decrement never creates a key and drops it at zero")
    void decrementScript() {
        store.decrement(KEY);

        verify(redisTemplate).execute(eq(RedisPickupAttemptStore.DECREMENT_SCRIPT), eq(List.of(KEY)));
        assertThat(RedisPickupAttemptStore.DECREMENT_SCRIPT.getScriptAsString())
                .contains("EXISTS").contains("DECR").contains("DEL");
    }

    @Test
    @DisplayName("count and remaining window come from the value and its TTL")
    void readsCountAndTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(KEY)).thenReturn("4");
        when(redisTemplate.getExpire(KEY, TimeUnit.SECONDS)).thenReturn(420L);

        assertThat(store.currentCount(KEY)).isEqualTo(4);
        assertThat(store.remainingWindow(KEY)).contains(Duration.ofSeconds(420));
    }

    @Test
    @DisplayName("a counter without a TTL gets a fresh window instead of locking out forever")
    void keyWithoutTtlIsGivenWindow() {
        when(redisTemplate.getExpire(KEY, TimeUnit.SECONDS)).thenReturn(-1L);

        assertThat(store.remainingWindow(KEY)).contains(WINDOW);
        verify(redisTemplate).expire(KEY, WINDOW);
    }

    @Test
    @DisplayName("a limited pair stuck without a TTL still gets a Retry-After and a window")
    void limiterRecoversFromKeyWithoutTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(KEY)).thenReturn("5");
        when(redisTemplate.getExpire(KEY, TimeUnit.SECONDS)).thenReturn(-1L);
        PickupAttemptRateLimiter rateLimiter = new PickupAttemptRateLimiter(store,
                new PickupRateLimitProperties(5, 15, PickupRateLimitProperties.Store.REDIS, Duration.ofMinutes(5)));

        assertThat(rateLimiter.getRetryAfter("9b0c6a52-1d7e-4c3f-8a2b-5e6f7a8b9c0d", "10.0.0.5"))
                .contains(WINDOW);
        verify(redisTemplate).expire(KEY, WINDOW);
    }

    @Test
    @DisplayName("a missing key has no count and no window")
    void missingKey() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(KEY)).thenReturn(null);
        when(redisTemplate.getExpire(KEY, TimeUnit.SECONDS)).thenReturn(-2L);

        assertThat(store.currentCount(KEY)).isZero();
        assertThat(store.remainingWindow(KEY)).isEmpty();
        verify(redisTemplate, never()).expire(any(String.class), any(Duration.class));
    }

    @Test
    @DisplayName("clear deletes the key")
    void clearDeletes() {
        store.clear(KEY);

        verify(redisTemplate).delete(KEY);
    }
}
