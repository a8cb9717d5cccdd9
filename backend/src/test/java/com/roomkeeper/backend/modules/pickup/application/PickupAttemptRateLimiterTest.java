package com.roomkeeper.backend.modules.pickup.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.roomkeeper.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PickupAttemptRateLimiterTest {

    private static final String ATTENDANCE = "9b0c6a52-1d7e-4c3f-8a2b-5e6f7a8b9c0d";
    private static final String OTHER_ATTENDANCE = "1a2b3c4d-5e6f-4a7b-8c9d-0e1f2a3b4c5d";
    private static final String KIOSK = "10.0.0.5";
    private static final String OTHER_KIOSK = "10.0.0.6";

    private MutableClock clock;
    private InMemoryPickupAttemptStore store;
    private PickupAttemptRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-05T10:00:00Z"));
        store = new InMemoryPickupAttemptStore(clock);
        rateLimiter = new PickupAttemptRateLimiter(store,
                new PickupRateLimitProperties(5, 15, PickupRateLimitProperties.Store.MEMORY, Duration.ofMinutes(5)));
    }

    @Test
    @DisplayName("the pair is limited once failures reach the maximum")
    void limitedAtMaxAttempts() {
        for (int i = 0; i < 4; i++) {
            rateLimiter.recordFailedAttempt(ATTENDANCE, KIOSK);
        }
        assertThat(rateLimiter.isRateLimited(ATTENDANCE, KIOSK)).isFalse();
        assertThat(rateLimiter.getRetryAfter(ATTENDANCE, KIOSK)).isEmpty();

        rateLimiter.recordFailedAttempt(ATTENDANCE, KIOSK);

        assertThat(rateLimiter.isRateLimited(ATTENDANCE, KIOSK)).isTrue();
        assertThat(rateLimiter.getRetryAfter(ATTENDANCE, KIOSK)).contains(Duration.ofMinutes(15));
    }

    @Test
    @DisplayName("other attendances and other origins keep their own counters")
    void countersAreIndependent() {
        for (int i = 0; i < 5; i++) {
            rateLimiter.recordFailedAttempt(ATTENDANCE, KIOSK);
        }

        assertThat(rateLimiter.isRateLimited(ATTENDANCE, KIOSK)).isTrue();
        assertThat(rateLimiter.isRateLimited(OTHER_ATTENDANCE, KIOSK)).isFalse();
        assertThat(rateLimiter.isRateLimited(ATTENDANCE, OTHER_KIOSK)).isFalse();
    }

    @Test
    @DisplayName("the window is fixed from the first failure and then resets")
    void windowExpires() {
        rateLimiter.recordFailedAttempt(ATTENDANCE, KIOSK);
        clock.advance(Duration.ofMinutes(10));
        for (int i = 0; i < 4; i++) {
            rateLimiter.recordFailedAttempt(ATTENDANCE, KIOSK);
        }

        assertThat(rateLimiter.getRetryAfter(ATTENDANCE, KIOSK)).contains(Duration.ofMinutes(5));

        clock.advance(Duration.ofMinutes(5));

        assertThat(rateLimiter.isRateLimited(ATTENDANCE, KIOSK)).isFalse();
        assertThat(rateLimiter.getRetryAfter(ATTENDANCE, KIOSK)).isEmpty();
        rateLimiter.recordFailedAttempt(ATTENDANCE, KIOSK);
        assertThat(store.currentCount(PickupAttemptRateLimiter.key(ATTENDANCE, KIOSK))).isEqualTo(1);
    }

    @Test
    @DisplayName("reset clears the counter immediately")
    void resetClears() {
        for (int i = 0; i < 5; i++) {
            rateLimiter.recordFailedAttempt(ATTENDANCE, KIOSK);
        }

        rateLimiter.resetAttempts(ATTENDANCE, KIOSK);

        assertThat(rateLimiter.isRateLimited(ATTENDANCE, KIOSK)).isFalse();
    }

    @Test
    @DisplayName("purge drops only expired windows")
    void purgeExpired() {
        rateLimiter.recordFailedAttempt(ATTENDANCE, KIOSK);
        clock.advance(Duration.ofMinutes(10));
        rateLimiter.recordFailedAttempt(OTHER_ATTENDANCE, KIOSK);
        clock.advance(Duration.ofMinutes(6));

        assertThat(rateLimiter.purgeExpired()).isEqualTo(1);
        assertThat(store.currentCount(PickupAttemptRateLimiter.key(OTHER_ATTENDANCE, KIOSK))).isEqualTo(1);
    }

    @Test
    @DisplayName("a burst of parallel attempts from one pair is cut off at the maximum")
    void parallelAttemptsCannotPassLimit() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> attempts = new ArrayList<>();
        try {
            for (int i = 0; i < 20; i++) {
                attempts.add(executor.submit(() -> {
                    start.await();
                    return rateLimiter.tryReserveAttempt(ATTENDANCE, KIOSK);
                }));
            }
            start.countDown();

            int admitted = 0;
            for (Future<Boolean> attempt : attempts) {
                if (attempt.get(5, TimeUnit.SECONDS)) {
                    admitted++;
                }
            }

            assertThat(admitted).isEqualTo(5);
            assertThat(store.currentCount(PickupAttemptRateLimiter.key(ATTENDANCE, KIOSK))).isEqualTo(5);
            assertThat(rateLimiter.getRetryAfter(ATTENDANCE, KIOSK)).contains(Duration.ofMinutes(15));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("a released attempt is not counted and does not leave a window behind")
    void releasedAttemptIsNotCounted() {
        rateLimiter.recordFailedAttempt(ATTENDANCE, KIOSK);
        assertThat(rateLimiter.tryReserveAttempt(ATTENDANCE, KIOSK)).isTrue();
        rateLimiter.releaseAttempt(ATTENDANCE, KIOSK);

        assertThat(store.currentCount(PickupAttemptRateLimiter.key(ATTENDANCE, KIOSK))).isEqualTo(1);

        assertThat(rateLimiter.tryReserveAttempt(OTHER_ATTENDANCE, KIOSK)).isTrue();
        rateLimiter.releaseAttempt(OTHER_ATTENDANCE, KIOSK);

        assertThat(store.remainingWindow(PickupAttemptRateLimiter.key(OTHER_ATTENDANCE, KIOSK))).isEmpty();
    }

    @Test
    @DisplayName("a refused reservation does not extend the count")
    void refusedReservationIsNotCounted() {
        for (int i = 0; i < 5; i++) {
            rateLimiter.recordFailedAttempt(ATTENDANCE, KIOSK);
        }

        assertThat(rateLimiter.tryReserveAttempt(ATTENDANCE, KIOSK)).isFalse();
        assertThat(store.currentCount(PickupAttemptRateLimiter.key(ATTENDANCE, KIOSK))).isEqualTo(5);
    }

    @Test
    @DisplayName("keys combine attendance and origin")
    void keyFormat() {
        assertThat(PickupAttemptRateLimiter.key(ATTENDANCE, KIOSK))
                .isEqualTo("pickup-attempts:" + ATTENDANCE + ":" + KIOSK);
    }
}
