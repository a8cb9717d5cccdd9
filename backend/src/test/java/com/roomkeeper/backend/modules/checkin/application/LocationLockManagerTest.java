package com.roomkeeper.backend.modules.checkin.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.roomkeeper.backend.global.error.RetryableProblemException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LocationLockManagerTest {

    private static final UUID NURSERY = UUID.fromString("00000000-0000-0000-0000-000000000c01");
    private static final UUID TODDLERS = UUID.fromString("00000000-0000-0000-0000-000000000c02");

    private final ExecutorService executor = Executors.newFixedThreadPool(8);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("sections for the same location never overlap")
    void serializesSameLocation() throws Exception {
        LocationLockManager lockManager = new LocationLockManager(properties(Duration.ofSeconds(10)));
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);

        List<Future<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return lockManager.executeWithLocationLock(NURSERY, () -> {
                    int now = inside.incrementAndGet();
                    maxInside.accumulateAndGet(now, Math::max);
                    sleep(5);
                    inside.decrementAndGet();
                    return now;
                });
            }));
        }
        start.countDown();
        for (Future<Integer> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }

        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("a held lock on one location does not block another location")
    void differentLocationsDoNotContend() throws Exception {
        LocationLockManager lockManager = new LocationLockManager(properties(Duration.ofMillis(200)));
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<String> holder = executor.submit(() -> lockManager.executeWithLocationLock(NURSERY, () -> {
            holding.countDown();
            await(release);
            return "nursery";
        }));
        assertThat(holding.await(2, TimeUnit.SECONDS)).isTrue();

        String other = lockManager.executeWithLocationLock(TODDLERS, () -> "toddlers");
        release.countDown();

        assertThat(other).isEqualTo("toddlers");
        assertThat(holder.get(2, TimeUnit.SECONDS)).isEqualTo("nursery");
    }

    @Test
    @DisplayName("waiting past the timeout fails with a retryable busy error")
    void timeoutRaisesLocationBusy() throws Exception {
        LocationLockManager lockManager = new LocationLockManager(properties(Duration.ofMillis(50)));
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<?> holder = executor.submit(() -> lockManager.executeWithLocationLock(NURSERY, () -> {
            holding.countDown();
            await(release);
            return null;
        }));
        assertThat(holding.await(2, TimeUnit.SECONDS)).isTrue();

        try {
            assertThatThrownBy(() -> lockManager.executeWithLocationLock(NURSERY, () -> "never"))
                    .isInstanceOf(LocationBusyException.class)
                    .isInstanceOf(RetryableProblemException.class)
                    .extracting(ex -> ((LocationBusyException) ex).getRetryAfterSeconds())
                    .isEqualTo(2L);
        } finally {
            release.countDown();
        }
        holder.get(2, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("the lock is released when the section throws")
    void releasesOnException() {
        LocationLockManager lockManager = new LocationLockManager(properties(Duration.ofMillis(50)));

        assertThatThrownBy(() -> lockManager.executeWithLocationLock(NURSERY, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        assertThat(lockManager.executeWithLocationLock(NURSERY, () -> "again")).isEqualTo("again");
    }

    static CheckinProperties properties(Duration lockTimeout) {
        return new CheckinProperties(lockTimeout, Duration.ofSeconds(2), true,
                new CheckinProperties.SecurityCodeSettings(10), new CheckinProperties.CapacitySettings(80));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
