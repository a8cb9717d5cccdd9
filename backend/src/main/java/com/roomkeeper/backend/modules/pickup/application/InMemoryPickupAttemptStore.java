package com.roomkeeper.backend.modules.pickup.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local store. State is lost on restart, which is acceptable for a brute-force throttle.
 */
@Component
@ConditionalOnProperty(prefix = "app.pickup.rate-limit", name = "store", havingValue = "memory", matchIfMissing = true)
public class InMemoryPickupAttemptStore implements PickupAttemptStore {

    private final ConcurrentMap<String, AttemptWindow> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryPickupAttemptStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long increment(String key, Duration window) {
        Instant now = clock.instant();
        AttemptWindow updated = windows.compute(key, (k, current) -> {
            if (current == null || current.isExpired(now)) {
                return new AttemptWindow(1, now.plus(window));
            }
            return new AttemptWindow(current.count() + 1, current.expiresAt());
        });
        return updated.count();
    }

    @Override
    public void decrement(String key) {
        Instant now = clock.instant();
        windows.computeIfPresent(key, (k, current) -> {
            if (current.isExpired(now) || current.count() <= 1) {
                return null;
            }
            return new AttemptWindow(current.count() - 1, current.expiresAt());
        });
    }

    @Override
    public long currentCount(String key) {
        AttemptWindow window = windows.get(key);
        if (window == null || window.isExpired(clock.instant())) {
            return 0;
        }
        return window.count();
    }

    @Override
    public Optional<Duration> remainingWindow(String key) {
        Instant now = clock.instant();
        AttemptWindow window = windows.get(key);
        if (window == null || window.isExpired(now)) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(now, window.expiresAt()));
    }

    @Override
    public void clear(String key) {
        windows.remove(key);
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = windows.size();
        windows.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
        return Math.max(0, before - windows.size());
    }

    private record AttemptWindow(long count, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
