package com.roomkeeper.backend.modules.pickup.application;

import java.time.Duration;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Throttles failed pickup verifications per (attendance, origin) pair. Knows nothing about codes:
 * callers reserve an attempt before verifying, then keep it as a failure, release it, or reset on success.
 */
@Component
public class PickupAttemptRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(PickupAttemptRateLimiter.class);
    private static final String KEY_PREFIX = "pickup-attempts:";

    private final PickupAttemptStore store;
    private final int maxAttempts;
    private final Duration window;

    public PickupAttemptRateLimiter(PickupAttemptStore store, PickupRateLimitProperties properties) {
        this.store = store;
        this.maxAttempts = properties.maxAttempts();
        this.window = properties.window();
    }

    public void recordFailedAttempt(String attendanceId, String originId) {
        long count = store.increment(key(attendanceId, originId), window);
        if (count == maxAttempts) {
            log.warn("Pickup verification limit reached for attendance {} from {} ({} failures)",
                    attendanceId, originId, count);
        }
    }

    /**
     * Counts an attempt before it is made, so concurrent attempts from one pair cannot pass the limit together.
     *
     * @return {@code false} when the pair is already limited; the refused attempt is not counted
     */
    public boolean tryReserveAttempt(String attendanceId, String originId) {
        String key = key(attendanceId, originId);
        long count = store.increment(key, window);
        if (count > maxAttempts) {
            store.decrement(key);
            return false;
        }
        if (count == maxAttempts) {
            log.warn("Pickup verification limit reached for attendance {} from {} ({} attempts)",
                    attendanceId, originId, count);
        }
        return true;
    }

    /**
     * Gives back a reserved attempt whose outcome does not count as a failure.
     */
    public void releaseAttempt(String attendanceId, String originId) {
        store.decrement(key(attendanceId, originId));
    }

    public boolean isRateLimited(String attendanceId, String originId) {
        return store.currentCount(key(attendanceId, originId)) >= maxAttempts;
    }

    /**
     * @return time until the pair may try again, empty when it is not limited
     */
    public Optional<Duration> getRetryAfter(String attendanceId, String originId) {
        if (!isRateLimited(attendanceId, originId)) {
            return Optional.empty();
        }
        return store.remainingWindow(key(attendanceId, originId))
                .map(remaining -> remaining.compareTo(window) > 0 ? window : remaining);
    }

    public void resetAttempts(String attendanceId, String originId) {
        store.clear(key(attendanceId, originId));
    }

    int purgeExpired() {
        return store.purgeExpired();
    }

    static String key(String attendanceId, String originId) {
        return KEY_PREFIX + attendanceId + ":" + originId;
    }
}
