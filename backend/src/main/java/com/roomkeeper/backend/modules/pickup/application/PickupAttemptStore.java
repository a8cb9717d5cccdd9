package com.roomkeeper.backend.modules.pickup.application;

import java.time.Duration;
import java.util.Optional;

/**
 * Counter storage for failed pickup verifications, one fixed window per key.
 */
public interface PickupAttemptStore {

    /**
     * Adds one failure, opening a new window of {@code window} length when none is active.
     *
     * @return failures counted in the active window, including this one
     */
    long increment(String key, Duration window);

    /**
     * Takes back one counted attempt in the active window. Never opens a window and never goes below zero.
     */
    void decrement(String key);

    /**
     * @return failures in the active window, 0 when the window has expired or never started
     */
    long currentCount(String key);

    /**
     * @return time until the active window closes, empty when there is none
     */
    Optional<Duration> remainingWindow(String key);

    void clear(String key);

    /**
     * Drops expired windows. Stores that expire keys on their own return 0.
     */
    default int purgeExpired() {
        return 0;
    }
}
