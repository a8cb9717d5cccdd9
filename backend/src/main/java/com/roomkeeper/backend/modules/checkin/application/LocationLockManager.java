package com.roomkeeper.backend.modules.checkin.application;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-location mutual exclusion for the "count occupants, compare, insert" section of a check-in.
 * Sections for the same location run one at a time; different locations never contend.
 * Knows nothing about capacity itself.
 */
@Component
public class LocationLockManager {

    private static final Logger log = LoggerFactory.getLogger(LocationLockManager.class);

    private final ConcurrentMap<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration lockTimeout;
    private final long busyRetryAfterSeconds;

    public LocationLockManager(CheckinProperties properties) {
        this.lockTimeout = properties.lockTimeout();
        this.busyRetryAfterSeconds = Math.max(1, properties.busyRetryAfter().toSeconds());
    }

    /**
     * Runs {@code criticalSection} while holding the lock for {@code locationId}.
     * Exceptions from the section propagate unchanged; nothing is retried.
     *
     * @throws LocationBusyException when the lock is not acquired within the configured timeout
     *                               or the waiting thread is interrupted
     */
    public <T> T executeWithLocationLock(UUID locationId, Supplier<T> criticalSection) {
        Objects.requireNonNull(locationId, "locationId");
        Objects.requireNonNull(criticalSection, "criticalSection");

        ReentrantLock lock = locks.computeIfAbsent(locationId, id -> new ReentrantLock(true));
        boolean acquired;
        try {
            acquired = lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new LocationBusyException(locationId, busyRetryAfterSeconds, ex);
        }
        if (!acquired) {
            log.warn("Timed out after {} waiting for location lock {} ({} waiting)",
                    lockTimeout, locationId, lock.getQueueLength());
            throw new LocationBusyException(locationId, busyRetryAfterSeconds, null);
        }
        try {
            return criticalSection.get();
        } finally {
            lock.unlock();
        }
    }
}
