package com.roomkeeper.backend.modules.pickup.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class PickupAttemptPurgeScheduler {

    private static final Logger log = LoggerFactory.getLogger(PickupAttemptPurgeScheduler.class);

    private final PickupAttemptRateLimiter rateLimiter;

    public PickupAttemptPurgeScheduler(PickupAttemptRateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Scheduled(fixedDelayString = "${app.pickup.rate-limit.purge-interval:PT5M}")
    public void purgeExpiredWindows() {
        int purged = rateLimiter.purgeExpired();
        if (purged > 0) {
            log.debug("Purged {} expired pickup attempt windows", purged);
        }
    }
}
