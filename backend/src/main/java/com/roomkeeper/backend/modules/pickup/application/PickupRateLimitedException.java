package com.roomkeeper.backend.modules.pickup.application;

import com.roomkeeper.backend.global.error.RetryableProblemException;

import org.springframework.http.HttpStatus;

public class PickupRateLimitedException extends RetryableProblemException {

    public PickupRateLimitedException(long retryAfterSeconds) {
        super(HttpStatus.TOO_MANY_REQUESTS, "PICKUP_RATE_LIMITED",
                "Rate limit exceeded. Try again in " + retryAfterSeconds + " seconds.", retryAfterSeconds);
    }
}
