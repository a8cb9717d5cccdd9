package com.roomkeeper.backend.modules.checkin.application;

import java.util.UUID;

import com.roomkeeper.backend.global.error.RetryableProblemException;

import org.springframework.http.HttpStatus;

/**
 * The location lock could not be acquired in time. Transient; not a refusal of the check-in.
 */
public class LocationBusyException extends RetryableProblemException {

    public LocationBusyException(UUID locationId, long retryAfterSeconds, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "LOCATION_BUSY",
                "Location " + locationId + " is busy, retry shortly", retryAfterSeconds, cause);
    }
}
