package com.roomkeeper.backend.modules.checkin.application;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * {@code app.checkin.*} settings.
 *
 * @param lockTimeout            how long a check-in waits for another check-in to the same location
 * @param busyRetryAfter         retry hint returned when that wait times out
 * @param enforceScheduleWindow  refuse same-day check-ins outside the schedule's weekly window
 */
@ConfigurationProperties(prefix = "app.checkin")
public record CheckinProperties(
        @DefaultValue("PT5S") Duration lockTimeout,
        @DefaultValue("PT2S") Duration busyRetryAfter,
        @DefaultValue("true") boolean enforceScheduleWindow,
        @DefaultValue SecurityCodeSettings securityCode,
        @DefaultValue CapacitySettings capacity
) {

    public record SecurityCodeSettings(@DefaultValue("10") int maxAttempts) {
    }

    public record CapacitySettings(@DefaultValue("80") int warningThresholdPercent) {
    }
}
