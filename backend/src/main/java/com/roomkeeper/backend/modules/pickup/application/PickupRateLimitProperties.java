package com.roomkeeper.backend.modules.pickup.application;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * {@code app.pickup.rate-limit.*} settings for failed pickup verifications.
 */
@ConfigurationProperties(prefix = "app.pickup.rate-limit")
public record PickupRateLimitProperties(
        @DefaultValue("5") int maxAttempts,
        @DefaultValue("15") int windowMinutes,
        @DefaultValue("memory") Store store,
        @DefaultValue("PT5M") Duration purgeInterval
) {

    public PickupRateLimitProperties {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("app.pickup.rate-limit.max-attempts must be at least 1");
        }
        if (windowMinutes < 1) {
            throw new IllegalArgumentException("app.pickup.rate-limit.window-minutes must be at least 1");
        }
    }

    public Duration window() {
        return Duration.ofMinutes(windowMinutes);
    }

    public enum Store {
        MEMORY,
        REDIS
    }
}
