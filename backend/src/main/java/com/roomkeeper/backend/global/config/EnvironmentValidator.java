package com.roomkeeper.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or obviously unsafe.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String PLACEHOLDER_SECRET = "change-me-roomkeeper-dev-secret-0123456789abcdef";

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "app.pickup.rate-limit.max-attempts",
            "app.pickup.rate-limit.window-minutes"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(key + ": missing");
            }
        }

        String jwtSecret = environment.getProperty("jwt.secret", "");
        if (jwtSecret.length() < 32) {
            problems.add("jwt.secret: must be at least 32 characters for HS256");
        }

        String[] profiles = environment.getActiveProfiles();
        boolean productionLike = profiles.length > 0 && List.of(profiles).contains("prod");
        if (productionLike && PLACEHOLDER_SECRET.equals(jwtSecret)) {
            problems.add("jwt.secret: replace the development placeholder");
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Configuration validation failed: " + String.join("; ", problems));
        }

        log.info("Configuration validated");
    }
}
