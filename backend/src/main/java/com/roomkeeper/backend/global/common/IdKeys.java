package com.roomkeeper.backend.global.common;

import java.util.Optional;
import java.util.UUID;

import org.springframework.util.StringUtils;

/**
 * Decodes external identifier strings into internal keys.
 * Blank or malformed input yields {@link Optional#empty()} instead of an exception.
 */
public final class IdKeys {

    private IdKeys() {
    }

    public static Optional<UUID> parse(String raw) {
        if (!StringUtils.hasText(raw)) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        // UUID.fromString accepts short segments like "1-2-3-4-5"
        if (trimmed.length() != 36) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(trimmed));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    public static String format(UUID id) {
        return id == null ? null : id.toString();
    }
}
