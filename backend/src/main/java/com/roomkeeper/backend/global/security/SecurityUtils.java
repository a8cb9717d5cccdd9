package com.roomkeeper.backend.global.security;

import java.util.Optional;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.server.ResponseStatusException;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        return findCurrentPrincipal()
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED"));
    }

    public static Optional<JwtAuthenticationPrincipal> findCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal)) {
            return Optional.empty();
        }
        return Optional.of(principal);
    }

    /**
     * Acting staff member for audit rows; empty outside a request (schedulers, tests without a principal).
     */
    public static Optional<UUID> findCurrentStaffId() {
        return findCurrentPrincipal().map(JwtAuthenticationPrincipal::staffPersonId);
    }

    public static boolean hasRole(String roleCode) {
        return findCurrentPrincipal().map(principal -> principal.hasRole(roleCode)).orElse(false);
    }
}
