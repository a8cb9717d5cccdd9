package com.roomkeeper.backend.modules.pickup.domain;

/**
 * Standing pickup policy for one (child, person) pair.
 */
public enum AuthorizationLevel {
    /** Released once the security code matches. */
    ALWAYS,
    /** Never released automatically; a supervisor must override. */
    EMERGENCY_ONLY,
    /** Hard block that no override can lift. */
    NEVER;

    /**
     * Constants are declared from least to most restrictive.
     */
    public static AuthorizationLevel mostRestrictive(AuthorizationLevel a, AuthorizationLevel b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
