package com.roomkeeper.backend.global.security;

import java.util.List;
import java.util.UUID;

public record JwtAuthenticationPrincipal(UUID staffPersonId, String displayName, List<String> roles) {

    public boolean hasRole(String roleCode) {
        return roles != null && roles.contains(roleCode);
    }
}
