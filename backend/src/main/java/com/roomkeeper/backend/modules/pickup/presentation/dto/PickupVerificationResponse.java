package com.roomkeeper.backend.modules.pickup.presentation.dto;

import java.util.UUID;

import com.roomkeeper.backend.modules.pickup.domain.AuthorizationLevel;

public record PickupVerificationResponse(
        boolean authorized,
        AuthorizationLevel authorizationLevel,
        UUID authorizedPickupId,
        boolean requiresSupervisorOverride,
        String message
) {

    public static PickupVerificationResponse denied(String message) {
        return new PickupVerificationResponse(false, null, null, false, message);
    }
}
