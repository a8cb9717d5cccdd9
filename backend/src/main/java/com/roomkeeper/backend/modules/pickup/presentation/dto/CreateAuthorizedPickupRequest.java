package com.roomkeeper.backend.modules.pickup.presentation.dto;

import com.roomkeeper.backend.modules.pickup.domain.AuthorizationLevel;
import com.roomkeeper.backend.modules.pickup.domain.PickupRelationship;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Links a directory person by {@code authorizedPersonId}, or records a free-text {@code name}.
 */
public record CreateAuthorizedPickupRequest(
        String authorizedPersonId,
        @Size(max = 200) String name,
        @Size(max = 40) String phoneNumber,
        @NotNull PickupRelationship relationship,
        @NotNull AuthorizationLevel authorizationLevel,
        @Size(max = 1000) String custodyNotes
) {
}
