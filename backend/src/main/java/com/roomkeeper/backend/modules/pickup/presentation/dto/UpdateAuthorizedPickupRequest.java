package com.roomkeeper.backend.modules.pickup.presentation.dto;

import com.roomkeeper.backend.modules.pickup.domain.AuthorizationLevel;
import com.roomkeeper.backend.modules.pickup.domain.PickupRelationship;

import jakarta.validation.constraints.Size;

/**
 * Null fields are left unchanged.
 */
public record UpdateAuthorizedPickupRequest(
        @Size(max = 40) String phoneNumber,
        PickupRelationship relationship,
        AuthorizationLevel authorizationLevel,
        @Size(max = 1000) String custodyNotes,
        Boolean active
) {
}
