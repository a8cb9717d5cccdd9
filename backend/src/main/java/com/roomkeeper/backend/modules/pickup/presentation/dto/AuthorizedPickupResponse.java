package com.roomkeeper.backend.modules.pickup.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.roomkeeper.backend.modules.pickup.domain.AuthorizationLevel;
import com.roomkeeper.backend.modules.pickup.domain.PickupRelationship;

public record AuthorizedPickupResponse(
        UUID id,
        UUID childId,
        UUID authorizedPersonId,
        String displayName,
        String phoneNumber,
        PickupRelationship relationship,
        AuthorizationLevel authorizationLevel,
        String custodyNotes,
        boolean active,
        OffsetDateTime updatedAt
) {
}
