package com.roomkeeper.backend.modules.pickup.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record PickupLogResponse(
        UUID id,
        UUID attendanceId,
        UUID childId,
        String childName,
        UUID pickupPersonId,
        String pickupPersonName,
        boolean wasAuthorized,
        UUID authorizedPickupId,
        boolean supervisorOverride,
        UUID supervisorPersonId,
        OffsetDateTime checkoutTime,
        String notes
) {
}
