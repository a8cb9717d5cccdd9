package com.roomkeeper.backend.modules.pickup.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RecordPickupRequest(
        @NotBlank String attendanceId,
        String pickupPersonId,
        @Size(max = 200) String pickupPersonName,
        boolean wasAuthorized,
        String authorizedPickupId,
        boolean supervisorOverride,
        String supervisorPersonId,
        @Size(max = 1000) String notes
) {
}
