package com.roomkeeper.backend.modules.pickup.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Either {@code pickupPersonId} or {@code pickupPersonName} identifies who is at the door.
 */
public record VerifyPickupRequest(
        @NotBlank String attendanceId,
        String pickupPersonId,
        @Size(max = 200) String pickupPersonName,
        @Size(max = 16) String securityCode
) {
}
