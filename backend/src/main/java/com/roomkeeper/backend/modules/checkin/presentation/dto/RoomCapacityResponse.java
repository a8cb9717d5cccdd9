package com.roomkeeper.backend.modules.checkin.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import com.roomkeeper.backend.modules.checkin.domain.CapacityStatus;

public record RoomCapacityResponse(
        UUID locationId,
        String locationName,
        LocalDate occurrenceDate,
        long currentCount,
        Integer softCapacity,
        Integer hardCapacity,
        CapacityStatus status,
        int percentageFull,
        boolean canAcceptCheckin,
        UUID overflowLocationId,
        String overflowLocationName
) {
}
