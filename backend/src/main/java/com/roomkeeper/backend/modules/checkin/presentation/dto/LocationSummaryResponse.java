package com.roomkeeper.backend.modules.checkin.presentation.dto;

import java.util.UUID;

public record LocationSummaryResponse(
        UUID id,
        String name,
        long currentCount,
        Integer softCapacity,
        Integer hardCapacity
) {
}
