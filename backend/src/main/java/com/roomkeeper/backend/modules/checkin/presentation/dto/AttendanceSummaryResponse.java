package com.roomkeeper.backend.modules.checkin.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

public record AttendanceSummaryResponse(
        UUID attendanceId,
        PersonSummaryResponse person,
        UUID locationId,
        String locationName,
        LocalDate occurrenceDate,
        OffsetDateTime startTime,
        OffsetDateTime endTime,
        String securityCode,
        boolean firstTime,
        String note
) {
}
