package com.roomkeeper.backend.modules.checkin.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.roomkeeper.backend.modules.checkin.domain.CheckinFailureReason;

public record CheckinResultResponse(
        boolean success,
        CheckinFailureReason failureReason,
        String message,
        UUID attendanceId,
        String securityCode,
        OffsetDateTime checkInTime,
        PersonSummaryResponse person,
        LocationSummaryResponse location,
        boolean firstTime,
        boolean capacityWarning
) {

    public static CheckinResultResponse refused(CheckinFailureReason reason, String message) {
        return new CheckinResultResponse(false, reason, message, null, null, null, null, null, false, false);
    }
}
