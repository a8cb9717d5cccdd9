package com.roomkeeper.backend.modules.checkin.presentation.dto;

import com.roomkeeper.backend.modules.checkin.domain.CheckinFailureReason;

public record CheckinValidationResponse(
        boolean allowed,
        CheckinFailureReason failureReason,
        String message
) {
}
