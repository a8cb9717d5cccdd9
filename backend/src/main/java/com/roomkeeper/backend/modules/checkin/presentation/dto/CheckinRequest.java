package com.roomkeeper.backend.modules.checkin.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.Size;

/**
 * Identifiers are accepted as strings; malformed ones become a refused result rather than a 400.
 * {@code occurrenceDate} defaults to today.
 */
public record CheckinRequest(
        String personId,
        String locationId,
        String scheduleId,
        LocalDate occurrenceDate,
        boolean generateSecurityCode,
        @Size(max = 500, message = "NOTE_TOO_LONG")
        String note
) {
}
