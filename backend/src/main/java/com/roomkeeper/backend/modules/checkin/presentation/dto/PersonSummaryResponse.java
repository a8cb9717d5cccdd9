package com.roomkeeper.backend.modules.checkin.presentation.dto;

import java.util.UUID;

public record PersonSummaryResponse(
        UUID id,
        String fullName,
        String firstName,
        String lastName,
        Integer age
) {
}
