package com.roomkeeper.backend.modules.checkin.presentation.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

public record BatchCheckinRequest(
        @NotEmpty(message = "ITEMS_REQUIRED")
        @Size(max = 50, message = "TOO_MANY_ITEMS")
        List<@Valid CheckinRequest> items
) {
}
