package com.roomkeeper.backend.modules.pickup.presentation.dto;

public record AutoPopulateResponse(int created) {
}
