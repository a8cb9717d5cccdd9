package com.roomkeeper.backend.modules.checkin.presentation.dto;

public record CheckoutResponse(boolean checkedOut) {
}
