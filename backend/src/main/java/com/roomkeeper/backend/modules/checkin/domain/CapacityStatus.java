package com.roomkeeper.backend.modules.checkin.domain;

public enum CapacityStatus {
    AVAILABLE,
    NEAR_CAPACITY,
    AT_SOFT_CAPACITY,
    FULL
}
