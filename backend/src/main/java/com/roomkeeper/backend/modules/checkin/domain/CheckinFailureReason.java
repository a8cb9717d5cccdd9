package com.roomkeeper.backend.modules.checkin.domain;

public enum CheckinFailureReason {
    INVALID_PERSON_ID,
    INVALID_LOCATION_OR_SCHEDULE_ID,
    PERSON_DECEASED,
    PERSON_INACTIVE,
    LOCATION_INACTIVE,
    OUTSIDE_SCHEDULE_WINDOW,
    ALREADY_CHECKED_IN,
    AT_CAPACITY
}
