package com.roomkeeper.backend.global.security;

public final class StaffRoles {

    public static final String CHECKIN_VOLUNTEER = "CHECKIN_VOLUNTEER";
    public static final String SUPERVISOR = "SUPERVISOR";
    public static final String ADMIN = "ADMIN";

    private StaffRoles() {
    }
}
