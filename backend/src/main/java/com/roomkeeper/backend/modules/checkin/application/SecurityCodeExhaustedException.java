package com.roomkeeper.backend.modules.checkin.application;

import java.time.LocalDate;

import com.roomkeeper.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class SecurityCodeExhaustedException extends ProblemException {

    public SecurityCodeExhaustedException(LocalDate issueDate, String reason) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "SECURITY_CODE_EXHAUSTED",
                "No unused security code for " + issueDate + ": " + reason);
    }
}
