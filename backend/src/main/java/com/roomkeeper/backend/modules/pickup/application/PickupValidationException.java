package com.roomkeeper.backend.modules.pickup.application;

import com.roomkeeper.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * The caller broke the record-pickup contract, e.g. an override without a supervisor.
 */
public class PickupValidationException extends ProblemException {

    public PickupValidationException(String code, String detail) {
        super(HttpStatus.BAD_REQUEST, code, detail);
    }
}
