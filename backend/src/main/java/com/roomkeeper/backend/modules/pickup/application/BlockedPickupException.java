package com.roomkeeper.backend.modules.pickup.application;

import com.roomkeeper.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * The pickup person is on the child's NEVER list. No override can release the child to them.
 */
public class BlockedPickupException extends ProblemException {

    public BlockedPickupException(String detail) {
        super(HttpStatus.CONFLICT, "PICKUP_BLOCKED", detail);
    }
}
