package com.travelbooking.reconciliation.exception;

/**
 * Operation conflicts with the current state of a payment or booking,
 * e.g. paying for a cancelled booking or starting a second verification run.
 */
public class StateConflictException extends ReconciliationException {

    public StateConflictException(String message) {
        super(message);
    }
}
