package com.travelbooking.reconciliation.exception;

/**
 * Base exception for payment reconciliation errors.
 */
public class ReconciliationException extends RuntimeException {

    public ReconciliationException(String message) {
        super(message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
