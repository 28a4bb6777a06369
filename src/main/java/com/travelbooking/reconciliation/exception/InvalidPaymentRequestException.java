package com.travelbooking.reconciliation.exception;

/**
 * Request is well-formed but cannot be honoured as given (amount mismatch, no tx_ref to verify).
 */
public class InvalidPaymentRequestException extends ReconciliationException {

    public InvalidPaymentRequestException(String message) {
        super(message);
    }
}
