package com.travelbooking.reconciliation.exception;

public class PaymentNotFoundException extends ReconciliationException {

    public PaymentNotFoundException(Long paymentId) {
        super("Payment not found: " + paymentId);
    }

    public PaymentNotFoundException(String txRef) {
        super("Payment not found for tx_ref: " + txRef);
    }
}
