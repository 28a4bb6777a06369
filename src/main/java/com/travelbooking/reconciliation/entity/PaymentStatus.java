package com.travelbooking.reconciliation.entity;

/**
 * Lifecycle status of a booking payment.
 */
public enum PaymentStatus {
    /**
     * Payment record created, gateway checkout not yet opened.
     */
    PENDING,

    /**
     * Checkout opened at the gateway, waiting for the guest to pay.
     * This is the state the verification sweep polls.
     */
    PROCESSING,

    /**
     * Gateway confirmed settlement. Terminal for reconciliation.
     */
    COMPLETED,

    /**
     * Gateway declined the payment, or reported a state we do not recognize.
     */
    FAILED,

    /**
     * Guest abandoned or cancelled the checkout.
     */
    CANCELLED,

    /**
     * Money returned after completion. Never set by reconciliation.
     */
    REFUNDED
}
