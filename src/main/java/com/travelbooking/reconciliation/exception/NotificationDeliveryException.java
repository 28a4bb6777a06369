package com.travelbooking.reconciliation.exception;

/**
 * A notification channel failed to accept a message. Retried by the delivery service.
 */
public class NotificationDeliveryException extends ReconciliationException {

    public NotificationDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
