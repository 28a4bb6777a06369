package com.travelbooking.reconciliation.notification;

import lombok.Value;

/**
 * Something a guest should hear about. Emitted by state transitions, never stored.
 */
@Value
public class NotificationEvent {

    NotificationType type;
    Long paymentId;
    Long bookingId;

    /**
     * Failure reason, only present on PAYMENT_FAILED.
     */
    String reason;

    public static NotificationEvent paymentConfirmed(Long paymentId, Long bookingId) {
        return new NotificationEvent(NotificationType.PAYMENT_CONFIRMED, paymentId, bookingId, null);
    }

    public static NotificationEvent paymentFailed(Long paymentId, Long bookingId, String reason) {
        return new NotificationEvent(NotificationType.PAYMENT_FAILED, paymentId, bookingId, reason);
    }

    public static NotificationEvent bookingAwaitingPayment(Long bookingId, Long paymentId) {
        return new NotificationEvent(NotificationType.BOOKING_AWAITING_PAYMENT, paymentId, bookingId, null);
    }
}
