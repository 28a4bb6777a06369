package com.travelbooking.reconciliation.notification;

public enum NotificationType {
    PAYMENT_CONFIRMED,
    PAYMENT_FAILED,
    BOOKING_AWAITING_PAYMENT
}
