package com.travelbooking.reconciliation.entity;

/**
 * Reservation status of a booking.
 */
public enum BookingStatus {
    PENDING,
    CONFIRMED,
    CANCELLED,
    COMPLETED
}
