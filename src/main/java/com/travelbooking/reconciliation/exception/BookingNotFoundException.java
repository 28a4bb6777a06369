package com.travelbooking.reconciliation.exception;

public class BookingNotFoundException extends ReconciliationException {

    public BookingNotFoundException(Long bookingId) {
        super("Booking not found: " + bookingId);
    }
}
