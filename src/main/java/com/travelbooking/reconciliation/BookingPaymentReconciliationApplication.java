package com.travelbooking.reconciliation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Booking Payment Reconciliation Service
 * <p>
 * Keeps travel bookings and their Chapa payments in agreement. Every gateway
 * verification, whether manual, webhook or scheduled, is reconciled into payment
 * and booking state, and guests are notified of the result.
 */
@SpringBootApplication
@EnableScheduling
@EnableRetry
public class BookingPaymentReconciliationApplication {

    public static void main(String[] args) {
        SpringApplication.run(BookingPaymentReconciliationApplication.class, args);
    }
}
