package com.travelbooking.reconciliation.reconciler;

import com.travelbooking.reconciliation.entity.BookingStatus;
import com.travelbooking.reconciliation.entity.Payment;
import com.travelbooking.reconciliation.entity.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * The slice of payment and booking state the reconciler decides on.
 */
@Value
@Builder
public class PaymentSnapshot {

    Long paymentId;
    Long bookingId;
    PaymentStatus paymentStatus;
    BookingStatus bookingStatus;
    BigDecimal recordedAmount;

    public static PaymentSnapshot of(Payment payment) {
        return PaymentSnapshot.builder()
                .paymentId(payment.getId())
                .bookingId(payment.getBooking().getId())
                .paymentStatus(payment.getStatus())
                .bookingStatus(payment.getBooking().getStatus())
                .recordedAmount(payment.getAmount())
                .build();
    }
}
