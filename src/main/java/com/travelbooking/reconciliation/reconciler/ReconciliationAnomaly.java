package com.travelbooking.reconciliation.reconciler;

import com.travelbooking.reconciliation.entity.BookingStatus;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Something an operator has to look at. Anomalies never block a transition;
 * the gateway stays authoritative over settlement.
 */
@Value
public class ReconciliationAnomaly {

    public enum Type {
        /**
         * Gateway settled a different amount than the one recorded for the payment.
         */
        AMOUNT_MISMATCH,

        /**
         * Payment settled for a booking that was already cancelled. Money moved but the
         * booking stays cancelled, so this needs manual follow-up (refund or rebook).
         */
        STALE_BOOKING_STATE
    }

    Type type;
    String message;

    public static ReconciliationAnomaly amountMismatch(Long paymentId, BigDecimal recorded, BigDecimal verified) {
        return new ReconciliationAnomaly(Type.AMOUNT_MISMATCH,
                String.format("Payment %d: gateway amount %s differs from recorded amount %s",
                        paymentId, verified.toPlainString(), recorded.toPlainString()));
    }

    public static ReconciliationAnomaly staleBookingState(Long paymentId, Long bookingId, BookingStatus bookingStatus) {
        return new ReconciliationAnomaly(Type.STALE_BOOKING_STATE,
                String.format("Payment %d completed but booking %d is %s; confirmation suppressed",
                        paymentId, bookingId, bookingStatus));
    }
}
