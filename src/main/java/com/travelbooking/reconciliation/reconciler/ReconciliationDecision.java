package com.travelbooking.reconciliation.reconciler;

import com.travelbooking.reconciliation.entity.BookingStatus;
import com.travelbooking.reconciliation.entity.PaymentStatus;
import com.travelbooking.reconciliation.notification.NotificationEvent;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Output of {@link PaymentReconciler#reconcile}. Describes the target state; applying it
 * and dispatching the events is the caller's job.
 */
@Value
@Builder
public class ReconciliationDecision {

    PaymentStatus previousPaymentStatus;
    BookingStatus previousBookingStatus;
    PaymentStatus newPaymentStatus;
    BookingStatus newBookingStatus;

    /**
     * Reason to record on the payment. Only set for {@link ReconciliationOutcome#FAILED}.
     */
    String failureReason;

    ReconciliationOutcome outcome;

    @Singular("event")
    List<NotificationEvent> events;

    @Singular("anomaly")
    List<ReconciliationAnomaly> anomalies;

    public boolean isPaymentStatusChanged() {
        return newPaymentStatus != previousPaymentStatus;
    }

    public boolean isBookingStatusChanged() {
        return newBookingStatus != previousBookingStatus;
    }

    public boolean isStateChanged() {
        return isPaymentStatusChanged() || isBookingStatusChanged();
    }

    public boolean isFirstSettlement() {
        return outcome == ReconciliationOutcome.SETTLED;
    }

    public boolean hasAnomalies() {
        return !anomalies.isEmpty();
    }
}
