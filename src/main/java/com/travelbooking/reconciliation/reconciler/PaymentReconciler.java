package com.travelbooking.reconciliation.reconciler;

import com.travelbooking.reconciliation.dto.GatewayVerificationResult;
import com.travelbooking.reconciliation.entity.BookingStatus;
import com.travelbooking.reconciliation.entity.PaymentStatus;
import com.travelbooking.reconciliation.notification.NotificationEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Decides how a payment and its booking move in response to a gateway verification.
 * <p>
 * Pure and stateless: no persistence, no dispatch, no clock. Safe to call from any thread.
 * Rules, in order:
 * <ol>
 *   <li>A verified amount that differs from the recorded one is an AMOUNT_MISMATCH anomaly;
 *       the transition still proceeds.</li>
 *   <li>COMPLETED and REFUNDED payments never move. A repeated success is a duplicate
 *       settlement and emits nothing.</li>
 *   <li>First success: payment COMPLETED, booking CONFIRMED (a cancelled booking stays
 *       cancelled and is flagged), PAYMENT_CONFIRMED emitted.</li>
 *   <li>First failure: payment FAILED, booking untouched, PAYMENT_FAILED emitted.</li>
 *   <li>Anything else: payment takes the mapped status silently.</li>
 * </ol>
 */
@Component
@RequiredArgsConstructor
public class PaymentReconciler {

    static final String DEFAULT_FAILURE_REASON = "Payment was declined or cancelled";

    private final GatewayStatusMapper statusMapper;

    public ReconciliationDecision reconcile(PaymentSnapshot current, GatewayVerificationResult verification) {
        PaymentStatus candidate = statusMapper.map(verification.getRawStatus());
        PaymentStatus paymentStatus = current.getPaymentStatus();
        BookingStatus bookingStatus = current.getBookingStatus();

        ReconciliationDecision.ReconciliationDecisionBuilder decision = ReconciliationDecision.builder()
                .previousPaymentStatus(paymentStatus)
                .previousBookingStatus(bookingStatus)
                .newPaymentStatus(paymentStatus)
                .newBookingStatus(bookingStatus);

        if (isAmountMismatch(current.getRecordedAmount(), verification.getAmount())) {
            decision.anomaly(ReconciliationAnomaly.amountMismatch(
                    current.getPaymentId(), current.getRecordedAmount(), verification.getAmount()));
        }

        if (paymentStatus == PaymentStatus.COMPLETED || paymentStatus == PaymentStatus.REFUNDED) {
            boolean replayedSuccess = paymentStatus == PaymentStatus.COMPLETED
                    && candidate == PaymentStatus.COMPLETED;
            return decision
                    .outcome(replayedSuccess
                            ? ReconciliationOutcome.DUPLICATE_SETTLEMENT
                            : ReconciliationOutcome.UNCHANGED)
                    .build();
        }

        if (candidate == PaymentStatus.COMPLETED) {
            decision.newPaymentStatus(PaymentStatus.COMPLETED)
                    .outcome(ReconciliationOutcome.SETTLED)
                    .event(NotificationEvent.paymentConfirmed(current.getPaymentId(), current.getBookingId()));

            if (bookingStatus == BookingStatus.CANCELLED) {
                decision.anomaly(ReconciliationAnomaly.staleBookingState(
                        current.getPaymentId(), current.getBookingId(), bookingStatus));
            } else {
                decision.newBookingStatus(BookingStatus.CONFIRMED);
            }
            return decision.build();
        }

        if (candidate == PaymentStatus.FAILED && paymentStatus != PaymentStatus.FAILED) {
            String reason = failureReasonOf(verification);
            return decision
                    .newPaymentStatus(PaymentStatus.FAILED)
                    .failureReason(reason)
                    .outcome(ReconciliationOutcome.FAILED)
                    .event(NotificationEvent.paymentFailed(current.getPaymentId(), current.getBookingId(), reason))
                    .build();
        }

        return decision
                .newPaymentStatus(candidate)
                .outcome(candidate == paymentStatus
                        ? ReconciliationOutcome.UNCHANGED
                        : ReconciliationOutcome.STATUS_UPDATED)
                .build();
    }

    private boolean isAmountMismatch(BigDecimal recorded, BigDecimal verified) {
        // no amount from the gateway means no check, not a mismatch
        if (recorded == null || verified == null) {
            return false;
        }
        return recorded.compareTo(verified) != 0;
    }

    private String failureReasonOf(GatewayVerificationResult verification) {
        String reason = verification.getFailureReason();
        return reason == null || reason.isBlank() ? DEFAULT_FAILURE_REASON : reason;
    }
}
