package com.travelbooking.reconciliation.reconciler;

import com.travelbooking.reconciliation.dto.GatewayVerificationResult;
import com.travelbooking.reconciliation.entity.BookingStatus;
import com.travelbooking.reconciliation.entity.PaymentStatus;
import com.travelbooking.reconciliation.notification.NotificationEvent;
import com.travelbooking.reconciliation.notification.NotificationType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for PaymentReconciler. No Spring context, database or HTTP involved.
 */
class PaymentReconcilerTest {

    private static final Long PAYMENT_ID = 7L;
    private static final Long BOOKING_ID = 42L;
    private static final BigDecimal AMOUNT = new BigDecimal("450.00");

    private final PaymentReconciler reconciler = new PaymentReconciler(new GatewayStatusMapper());

    @Nested
    @DisplayName("Settlement")
    class Settlement {

        @Test
        @DisplayName("Should settle a pending payment and confirm the booking")
        void shouldSettlePendingPayment() {
            // Given
            PaymentSnapshot current = snapshot(PaymentStatus.PENDING, BookingStatus.PENDING);

            // When
            ReconciliationDecision decision = reconciler.reconcile(current, verification("success", "450.00"));

            // Then
            assertThat(decision.getNewPaymentStatus()).isEqualTo(PaymentStatus.COMPLETED);
            assertThat(decision.getNewBookingStatus()).isEqualTo(BookingStatus.CONFIRMED);
            assertThat(decision.getOutcome()).isEqualTo(ReconciliationOutcome.SETTLED);
            assertThat(decision.getEvents()).containsExactly(NotificationEvent.paymentConfirmed(PAYMENT_ID, BOOKING_ID));
            assertThat(decision.getAnomalies()).isEmpty();
            assertThat(decision.isFirstSettlement()).isTrue();
        }

        @ParameterizedTest
        @EnumSource(value = PaymentStatus.class, names = {"PENDING", "PROCESSING", "FAILED", "CANCELLED"})
        @DisplayName("Should settle from any non-terminal status, including a late success after failure")
        void shouldSettleFromNonTerminalStatus(PaymentStatus status) {
            ReconciliationDecision decision = reconciler.reconcile(
                    snapshot(status, BookingStatus.PENDING), verification("success", "450.00"));

            assertThat(decision.getOutcome()).isEqualTo(ReconciliationOutcome.SETTLED);
            assertThat(decision.getNewPaymentStatus()).isEqualTo(PaymentStatus.COMPLETED);
            assertThat(decision.getEvents()).extracting(NotificationEvent::getType)
                    .containsExactly(NotificationType.PAYMENT_CONFIRMED);
        }

        @Test
        @DisplayName("Should keep a cancelled booking cancelled and flag it when payment settles")
        void shouldNotResurrectCancelledBooking() {
            // Given
            PaymentSnapshot current = snapshot(PaymentStatus.PROCESSING, BookingStatus.CANCELLED);

            // When
            ReconciliationDecision decision = reconciler.reconcile(current, verification("success", "450.00"));

            // Then
            assertThat(decision.getNewPaymentStatus()).isEqualTo(PaymentStatus.COMPLETED);
            assertThat(decision.getNewBookingStatus()).isEqualTo(BookingStatus.CANCELLED);
            assertThat(decision.isBookingStatusChanged()).isFalse();
            assertThat(decision.getOutcome()).isEqualTo(ReconciliationOutcome.SETTLED);
            assertThat(decision.getAnomalies()).extracting(ReconciliationAnomaly::getType)
                    .containsExactly(ReconciliationAnomaly.Type.STALE_BOOKING_STATE);
        }

        @Test
        @DisplayName("Should settle despite an amount mismatch but report it")
        void shouldReportAmountMismatch() {
            ReconciliationDecision decision = reconciler.reconcile(
                    snapshot(PaymentStatus.PROCESSING, BookingStatus.PENDING), verification("success", "400.00"));

            assertThat(decision.getOutcome()).isEqualTo(ReconciliationOutcome.SETTLED);
            assertThat(decision.getAnomalies()).hasSize(1);
            assertThat(decision.getAnomalies().get(0).getType()).isEqualTo(ReconciliationAnomaly.Type.AMOUNT_MISMATCH);
            assertThat(decision.getAnomalies().get(0).getMessage()).contains("400.00").contains("450.00");
        }

        @Test
        @DisplayName("Should treat equal amounts with different scale as matching")
        void shouldCompareAmountsByValue() {
            ReconciliationDecision decision = reconciler.reconcile(
                    snapshot(PaymentStatus.PROCESSING, BookingStatus.PENDING), verification("success", "450"));

            assertThat(decision.getAnomalies()).isEmpty();
        }

        @Test
        @DisplayName("Should skip the amount check when the gateway omits the amount")
        void shouldSkipAmountCheckWhenMissing() {
            ReconciliationDecision decision = reconciler.reconcile(
                    snapshot(PaymentStatus.PROCESSING, BookingStatus.PENDING), verification("success", null));

            assertThat(decision.getOutcome()).isEqualTo(ReconciliationOutcome.SETTLED);
            assertThat(decision.getAnomalies()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Idempotence and monotonic settlement")
    class Idempotence {

        @Test
        @DisplayName("Should ignore a replayed success for a completed payment")
        void shouldIgnoreReplayedSuccess() {
            // Given
            PaymentSnapshot current = snapshot(PaymentStatus.COMPLETED, BookingStatus.CONFIRMED);

            // When
            ReconciliationDecision decision = reconciler.reconcile(current, verification("success", "450.00"));

            // Then
            assertThat(decision.getOutcome()).isEqualTo(ReconciliationOutcome.DUPLICATE_SETTLEMENT);
            assertThat(decision.getNewPaymentStatus()).isEqualTo(PaymentStatus.COMPLETED);
            assertThat(decision.getNewBookingStatus()).isEqualTo(BookingStatus.CONFIRMED);
            assertThat(decision.getEvents()).isEmpty();
            assertThat(decision.isStateChanged()).isFalse();
            assertThat(decision.isFirstSettlement()).isFalse();
        }

        @ParameterizedTest
        @ValueSource(strings = {"failed", "pending", "cancelled", "reversed"})
        @DisplayName("Should never move a completed payment")
        void shouldNeverLeaveCompleted(String rawStatus) {
            ReconciliationDecision decision = reconciler.reconcile(
                    snapshot(PaymentStatus.COMPLETED, BookingStatus.CONFIRMED), verification(rawStatus, "450.00"));

            assertThat(decision.getNewPaymentStatus()).isEqualTo(PaymentStatus.COMPLETED);
            assertThat(decision.getOutcome()).isEqualTo(ReconciliationOutcome.UNCHANGED);
            assertThat(decision.getEvents()).isEmpty();
        }

        @ParameterizedTest(name = "refunded + {0}")
        @ValueSource(strings = {"success", "failed", "cancelled", "pending"})
        @DisplayName("Should leave a refunded payment alone whatever the gateway reports")
        void shouldLeaveRefundedAlone(String rawStatus) {
            ReconciliationDecision decision = reconciler.reconcile(
                    snapshot(PaymentStatus.REFUNDED, BookingStatus.CANCELLED), verification(rawStatus, "450.00"));

            assertThat(decision.getNewPaymentStatus()).isEqualTo(PaymentStatus.REFUNDED);
            assertThat(decision.getOutcome()).isEqualTo(ReconciliationOutcome.UNCHANGED);
            assertThat(decision.getEvents()).isEmpty();
        }

        @Test
        @DisplayName("Should produce the same decision when applied to its own result")
        void shouldBeIdempotentOnRepeatedApplication() {
            GatewayVerificationResult success = verification("success", "450.00");
            ReconciliationDecision first = reconciler.reconcile(
                    snapshot(PaymentStatus.PROCESSING, BookingStatus.PENDING), success);

            ReconciliationDecision second = reconciler.reconcile(
                    snapshot(first.getNewPaymentStatus(), first.getNewBookingStatus()), success);

            assertThat(second.getNewPaymentStatus()).isEqualTo(first.getNewPaymentStatus());
            assertThat(second.getNewBookingStatus()).isEqualTo(first.getNewBookingStatus());
            assertThat(second.getEvents()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Failure")
    class Failure {

        @Test
        @DisplayName("Should fail a processing payment with the gateway reason")
        void shouldFailWithGatewayReason() {
            // Given
            GatewayVerificationResult result = verification("failed", "450.00");
            result.setFailureReason("card_declined");

            // When
            ReconciliationDecision decision = reconciler.reconcile(
                    snapshot(PaymentStatus.PROCESSING, BookingStatus.PENDING), result);

            // Then
            assertThat(decision.getNewPaymentStatus()).isEqualTo(PaymentStatus.FAILED);
            assertThat(decision.getNewBookingStatus()).isEqualTo(BookingStatus.PENDING);
            assertThat(decision.getOutcome()).isEqualTo(ReconciliationOutcome.FAILED);
            assertThat(decision.getFailureReason()).isEqualTo("card_declined");
            assertThat(decision.getEvents())
                    .containsExactly(NotificationEvent.paymentFailed(PAYMENT_ID, BOOKING_ID, "card_declined"));
        }

        @Test
        @DisplayName("Should use the default reason when the gateway gives none")
        void shouldUseDefaultReason() {
            ReconciliationDecision decision = reconciler.reconcile(
                    snapshot(PaymentStatus.PROCESSING, BookingStatus.PENDING), verification("failed", "450.00"));

            assertThat(decision.getFailureReason()).isEqualTo(PaymentReconciler.DEFAULT_FAILURE_REASON);
        }

        @Test
        @DisplayName("Should fail a payment on an unknown gateway status and never confirm the booking")
        void shouldFailOnUnknownStatus() {
            ReconciliationDecision decision = reconciler.reconcile(
                    snapshot(PaymentStatus.PROCESSING, BookingStatus.PENDING), verification("reversed", "450.00"));

            assertThat(decision.getNewPaymentStatus()).isEqualTo(PaymentStatus.FAILED);
            assertThat(decision.getNewBookingStatus()).isEqualTo(BookingStatus.PENDING);
            assertThat(decision.getEvents()).extracting(NotificationEvent::getType)
                    .containsExactly(NotificationType.PAYMENT_FAILED);
        }

        @Test
        @DisplayName("Should not notify twice for an already failed payment")
        void shouldNotRepeatFailure() {
            ReconciliationDecision decision = reconciler.reconcile(
                    snapshot(PaymentStatus.FAILED, BookingStatus.PENDING), verification("failed", "450.00"));

            assertThat(decision.getOutcome()).isEqualTo(ReconciliationOutcome.UNCHANGED);
            assertThat(decision.getEvents()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Intermediate statuses")
    class Intermediate {

        @Test
        @DisplayName("Should move a pending payment to processing without events")
        void shouldMoveToProcessing() {
            ReconciliationDecision decision = reconciler.reconcile(
                    snapshot(PaymentStatus.PENDING, BookingStatus.PENDING), verification("pending", "450.00"));

            assertThat(decision.getNewPaymentStatus()).isEqualTo(PaymentStatus.PROCESSING);
            assertThat(decision.getOutcome()).isEqualTo(ReconciliationOutcome.STATUS_UPDATED);
            assertThat(decision.getEvents()).isEmpty();
        }

        @Test
        @DisplayName("Should report no change when the gateway still says pending")
        void shouldStayProcessing() {
            ReconciliationDecision decision = reconciler.reconcile(
                    snapshot(PaymentStatus.PROCESSING, BookingStatus.PENDING), verification("pending", "450.00"));

            assertThat(decision.getOutcome()).isEqualTo(ReconciliationOutcome.UNCHANGED);
            assertThat(decision.isStateChanged()).isFalse();
        }

        @Test
        @DisplayName("Should record a gateway cancellation without events")
        void shouldCancelWithoutEvents() {
            ReconciliationDecision decision = reconciler.reconcile(
                    snapshot(PaymentStatus.PROCESSING, BookingStatus.PENDING), verification("cancelled", "450.00"));

            assertThat(decision.getNewPaymentStatus()).isEqualTo(PaymentStatus.CANCELLED);
            assertThat(decision.getNewBookingStatus()).isEqualTo(BookingStatus.PENDING);
            assertThat(decision.getEvents()).isEmpty();
        }
    }

    private static PaymentSnapshot snapshot(PaymentStatus paymentStatus, BookingStatus bookingStatus) {
        return PaymentSnapshot.builder()
                .paymentId(PAYMENT_ID)
                .bookingId(BOOKING_ID)
                .paymentStatus(paymentStatus)
                .bookingStatus(bookingStatus)
                .recordedAmount(AMOUNT)
                .build();
    }

    private static GatewayVerificationResult verification(String rawStatus, String amount) {
        return GatewayVerificationResult.builder()
                .txRef("ALX-42-0A1B2C3D")
                .rawStatus(rawStatus)
                .amount(amount != null ? new BigDecimal(amount) : null)
                .currency("ETB")
                .build();
    }
}
