package com.travelbooking.reconciliation.service;

import com.travelbooking.reconciliation.config.ChapaProperties;
import com.travelbooking.reconciliation.dto.GatewayVerificationResult;
import com.travelbooking.reconciliation.dto.PaymentInitiationRequest;
import com.travelbooking.reconciliation.entity.Booking;
import com.travelbooking.reconciliation.entity.Payment;
import com.travelbooking.reconciliation.entity.PaymentStatus;
import com.travelbooking.reconciliation.exception.BookingNotFoundException;
import com.travelbooking.reconciliation.exception.InvalidPaymentRequestException;
import com.travelbooking.reconciliation.exception.PaymentNotFoundException;
import com.travelbooking.reconciliation.exception.StateConflictException;
import com.travelbooking.reconciliation.reconciler.PaymentReconciler;
import com.travelbooking.reconciliation.reconciler.PaymentSnapshot;
import com.travelbooking.reconciliation.reconciler.ReconciliationAnomaly;
import com.travelbooking.reconciliation.reconciler.ReconciliationDecision;
import com.travelbooking.reconciliation.repository.BookingRepository;
import com.travelbooking.reconciliation.repository.PaymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Transactional writes to payment and booking state.
 * <p>
 * Each method runs in its own transaction and takes a row lock before reading the
 * state it decides on. Callers do any gateway I/O before calling in here, so no
 * lock is ever held across a network call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentStateService {

    private static final String DEFAULT_CURRENCY = "ETB";
    private static final int MAX_ERROR_LENGTH = 500;

    private final PaymentRepository paymentRepository;
    private final BookingRepository bookingRepository;
    private final PaymentReconciler reconciler;
    private final ChapaProperties chapaProperties;

    /**
     * Creates the booking's payment in PENDING with a fresh tx_ref, or returns the existing
     * one if a previous initiation never reached the gateway.
     *
     * @throws BookingNotFoundException       if the booking does not exist
     * @throws StateConflictException         if the booking cannot take a payment or already has one
     * @throws InvalidPaymentRequestException if the amount differs from the booking total
     */
    @Transactional
    public Payment preparePayment(PaymentInitiationRequest request) {
        Booking booking = bookingRepository.findByIdWithLock(request.getBookingId())
                .orElseThrow(() -> new BookingNotFoundException(request.getBookingId()));

        if (!booking.isCancellable()) {
            throw new StateConflictException(String.format(
                    "Cannot pay for a booking that is %s", booking.getStatus().name().toLowerCase(Locale.ROOT)));
        }

        if (request.getAmount().compareTo(booking.getTotalPrice()) != 0) {
            throw new InvalidPaymentRequestException(String.format(
                    "Payment amount (%s) must match booking total (%s)",
                    request.getAmount().toPlainString(), booking.getTotalPrice().toPlainString()));
        }

        Optional<Payment> existing = paymentRepository.findByBookingId(booking.getId());
        if (existing.isPresent()) {
            Payment payment = existing.get();
            if (payment.getStatus() == PaymentStatus.PENDING) {
                log.info("Reusing pending payment {} for booking {}", payment.getId(), booking.getId());
                return payment;
            }
            throw new StateConflictException("Payment already exists for this booking");
        }

        Payment payment = Payment.builder()
                .booking(booking)
                .amount(booking.getTotalPrice())
                .currency(request.getCurrency() != null ? request.getCurrency() : DEFAULT_CURRENCY)
                .status(PaymentStatus.PENDING)
                .txRef(generateTxRef(booking.getId()))
                .build();

        Payment saved = paymentRepository.save(payment);
        log.info("Created payment {} for booking {} with tx_ref {}", saved.getId(), booking.getId(), saved.getTxRef());
        return saved;
    }

    /**
     * Records the checkout URL and moves the payment to PROCESSING.
     * A webhook may have settled the payment already; its status is then left alone.
     */
    @Transactional
    public Payment markInitiated(Long paymentId, String checkoutUrl) {
        Payment payment = paymentRepository.findByIdWithLock(paymentId)
                .orElseThrow(() -> new PaymentNotFoundException(paymentId));

        payment.setCheckoutUrl(checkoutUrl);
        if (payment.getStatus() == PaymentStatus.PENDING) {
            payment.setStatus(PaymentStatus.PROCESSING);
        } else {
            log.info("Payment {} already {} when initiation was recorded, keeping status",
                    paymentId, payment.getStatus());
        }
        return paymentRepository.save(payment);
    }

    /**
     * Read-decide-write for one gateway verification, under the payment row lock.
     * Of two concurrent callers for the same payment, the second sees the first's
     * committed state.
     */
    @Transactional
    public VerificationOutcome applyVerification(Long paymentId, GatewayVerificationResult verification) {
        Payment payment = paymentRepository.findByIdWithLock(paymentId)
                .orElseThrow(() -> new PaymentNotFoundException(paymentId));
        Booking booking = payment.getBooking();

        ReconciliationDecision decision = reconciler.reconcile(PaymentSnapshot.of(payment), verification);

        if (decision.isPaymentStatusChanged()) {
            payment.setStatus(decision.getNewPaymentStatus());
        }

        switch (decision.getOutcome()) {
            case SETTLED:
                payment.setPaidAt(LocalDateTime.now());
                payment.setFailureReason(null);
                break;
            case FAILED:
                payment.setFailureReason(decision.getFailureReason());
                break;
            default:
                break;
        }

        // settled payments keep the identifiers they settled with
        if (decision.getPreviousPaymentStatus() != PaymentStatus.COMPLETED
                && decision.getPreviousPaymentStatus() != PaymentStatus.REFUNDED) {
            recordGatewayIdentifiers(payment, verification);
        }

        payment.recordVerificationAttempt();
        payment.setLastError(null);

        if (decision.isBookingStatusChanged()) {
            booking.setStatus(decision.getNewBookingStatus());
            bookingRepository.save(booking);
        }
        Payment saved = paymentRepository.save(payment);

        logDecision(saved, decision);
        return new VerificationOutcome(saved, decision);
    }

    /**
     * Books a failed verification attempt against the payment without touching its status.
     */
    @Transactional
    public void recordVerificationFailure(Long paymentId, String error) {
        Payment payment = paymentRepository.findByIdWithLock(paymentId)
                .orElseThrow(() -> new PaymentNotFoundException(paymentId));
        payment.recordVerificationAttempt();
        payment.setLastError(truncate(error));
        paymentRepository.save(payment);
    }

    private void recordGatewayIdentifiers(Payment payment, GatewayVerificationResult verification) {
        if (verification.getGatewayTransactionId() != null) {
            payment.setGatewayTransactionId(verification.getGatewayTransactionId());
        }
        if (verification.getGatewayReference() != null) {
            payment.setGatewayReference(verification.getGatewayReference());
        }
    }

    private void logDecision(Payment payment, ReconciliationDecision decision) {
        switch (decision.getOutcome()) {
            case DUPLICATE_SETTLEMENT:
                log.info("Payment {} already completed, ignoring replayed settlement", payment.getId());
                break;
            case UNCHANGED:
                log.debug("Payment {} unchanged at {}", payment.getId(), payment.getStatus());
                break;
            default:
                log.info("Payment {} moved {} -> {}, booking {} -> {} ({})",
                        payment.getId(),
                        decision.getPreviousPaymentStatus(), decision.getNewPaymentStatus(),
                        decision.getPreviousBookingStatus(), decision.getNewBookingStatus(),
                        decision.getOutcome());
        }

        for (ReconciliationAnomaly anomaly : decision.getAnomalies()) {
            log.warn("Reconciliation anomaly {}: {}", anomaly.getType(), anomaly.getMessage());
        }
    }

    private String generateTxRef(Long bookingId) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
        return String.format("%s-%d-%s", chapaProperties.getTxRefPrefix(), bookingId, suffix);
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }
}
