package com.travelbooking.reconciliation.service;

import com.travelbooking.reconciliation.client.PaymentGatewayClient;
import com.travelbooking.reconciliation.dto.GatewayVerificationResult;
import com.travelbooking.reconciliation.dto.VerificationRunResult;
import com.travelbooking.reconciliation.entity.Payment;
import com.travelbooking.reconciliation.entity.PaymentStatus;
import com.travelbooking.reconciliation.exception.GatewayException;
import com.travelbooking.reconciliation.exception.InvalidPaymentRequestException;
import com.travelbooking.reconciliation.exception.PaymentNotFoundException;
import com.travelbooking.reconciliation.exception.StateConflictException;
import com.travelbooking.reconciliation.notification.NotificationEvent;
import com.travelbooking.reconciliation.notification.Notifier;
import com.travelbooking.reconciliation.reconciler.ReconciliationDecision;
import com.travelbooking.reconciliation.repository.PaymentRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Drives payment verification from its three triggers: the manual verify endpoint,
 * the gateway webhook and the scheduled sweep over stale PROCESSING payments.
 * <p>
 * Every trigger follows the same path: ask the gateway (no lock held), apply the
 * answer through {@link PaymentStateService} in one locked transaction, then hand
 * the resulting events to the {@link Notifier} once that transaction has committed.
 */
@Service
@Slf4j
public class PaymentVerificationService {

    private static final int MAX_PAGES = 10000;

    private final PaymentRepository paymentRepository;
    private final PaymentGatewayClient gatewayClient;
    private final PaymentStateService stateService;
    private final Notifier notifier;
    private final MeterRegistry meterRegistry;

    @Value("${verification.batch-size:100}")
    private int batchSize;

    @Value("${verification.max-attempts:5}")
    private int maxVerificationAttempts;

    @Value("${verification.stale-threshold-minutes:15}")
    private int staleThresholdMinutes;

    private Counter verificationCounter;
    private Counter settledCounter;
    private Counter failedCounter;
    private Counter duplicateCounter;
    private Counter anomalyCounter;
    private Counter gatewayErrorCounter;
    private Timer sweepTimer;

    // one sweep at a time
    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public PaymentVerificationService(PaymentRepository paymentRepository,
                                      PaymentGatewayClient gatewayClient,
                                      PaymentStateService stateService,
                                      Notifier notifier,
                                      MeterRegistry meterRegistry) {
        this.paymentRepository = paymentRepository;
        this.gatewayClient = gatewayClient;
        this.stateService = stateService;
        this.notifier = notifier;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        verificationCounter = Counter.builder("payments.verification.total")
                .description("Gateway verifications attempted")
                .register(meterRegistry);

        settledCounter = Counter.builder("payments.verification.settled")
                .description("Verifications that settled a payment")
                .register(meterRegistry);

        failedCounter = Counter.builder("payments.verification.failed")
                .description("Verifications that moved a payment to FAILED")
                .register(meterRegistry);

        duplicateCounter = Counter.builder("payments.verification.duplicate")
                .description("Replayed settlements ignored by the idempotence guard")
                .register(meterRegistry);

        anomalyCounter = Counter.builder("payments.verification.anomalies")
                .description("Amount mismatches and stale booking states detected")
                .register(meterRegistry);

        gatewayErrorCounter = Counter.builder("payments.gateway.errors")
                .description("Verifications that failed to get an answer from the gateway")
                .register(meterRegistry);

        sweepTimer = Timer.builder("payments.verification.sweep.duration")
                .description("Time taken by a stale payment sweep")
                .register(meterRegistry);
    }

    /**
     * Manual verification of one payment.
     *
     * @throws PaymentNotFoundException       if the payment does not exist
     * @throws InvalidPaymentRequestException if the payment was never sent to the gateway
     * @throws GatewayException               if the gateway gave no definite answer; nothing is written
     */
    public VerificationOutcome verifyPayment(Long paymentId) {
        Payment payment = paymentRepository.findById(paymentId)
                .orElseThrow(() -> new PaymentNotFoundException(paymentId));

        if (payment.getTxRef() == null || payment.getTxRef().isBlank()) {
            throw new InvalidPaymentRequestException("No transaction reference available for verification");
        }

        log.info("Manual verification requested for payment {} ({})", paymentId, payment.getTxRef());
        return verifyAndApply(payment.getId(), payment.getTxRef());
    }

    /**
     * Webhook trigger. Only the reference is taken from the callback; the status
     * always comes from a fresh gateway verification.
     */
    public VerificationOutcome handleWebhook(String txRef) {
        if (txRef == null || txRef.isBlank()) {
            throw new InvalidPaymentRequestException("Missing tx_ref in webhook payload");
        }

        Payment payment = paymentRepository.findByTxRef(txRef)
                .orElseThrow(() -> new PaymentNotFoundException(txRef));

        log.info("Webhook received for payment {} ({})", payment.getId(), txRef);
        return verifyAndApply(payment.getId(), txRef);
    }

    /**
     * Re-verifies PROCESSING payments nobody has touched for a while.
     * A failure on one payment is recorded against it and the sweep moves on.
     *
     * @throws StateConflictException if a sweep is already running
     */
    public VerificationRunResult verifyStaleProcessingPayments() {
        if (!isRunning.compareAndSet(false, true)) {
            log.warn("Verification sweep already in progress, skipping this run");
            throw new StateConflictException("Verification sweep already in progress");
        }

        VerificationRunResult result = VerificationRunResult.builder()
                .startedAt(LocalDateTime.now())
                .build();

        log.info("Starting verification sweep of stale PROCESSING payments");

        try {
            return sweepTimer.record(() -> {
                processStalePayments(result);
                result.setCompletedAt(LocalDateTime.now());

                log.info("Verification sweep completed. Processed: {}, Settled: {}, Failed: {}, " +
                                "Still processing: {}, Anomalies: {}, Errors: {}",
                        result.getTotalProcessed(),
                        result.getSettled(),
                        result.getFailed(),
                        result.getStillProcessing(),
                        result.getAnomalies(),
                        result.getErrors());

                return result;
            });
        } finally {
            isRunning.set(false);
        }
    }

    /**
     * Reads the first page again after each batch: payments handled in this run leave the
     * result set because their updated_at moves past the threshold. Ids already seen are
     * skipped. A payment whose error state could not be saved stays in the result set, so
     * when a page holds only seen ids the sweep moves on to the next page.
     */
    private void processStalePayments(VerificationRunResult result) {
        LocalDateTime staleThreshold = LocalDateTime.now().minusMinutes(staleThresholdMinutes);
        Set<Long> seen = new HashSet<>();
        int pageIndex = 0;
        int pages = 0;

        while (pages < MAX_PAGES) {
            Page<Payment> page = paymentRepository.findStaleForVerification(
                    PaymentStatus.PROCESSING,
                    staleThreshold,
                    maxVerificationAttempts,
                    PageRequest.of(pageIndex, batchSize)
            );
            pages++;

            List<Payment> fresh = page.getContent().stream()
                    .filter(payment -> seen.add(payment.getId()))
                    .collect(Collectors.toList());

            if (fresh.isEmpty()) {
                if (!page.hasNext()) {
                    return;
                }
                pageIndex++;
                log.debug("Page {} holds only payments already tried in this run, moving to page {}",
                        pageIndex - 1, pageIndex);
                continue;
            }

            log.debug("Processing batch {} (page {}) with {} payments", pages, pageIndex, fresh.size());
            for (Payment payment : fresh) {
                processPayment(payment, result);
            }
        }
        log.warn("Reached maximum page limit ({}), stopping sweep", MAX_PAGES);
    }

    private void processPayment(Payment payment, VerificationRunResult result) {
        result.incrementTotalProcessed();

        try {
            ReconciliationDecision decision = verifyAndApply(payment.getId(), payment.getTxRef()).getDecision();
            result.addAnomalies(decision.getAnomalies().size());

            switch (decision.getOutcome()) {
                case SETTLED:
                    result.incrementSettled();
                    break;
                case FAILED:
                    result.incrementFailed();
                    break;
                default:
                    if (decision.getNewPaymentStatus() == PaymentStatus.PROCESSING) {
                        result.incrementStillProcessing();
                    }
                    break;
            }
        } catch (GatewayException e) {
            handleGatewayError(payment, e, result);
        } catch (Exception e) {
            handleUnexpectedError(payment, e, result);
        }
    }

    private VerificationOutcome verifyAndApply(Long paymentId, String txRef) {
        verificationCounter.increment();

        GatewayVerificationResult verification;
        try {
            verification = gatewayClient.verify(txRef);
        } catch (GatewayException e) {
            gatewayErrorCounter.increment();
            log.warn("Verification of payment {} ({}) failed: {} {}",
                    paymentId, txRef, e.getKind(), e.getMessage());
            throw e;
        }

        VerificationOutcome outcome = stateService.applyVerification(paymentId, verification);
        recordMetrics(outcome.getDecision());
        dispatch(outcome.getDecision());
        return outcome;
    }

    private void recordMetrics(ReconciliationDecision decision) {
        switch (decision.getOutcome()) {
            case SETTLED:
                settledCounter.increment();
                break;
            case FAILED:
                failedCounter.increment();
                break;
            case DUPLICATE_SETTLEMENT:
                duplicateCounter.increment();
                break;
            default:
                break;
        }
        if (decision.hasAnomalies()) {
            anomalyCounter.increment(decision.getAnomalies().size());
        }
    }

    private void dispatch(ReconciliationDecision decision) {
        for (NotificationEvent event : decision.getEvents()) {
            try {
                notifier.publish(event);
            } catch (RuntimeException e) {
                log.error("Could not hand {} for payment {} to the notifier",
                        event.getType(), event.getPaymentId(), e);
            }
        }
    }

    private void handleGatewayError(Payment payment, GatewayException e, VerificationRunResult result) {
        result.addError(payment.getId(), payment.getTxRef(), e.getMessage());
        recordFailure(payment, e.getKind() + ": " + e.getMessage());
    }

    private void handleUnexpectedError(Payment payment, Exception e, VerificationRunResult result) {
        log.error("Unexpected error verifying payment {}: {}", payment.getId(), e.getMessage(), e);
        result.addError(payment.getId(), payment.getTxRef(), "Unexpected error: " + e.getMessage());
        recordFailure(payment, "Unexpected error: " + e.getMessage());
    }

    private void recordFailure(Payment payment, String error) {
        try {
            stateService.recordVerificationFailure(payment.getId(), error);
        } catch (Exception saveError) {
            log.error("Failed to save error state for payment {}", payment.getId(), saveError);
        }
    }

    /**
     * Payment counts by status, for the stats endpoint.
     */
    public PaymentStats getStats() {
        return PaymentStats.builder()
                .pendingCount(paymentRepository.countByStatus(PaymentStatus.PENDING))
                .processingCount(paymentRepository.countByStatus(PaymentStatus.PROCESSING))
                .completedCount(paymentRepository.countByStatus(PaymentStatus.COMPLETED))
                .failedCount(paymentRepository.countByStatus(PaymentStatus.FAILED))
                .cancelledCount(paymentRepository.countByStatus(PaymentStatus.CANCELLED))
                .refundedCount(paymentRepository.countByStatus(PaymentStatus.REFUNDED))
                .isVerificationRunning(isRunning.get())
                .build();
    }

    @lombok.Data
    @lombok.Builder
    public static class PaymentStats {
        private long pendingCount;
        private long processingCount;
        private long completedCount;
        private long failedCount;
        private long cancelledCount;
        private long refundedCount;
        private boolean isVerificationRunning;
    }
}
