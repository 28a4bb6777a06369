package com.travelbooking.reconciliation.scheduler;

import com.travelbooking.reconciliation.dto.VerificationRunResult;
import com.travelbooking.reconciliation.exception.ReconciliationException;
import com.travelbooking.reconciliation.service.PaymentVerificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Periodically re-verifies payments stuck in PROCESSING, for guests whose webhook
 * never arrived and who never came back to the return URL.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentVerificationScheduler {

    private final PaymentVerificationService verificationService;

    @Value("${verification.scheduler.enabled:true}")
    private boolean schedulerEnabled;

    /**
     * fixedDelay, so the next sweep starts only after the previous one returned.
     */
    @Scheduled(fixedDelayString = "${verification.scheduler.interval-ms:300000}",
            initialDelayString = "${verification.scheduler.initial-delay-ms:60000}")
    public void runScheduledVerification() {
        if (!schedulerEnabled) {
            log.debug("Scheduler is disabled, skipping verification sweep");
            return;
        }

        log.info("Starting scheduled verification sweep at {}", LocalDateTime.now());

        try {
            VerificationRunResult result = verificationService.verifyStaleProcessingPayments();

            logResult(result);

            if (result.getErrors() > result.getTotalProcessed() * 0.1) {
                log.warn("High error rate in verification sweep: {} errors out of {} processed",
                        result.getErrors(), result.getTotalProcessed());
            }

        } catch (ReconciliationException e) {
            log.warn("Verification sweep skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled verification sweep failed with unexpected error", e);
        }
    }

    private void logResult(VerificationRunResult result) {
        if (result.getTotalProcessed() == 0) {
            log.info("No stale payments to verify");
        } else {
            log.info("Verification sweep completed in {}ms: {} processed, {} settled, {} failed, {} errors",
                    result.getDurationMs(),
                    result.getTotalProcessed(),
                    result.getSettled(),
                    result.getFailed(),
                    result.getErrors());
        }
    }
}
