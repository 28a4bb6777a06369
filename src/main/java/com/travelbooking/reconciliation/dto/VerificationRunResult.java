package com.travelbooking.reconciliation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Summary of one sweep over stale PROCESSING payments.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationRunResult {

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    @Builder.Default
    private int totalProcessed = 0;

    @Builder.Default
    private int settled = 0;

    @Builder.Default
    private int failed = 0;

    @Builder.Default
    private int stillProcessing = 0;

    @Builder.Default
    private int anomalies = 0;

    @Builder.Default
    private int errors = 0;

    @Builder.Default
    private List<VerificationError> errorDetails = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VerificationError {
        private Long paymentId;
        private String txRef;
        private String errorMessage;
        private LocalDateTime occurredAt;
    }

    public void incrementTotalProcessed() {
        this.totalProcessed++;
    }

    public void incrementSettled() {
        this.settled++;
    }

    public void incrementFailed() {
        this.failed++;
    }

    public void incrementStillProcessing() {
        this.stillProcessing++;
    }

    public void addAnomalies(int count) {
        this.anomalies += count;
    }

    public void addError(Long paymentId, String txRef, String errorMessage) {
        this.errors++;
        if (this.errorDetails == null) {
            this.errorDetails = new ArrayList<>();
        }
        this.errorDetails.add(VerificationError.builder()
                .paymentId(paymentId)
                .txRef(txRef)
                .errorMessage(errorMessage)
                .occurredAt(LocalDateTime.now())
                .build());
    }

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
