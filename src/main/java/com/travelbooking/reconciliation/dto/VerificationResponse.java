package com.travelbooking.reconciliation.dto;

import com.travelbooking.reconciliation.entity.BookingStatus;
import com.travelbooking.reconciliation.reconciler.ReconciliationAnomaly;
import com.travelbooking.reconciliation.reconciler.ReconciliationOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of a manual verification or webhook, including anomalies an operator should look at.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationResponse {

    private String message;
    private PaymentResponse payment;
    private BookingStatus bookingStatus;
    private ReconciliationOutcome outcome;
    private List<ReconciliationAnomaly> anomalies;
}
