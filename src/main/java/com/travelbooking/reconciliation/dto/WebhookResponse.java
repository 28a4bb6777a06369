package com.travelbooking.reconciliation.dto;

import com.travelbooking.reconciliation.entity.PaymentStatus;
import com.travelbooking.reconciliation.reconciler.ReconciliationOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookResponse {

    private String message;
    private UUID paymentId;
    private PaymentStatus status;
    private ReconciliationOutcome outcome;
}
