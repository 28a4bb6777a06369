package com.travelbooking.reconciliation.service;

import com.travelbooking.reconciliation.entity.Payment;
import com.travelbooking.reconciliation.reconciler.ReconciliationDecision;
import lombok.Value;

/**
 * A reconciliation decision together with the payment as committed after applying it.
 */
@Value
public class VerificationOutcome {

    Payment payment;
    ReconciliationDecision decision;
}
