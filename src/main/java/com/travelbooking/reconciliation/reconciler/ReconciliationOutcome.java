package com.travelbooking.reconciliation.reconciler;

/**
 * What kind of transition a reconciliation decision represents.
 */
public enum ReconciliationOutcome {
    /**
     * First transition into COMPLETED. Sets paid_at and emits the confirmation.
     */
    SETTLED,

    /**
     * Transition into FAILED. Emits the failure notification.
     */
    FAILED,

    /**
     * Payment already COMPLETED and the gateway says success again, typically a replayed
     * webhook racing a manual verify. Nothing changes and nothing is emitted.
     */
    DUPLICATE_SETTLEMENT,

    /**
     * Silent status move, e.g. PENDING to PROCESSING or to CANCELLED.
     */
    STATUS_UPDATED,

    /**
     * Gateway agrees with what we already have.
     */
    UNCHANGED
}
