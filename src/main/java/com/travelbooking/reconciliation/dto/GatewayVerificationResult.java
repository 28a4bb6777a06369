package com.travelbooking.reconciliation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * The gateway's answer to "what happened to this tx_ref?".
 * This DTO maps the data block of Chapa's verify response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayVerificationResult {

    /**
     * Our reference, echoed back by the gateway.
     */
    private String txRef;

    /**
     * Gateway-native status text, e.g. "success" or "pending".
     * Translated only by GatewayStatusMapper.
     */
    private String rawStatus;

    /**
     * Amount the gateway settled. Null when the gateway omitted it or sent something unparsable.
     */
    private BigDecimal amount;

    private String currency;

    /**
     * The gateway's own transaction identifier.
     */
    private String gatewayTransactionId;

    /**
     * The gateway's payment reference shown to the customer.
     */
    private String gatewayReference;

    private String failureReason;
}
