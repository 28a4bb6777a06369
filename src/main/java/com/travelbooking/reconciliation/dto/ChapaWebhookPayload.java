package com.travelbooking.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Callback body posted by Chapa. Only tx_ref is trusted. The posted status is logged,
 * other fields are ignored, and the actual state is always re-fetched through the verify API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChapaWebhookPayload {

    @JsonProperty("tx_ref")
    private String txRef;

    private String status;
}
