package com.travelbooking.reconciliation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Everything the gateway needs to open a hosted checkout for one payment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayInitiationRequest {

    private String txRef;
    private BigDecimal amount;
    private String currency;
    private String email;
    private String firstName;
    private String lastName;
    private String phoneNumber;
    private String callbackUrl;
    private String returnUrl;
    private String title;
    private String description;
    private Long bookingId;
}
