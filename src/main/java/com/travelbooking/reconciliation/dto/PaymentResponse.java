package com.travelbooking.reconciliation.dto;

import com.travelbooking.reconciliation.entity.Payment;
import com.travelbooking.reconciliation.entity.PaymentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * API view of a payment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentResponse {

    private Long id;
    private UUID paymentId;
    private Long bookingId;
    private BigDecimal amount;
    private String currency;
    private PaymentStatus status;
    private String txRef;
    private String checkoutUrl;
    private String gatewayTransactionId;
    private String gatewayReference;
    private String failureReason;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime paidAt;
    private boolean successful;
    private boolean pending;
    private boolean refundable;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
                .id(payment.getId())
                .paymentId(payment.getPaymentId())
                .bookingId(payment.getBooking() != null ? payment.getBooking().getId() : null)
                .amount(payment.getAmount())
                .currency(payment.getCurrency())
                .status(payment.getStatus())
                .txRef(payment.getTxRef())
                .checkoutUrl(payment.getCheckoutUrl())
                .gatewayTransactionId(payment.getGatewayTransactionId())
                .gatewayReference(payment.getGatewayReference())
                .failureReason(payment.getFailureReason())
                .createdAt(payment.getCreatedAt())
                .updatedAt(payment.getUpdatedAt())
                .paidAt(payment.getPaidAt())
                .successful(payment.isSuccessful())
                .pending(payment.isPending())
                .refundable(payment.canBeRefunded())
                .build();
    }
}
