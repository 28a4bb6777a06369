package com.travelbooking.reconciliation.controller;

import com.travelbooking.reconciliation.dto.ChapaWebhookPayload;
import com.travelbooking.reconciliation.dto.PaymentInitiationRequest;
import com.travelbooking.reconciliation.dto.PaymentInitiationResponse;
import com.travelbooking.reconciliation.dto.PaymentResponse;
import com.travelbooking.reconciliation.dto.VerificationResponse;
import com.travelbooking.reconciliation.dto.VerificationRunResult;
import com.travelbooking.reconciliation.dto.WebhookResponse;
import com.travelbooking.reconciliation.exception.PaymentNotFoundException;
import com.travelbooking.reconciliation.reconciler.ReconciliationDecision;
import com.travelbooking.reconciliation.reconciler.ReconciliationOutcome;
import com.travelbooking.reconciliation.repository.PaymentRepository;
import com.travelbooking.reconciliation.service.PaymentInitiationService;
import com.travelbooking.reconciliation.service.PaymentInitiationService.InitiatedPayment;
import com.travelbooking.reconciliation.service.PaymentVerificationService;
import com.travelbooking.reconciliation.service.PaymentVerificationService.PaymentStats;
import com.travelbooking.reconciliation.service.VerificationOutcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Payment endpoints: checkout initiation, manual verification, status lookup and
 * the gateway webhook.
 */
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Payments", description = "Booking payment initiation and verification API")
public class PaymentController {

    private final PaymentInitiationService initiationService;
    private final PaymentVerificationService verificationService;
    private final PaymentRepository paymentRepository;

    @Operation(
            summary = "Initiate payment",
            description = "Creates the booking's payment and opens a hosted checkout with the gateway."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Checkout created",
                    content = @Content(schema = @Schema(implementation = PaymentInitiationResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid amount or gateway rejected the request"),
            @ApiResponse(responseCode = "404", description = "Booking not found"),
            @ApiResponse(responseCode = "409", description = "Booking cannot take a payment"),
            @ApiResponse(responseCode = "502", description = "Gateway unreachable")
    })
    @PostMapping("/initiate")
    public ResponseEntity<PaymentInitiationResponse> initiatePayment(
            @Valid @RequestBody PaymentInitiationRequest request) {
        InitiatedPayment initiated = initiationService.initiate(request);

        PaymentInitiationResponse response = PaymentInitiationResponse.builder()
                .message("Payment initiated successfully")
                .payment(PaymentResponse.from(initiated.getPayment()))
                .checkoutUrl(initiated.getCheckoutUrl())
                .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(
            summary = "Verify payment",
            description = "Asks the gateway for the payment's current status and reconciles it with local state."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Verification applied",
                    content = @Content(schema = @Schema(implementation = VerificationResponse.class))),
            @ApiResponse(responseCode = "400", description = "Payment has no transaction reference"),
            @ApiResponse(responseCode = "404", description = "Payment not found"),
            @ApiResponse(responseCode = "502", description = "Gateway unreachable or answered garbage")
    })
    @PostMapping("/{paymentId}/verify")
    public ResponseEntity<VerificationResponse> verifyPayment(
            @Parameter(description = "Payment ID") @PathVariable Long paymentId) {
        VerificationOutcome outcome = verificationService.verifyPayment(paymentId);
        ReconciliationDecision decision = outcome.getDecision();

        VerificationResponse response = VerificationResponse.builder()
                .message(describe(decision.getOutcome()))
                .payment(PaymentResponse.from(outcome.getPayment()))
                .bookingStatus(decision.getNewBookingStatus())
                .outcome(decision.getOutcome())
                .anomalies(decision.getAnomalies())
                .build();
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Get payment status")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Payment found",
                    content = @Content(schema = @Schema(implementation = PaymentResponse.class))),
            @ApiResponse(responseCode = "404", description = "Payment not found")
    })
    @GetMapping("/{paymentId}/status")
    public ResponseEntity<PaymentResponse> getPaymentStatus(
            @Parameter(description = "Payment ID") @PathVariable Long paymentId) {
        return paymentRepository.findById(paymentId)
                .map(PaymentResponse::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new PaymentNotFoundException(paymentId));
    }

    @Operation(
            summary = "Gateway webhook",
            description = "Callback from Chapa. Only tx_ref is used; the status is re-verified with the gateway."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Webhook processed",
                    content = @Content(schema = @Schema(implementation = WebhookResponse.class))),
            @ApiResponse(responseCode = "400", description = "Missing tx_ref"),
            @ApiResponse(responseCode = "404", description = "Unknown tx_ref")
    })
    @PostMapping("/webhook")
    public ResponseEntity<WebhookResponse> handleWebhook(@RequestBody ChapaWebhookPayload payload) {
        log.debug("Webhook payload: tx_ref={}, status={}", payload.getTxRef(), payload.getStatus());

        VerificationOutcome outcome = verificationService.handleWebhook(payload.getTxRef());

        WebhookResponse response = WebhookResponse.builder()
                .message("Webhook processed successfully")
                .paymentId(outcome.getPayment().getPaymentId())
                .status(outcome.getPayment().getStatus())
                .outcome(outcome.getDecision().getOutcome())
                .build();
        return ResponseEntity.ok(response);
    }

    @Operation(
            summary = "Run stale payment sweep",
            description = "Re-verifies PROCESSING payments that have not been updated recently. Normally run by the scheduler."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Sweep completed",
                    content = @Content(schema = @Schema(implementation = VerificationRunResult.class))),
            @ApiResponse(responseCode = "409", description = "Sweep already in progress")
    })
    @PostMapping("/verification/run")
    public ResponseEntity<VerificationRunResult> runVerificationSweep() {
        log.info("Manual verification sweep triggered via API");
        return ResponseEntity.ok(verificationService.verifyStaleProcessingPayments());
    }

    @Operation(summary = "Get payment statistics", description = "Payment counts by status.")
    @ApiResponse(responseCode = "200", description = "Statistics retrieved successfully",
            content = @Content(schema = @Schema(implementation = PaymentStats.class)))
    @GetMapping("/stats")
    public ResponseEntity<PaymentStats> getStats() {
        return ResponseEntity.ok(verificationService.getStats());
    }

    private static String describe(ReconciliationOutcome outcome) {
        switch (outcome) {
            case SETTLED:
                return "Payment completed successfully";
            case FAILED:
                return "Payment failed";
            case DUPLICATE_SETTLEMENT:
                return "Payment was already completed";
            case STATUS_UPDATED:
                return "Payment status updated";
            default:
                return "Payment status unchanged";
        }
    }
}
