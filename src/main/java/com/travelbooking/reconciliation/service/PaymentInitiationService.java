package com.travelbooking.reconciliation.service;

import com.travelbooking.reconciliation.client.PaymentGatewayClient;
import com.travelbooking.reconciliation.config.ChapaProperties;
import com.travelbooking.reconciliation.dto.GatewayCheckout;
import com.travelbooking.reconciliation.dto.GatewayInitiationRequest;
import com.travelbooking.reconciliation.dto.PaymentInitiationRequest;
import com.travelbooking.reconciliation.entity.Booking;
import com.travelbooking.reconciliation.entity.Payment;
import com.travelbooking.reconciliation.exception.GatewayException;
import com.travelbooking.reconciliation.notification.NotificationEvent;
import com.travelbooking.reconciliation.notification.Notifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Opens a hosted checkout for a booking.
 * <p>
 * The payment row is committed in PENDING before the gateway is called. If the call
 * fails the row stays PENDING and the next initiation for the booking reuses it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentInitiationService {

    private final PaymentStateService stateService;
    private final PaymentGatewayClient gatewayClient;
    private final ChapaProperties chapaProperties;
    private final Notifier notifier;

    public InitiatedPayment initiate(PaymentInitiationRequest request) {
        Payment payment = stateService.preparePayment(request);
        Booking booking = payment.getBooking();

        GatewayCheckout checkout;
        try {
            checkout = gatewayClient.initiate(toGatewayRequest(payment, booking));
        } catch (GatewayException e) {
            log.error("Payment initiation failed for booking {} ({}): {} {}",
                    booking.getId(), payment.getTxRef(), e.getKind(), e.getMessage());
            throw e;
        }

        Payment initiated = stateService.markInitiated(payment.getId(), checkout.getCheckoutUrl());
        log.info("Payment {} initiated for booking {}, tx_ref {}",
                initiated.getId(), booking.getId(), initiated.getTxRef());

        try {
            notifier.publish(NotificationEvent.bookingAwaitingPayment(booking.getId(), initiated.getId()));
        } catch (RuntimeException e) {
            log.error("Could not hand booking notification for payment {} to the notifier", initiated.getId(), e);
        }

        return new InitiatedPayment(initiated, checkout.getCheckoutUrl());
    }

    private GatewayInitiationRequest toGatewayRequest(Payment payment, Booking booking) {
        return GatewayInitiationRequest.builder()
                .txRef(payment.getTxRef())
                .amount(payment.getAmount())
                .currency(payment.getCurrency())
                .email(booking.getGuestEmail())
                .firstName(booking.getGuestFirstName())
                .lastName(booking.getGuestLastName())
                .phoneNumber(booking.getGuestPhone())
                .callbackUrl(chapaProperties.getCallbackUrl())
                .returnUrl(chapaProperties.getReturnUrl())
                .title(chapaProperties.getCheckoutTitle())
                .description("Payment for booking #" + booking.getId())
                .bookingId(booking.getId())
                .build();
    }

    @lombok.Value
    public static class InitiatedPayment {
        Payment payment;
        String checkoutUrl;
    }
}
