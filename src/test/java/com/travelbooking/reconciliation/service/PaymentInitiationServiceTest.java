package com.travelbooking.reconciliation.service;

import com.travelbooking.reconciliation.client.PaymentGatewayClient;
import com.travelbooking.reconciliation.config.ChapaProperties;
import com.travelbooking.reconciliation.dto.GatewayCheckout;
import com.travelbooking.reconciliation.dto.GatewayInitiationRequest;
import com.travelbooking.reconciliation.dto.PaymentInitiationRequest;
import com.travelbooking.reconciliation.entity.Booking;
import com.travelbooking.reconciliation.entity.Payment;
import com.travelbooking.reconciliation.entity.PaymentStatus;
import com.travelbooking.reconciliation.exception.GatewayException;
import com.travelbooking.reconciliation.exception.GatewayException.Kind;
import com.travelbooking.reconciliation.notification.NotificationEvent;
import com.travelbooking.reconciliation.notification.Notifier;
import com.travelbooking.reconciliation.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaymentInitiationServiceTest {

    private static final String TX_REF = "ALX-42-0A1B2C3D";
    private static final String CHECKOUT_URL = "https://checkout.chapa.co/checkout/payment/abc";

    @Mock
    private PaymentStateService stateService;

    @Mock
    private PaymentGatewayClient gatewayClient;

    @Mock
    private Notifier notifier;

    private PaymentInitiationService initiationService;

    private Booking booking;
    private Payment pending;

    @BeforeEach
    void setUp() {
        ChapaProperties properties = new ChapaProperties();
        properties.setCallbackUrl("https://api.example.com/api/v1/payments/webhook");
        properties.setReturnUrl("https://app.example.com/payment/complete");
        initiationService = new PaymentInitiationService(stateService, gatewayClient, properties, notifier);

        booking = TestData.booking().id(42L).build();
        pending = TestData.payment(booking, PaymentStatus.PENDING, TX_REF).id(7L).build();
    }

    @Test
    @DisplayName("Should open a checkout, mark the payment initiated and notify the guest")
    void shouldInitiatePayment() {
        // Given
        Payment processing = TestData.payment(booking, PaymentStatus.PROCESSING, TX_REF)
                .id(7L).checkoutUrl(CHECKOUT_URL).build();
        when(stateService.preparePayment(any())).thenReturn(pending);
        when(gatewayClient.initiate(any())).thenReturn(GatewayCheckout.builder()
                .checkoutUrl(CHECKOUT_URL).txRef(TX_REF).build());
        when(stateService.markInitiated(7L, CHECKOUT_URL)).thenReturn(processing);

        // When
        PaymentInitiationService.InitiatedPayment result = initiationService.initiate(request());

        // Then
        assertThat(result.getCheckoutUrl()).isEqualTo(CHECKOUT_URL);
        assertThat(result.getPayment().getStatus()).isEqualTo(PaymentStatus.PROCESSING);

        ArgumentCaptor<GatewayInitiationRequest> captor = ArgumentCaptor.forClass(GatewayInitiationRequest.class);
        verify(gatewayClient).initiate(captor.capture());
        GatewayInitiationRequest sent = captor.getValue();
        assertThat(sent.getTxRef()).isEqualTo(TX_REF);
        assertThat(sent.getAmount()).isEqualByComparingTo("450.00");
        assertThat(sent.getEmail()).isEqualTo("abebe@example.com");
        assertThat(sent.getFirstName()).isEqualTo("Abebe");
        assertThat(sent.getCallbackUrl()).isEqualTo("https://api.example.com/api/v1/payments/webhook");
        assertThat(sent.getTitle()).isEqualTo("ALX Travel App");
        assertThat(sent.getBookingId()).isEqualTo(42L);

        verify(notifier).publish(NotificationEvent.bookingAwaitingPayment(42L, 7L));
    }

    @Test
    @DisplayName("Should leave the payment pending when the gateway call fails")
    void shouldLeavePaymentPendingOnGatewayError() {
        when(stateService.preparePayment(any())).thenReturn(pending);
        when(gatewayClient.initiate(any()))
                .thenThrow(new GatewayException(Kind.UNREACHABLE, "timeout", "Chapa", TX_REF));

        assertThatThrownBy(() -> initiationService.initiate(request()))
                .isInstanceOf(GatewayException.class);

        verify(stateService, never()).markInitiated(anyLong(), anyString());
        verify(notifier, never()).publish(any());
    }

    private PaymentInitiationRequest request() {
        return PaymentInitiationRequest.builder()
                .bookingId(42L)
                .amount(new BigDecimal("450.00"))
                .currency("ETB")
                .build();
    }
}
