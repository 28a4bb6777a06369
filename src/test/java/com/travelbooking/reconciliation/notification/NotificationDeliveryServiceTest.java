package com.travelbooking.reconciliation.notification;

import com.travelbooking.reconciliation.exception.NotificationDeliveryException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Plain unit tests for delivery. Retry behaviour is covered by the Spring context in
 * {@link NotificationRetryTest}.
 */
@ExtendWith(MockitoExtension.class)
class NotificationDeliveryServiceTest {

    @Mock
    private NotificationMessageFactory messageFactory;

    @Mock
    private NotificationChannel channel;

    private SimpleMeterRegistry meterRegistry;
    private NotificationDeliveryService deliveryService;

    private final NotificationEvent event = NotificationEvent.paymentConfirmed(7L, 42L);
    private final NotificationMessage message = NotificationMessage.builder()
            .type(NotificationType.PAYMENT_CONFIRMED)
            .recipient("abebe@example.com")
            .subject("Payment Confirmation - Booking #42")
            .body("Thank you")
            .build();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        deliveryService = new NotificationDeliveryService(messageFactory, channel, meterRegistry);
    }

    @Test
    @DisplayName("Should send the rendered message and count it")
    void shouldSendRenderedMessage() {
        when(messageFactory.render(event)).thenReturn(Optional.of(message));

        deliveryService.deliver(event);

        verify(channel).send(message);
        assertThat(meterRegistry.counter("notifications.delivered", "type", "PAYMENT_CONFIRMED").count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should skip events that no longer apply")
    void shouldSkipWhenNothingToSend() {
        when(messageFactory.render(event)).thenReturn(Optional.empty());

        deliveryService.deliver(event);

        verifyNoInteractions(channel);
    }

    @Test
    @DisplayName("Should wrap channel failures so they can be retried")
    void shouldWrapChannelFailures() {
        when(messageFactory.render(event)).thenReturn(Optional.of(message));
        doThrow(new IllegalStateException("smtp down")).when(channel).send(any());

        assertThatThrownBy(() -> deliveryService.deliver(event))
                .isInstanceOf(NotificationDeliveryException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should count a notification given up on")
    void shouldCountRecoveredFailures() {
        deliveryService.recover(new NotificationDeliveryException("failed", new IllegalStateException()), event);

        assertThat(meterRegistry.counter("notifications.failed", "type", "PAYMENT_CONFIRMED").count())
                .isEqualTo(1.0);
    }
}
