package com.travelbooking.reconciliation.notification;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.retry.annotation.EnableRetry;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest(
        classes = {NotificationDeliveryService.class, NotificationRetryTest.RetryConfig.class},
        properties = {
                "notification.retry.max-attempts=3",
                "notification.retry.delay-ms=1",
                "notification.retry.multiplier=1"
        })
class NotificationRetryTest {

    @TestConfiguration
    @EnableRetry
    static class RetryConfig {

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Autowired
    private NotificationDeliveryService deliveryService;

    @Autowired
    private MeterRegistry meterRegistry;

    @MockBean
    private NotificationMessageFactory messageFactory;

    @MockBean
    private NotificationChannel channel;

    private final NotificationEvent event = NotificationEvent.paymentFailed(7L, 42L, "card_declined");

    @Test
    @DisplayName("Should retry a failing channel and succeed on a later attempt")
    void shouldRetryUntilDelivered() {
        when(messageFactory.render(event)).thenReturn(Optional.of(message()));
        doThrow(new IllegalStateException("smtp down"))
                .doNothing()
                .when(channel).send(any());

        deliveryService.deliver(event);

        verify(channel, times(2)).send(any());
        assertThat(meterRegistry.counter("notifications.delivered", "type", "PAYMENT_FAILED").count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should give up after three attempts without throwing")
    void shouldRecoverAfterExhaustingAttempts() {
        when(messageFactory.render(event)).thenReturn(Optional.of(message()));
        doThrow(new IllegalStateException("smtp down")).when(channel).send(any());

        assertThatCode(() -> deliveryService.deliver(event)).doesNotThrowAnyException();

        verify(channel, times(3)).send(any());
        assertThat(meterRegistry.counter("notifications.failed", "type", "PAYMENT_FAILED").count())
                .isEqualTo(1.0);
    }

    private NotificationMessage message() {
        return NotificationMessage.builder()
                .type(NotificationType.PAYMENT_FAILED)
                .recipient("abebe@example.com")
                .subject("Payment Failed - Booking #42")
                .body("Sorry")
                .build();
    }
}
