package com.travelbooking.reconciliation.notification;

import com.travelbooking.reconciliation.exception.NotificationDeliveryException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Renders and sends one notification, retrying the channel with bounded backoff.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationDeliveryService {

    private final NotificationMessageFactory messageFactory;
    private final NotificationChannel channel;
    private final MeterRegistry meterRegistry;

    @Retryable(
            retryFor = NotificationDeliveryException.class,
            maxAttemptsExpression = "${notification.retry.max-attempts:3}",
            backoff = @Backoff(
                    delayExpression = "${notification.retry.delay-ms:60000}",
                    multiplierExpression = "${notification.retry.multiplier:2}")
    )
    public void deliver(NotificationEvent event) {
        Optional<NotificationMessage> message = messageFactory.render(event);
        if (message.isEmpty()) {
            log.warn("Nothing to send for {} (payment {}, booking {})",
                    event.getType(), event.getPaymentId(), event.getBookingId());
            return;
        }

        try {
            channel.send(message.get());
        } catch (RuntimeException e) {
            log.warn("Delivery of {} to {} failed: {}",
                    event.getType(), message.get().getRecipient(), e.getMessage());
            throw new NotificationDeliveryException("Failed to deliver " + event.getType(), e);
        }

        meterRegistry.counter("notifications.delivered", "type", event.getType().name()).increment();
        log.info("{} notification sent to {}", event.getType(), message.get().getRecipient());
    }

    /**
     * Called once retries are exhausted. The transition that produced the event stays committed.
     */
    @Recover
    public void recover(NotificationDeliveryException e, NotificationEvent event) {
        log.error("Giving up on {} notification for payment {} / booking {}",
                event.getType(), event.getPaymentId(), event.getBookingId(), e);
        meterRegistry.counter("notifications.failed", "type", event.getType().name()).increment();
    }
}
