package com.travelbooking.reconciliation.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Hands notifications to a bounded executor so the payment flow never waits on delivery.
 */
@Component
@Slf4j
public class AsyncNotifier implements Notifier {

    private final TaskExecutor executor;
    private final NotificationDeliveryService deliveryService;

    public AsyncNotifier(@Qualifier("notificationExecutor") TaskExecutor executor,
                         NotificationDeliveryService deliveryService) {
        this.executor = executor;
        this.deliveryService = deliveryService;
    }

    @Override
    public void publish(NotificationEvent event) {
        log.debug("Queueing {} notification for payment {} / booking {}",
                event.getType(), event.getPaymentId(), event.getBookingId());
        try {
            executor.execute(() -> deliverQuietly(event));
        } catch (TaskRejectedException e) {
            log.error("Notification queue full, dropped {} for payment {} / booking {}",
                    event.getType(), event.getPaymentId(), event.getBookingId(), e);
        }
    }

    private void deliverQuietly(NotificationEvent event) {
        try {
            deliveryService.deliver(event);
        } catch (RuntimeException e) {
            log.error("Unexpected error delivering {} for payment {} / booking {}",
                    event.getType(), event.getPaymentId(), event.getBookingId(), e);
        }
    }
}
