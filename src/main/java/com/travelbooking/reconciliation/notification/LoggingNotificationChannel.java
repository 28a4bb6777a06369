package com.travelbooking.reconciliation.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes notifications to the application log. Mail delivery lives with the
 * notification platform, which tails this logger.
 */
@Component
@Slf4j
public class LoggingNotificationChannel implements NotificationChannel {

    @Override
    public void send(NotificationMessage message) {
        log.info("Notification {} to {}: {}\n{}",
                message.getType(), message.getRecipient(), message.getSubject(), message.getBody());
    }
}
