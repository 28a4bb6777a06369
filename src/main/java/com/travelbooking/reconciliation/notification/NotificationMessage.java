package com.travelbooking.reconciliation.notification;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class NotificationMessage {

    NotificationType type;
    String recipient;
    String subject;
    String body;
}
