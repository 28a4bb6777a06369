package com.travelbooking.reconciliation.notification;

/**
 * Transport for rendered notifications. Throwing signals a delivery failure worth retrying.
 */
public interface NotificationChannel {

    void send(NotificationMessage message);
}
