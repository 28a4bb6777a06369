package com.travelbooking.reconciliation.notification;

/**
 * Outbound, best-effort channel for guest notifications.
 * <p>
 * Implementations must return without waiting for delivery and must never throw back
 * into the caller: a notification problem cannot undo a committed payment transition.
 */
public interface Notifier {

    void publish(NotificationEvent event);
}
