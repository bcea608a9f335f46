package com.flagship.escrow_engine.notification;

/**
 * Fire-and-forget delivery. Implementations never throw: a lost notification
 * must not undo the transition that caused it.
 */
public interface NotificationService {

    void send(Notification notification);
}
