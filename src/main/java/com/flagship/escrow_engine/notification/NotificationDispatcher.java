package com.flagship.escrow_engine.notification;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Sends notifications once the current transaction has committed, so a
 * rolled-back transition never produces a message. Outside a transaction
 * the notification is sent immediately.
 */
@Component
@RequiredArgsConstructor
public class NotificationDispatcher {

    private final NotificationService notificationService;

    public void sendAfterCommit(Notification notification) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    notificationService.send(notification);
                }
            });
        } else {
            notificationService.send(notification);
        }
    }
}
