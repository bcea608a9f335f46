package com.flagship.escrow_engine.notification;

import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A message for one user. Content and delivery channel are decided downstream.
 */
@Value
public class Notification {
    UUID notificationId;
    UUID recipientId;
    NotificationType type;
    UUID contractId;
    Map<String, String> data;
    Instant createdAt;

    public static Notification of(UUID recipientId, NotificationType type, UUID contractId,
                                  Map<String, String> data, Instant now) {
        return new Notification(UUID.randomUUID(), recipientId, type, contractId,
                data != null ? Map.copyOf(data) : Map.of(), now);
    }
}
