package com.flagship.escrow_engine.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A domain event waiting in the outbox.
 *
 * Written in the transaction that changes the contract, payment or referral it
 * describes, and published to Kafka by {@link OutboxPublisher} afterwards.
 * The sequence number is assigned by the database and orders events of one aggregate.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType, String payload) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType, payload,
                Instant.now(), null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
