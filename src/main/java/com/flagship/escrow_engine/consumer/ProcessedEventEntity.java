package com.flagship.escrow_engine.consumer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for processed_events, keyed by (event_id, consumer_group) so
 * independent consumer groups keep separate records of the same event.
 *
 * Always inserted, never merged: a concurrent duplicate fails on the primary key.
 */
@Entity
@Table(name = "processed_events")
@IdClass(ProcessedEventEntity.Key.class)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProcessedEventEntity implements Persistable<ProcessedEventEntity.Key> {

    @Id
    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Id
    @Column(name = "consumer_group", nullable = false, length = 100, updatable = false)
    private String consumerGroup;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "aggregate_type", nullable = false, length = 100)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false)
    private UUID aggregateId;

    @Column(name = "processed_at", nullable = false)
    private Instant processedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_result", length = 50)
    private ProcessedEvent.ProcessingResult processingResult;

    @Column(name = "note", columnDefinition = "TEXT")
    private String note;

    @Transient
    @Getter(AccessLevel.NONE)
    private boolean fresh = true;

    @Override
    public Key getId() {
        return new Key(eventId, consumerGroup);
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        fresh = false;
    }

    static ProcessedEventEntity fromDomain(ProcessedEvent event) {
        ProcessedEventEntity entity = new ProcessedEventEntity();
        entity.eventId = event.getEventId();
        entity.consumerGroup = event.getConsumerGroup();
        entity.eventType = event.getEventType();
        entity.aggregateType = event.getAggregateType();
        entity.aggregateId = event.getAggregateId();
        entity.processedAt = event.getProcessedAt();
        entity.processingResult = event.getResult();
        entity.note = event.getNote();
        return entity;
    }

    ProcessedEvent toDomain() {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
                processedAt, processingResult, note);
    }

    @NoArgsConstructor
    @EqualsAndHashCode
    public static class Key implements Serializable {
        private UUID eventId;
        private String consumerGroup;

        public Key(UUID eventId, String consumerGroup) {
            this.eventId = eventId;
            this.consumerGroup = consumerGroup;
        }
    }
}
