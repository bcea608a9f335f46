package com.flagship.escrow_engine.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes domain events to the outbox and tracks their publication.
 *
 * saveEvent joins the caller's transaction: an event exists if and only if the
 * state change it describes committed. Publication happens later in {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    /**
     * Serializes the payload and stores it in the current transaction.
     *
     * @param aggregateType "Contract", "Payment" or "Referral"; selects the topic
     * @param aggregateId   Kafka key, so events of one aggregate stay ordered
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId, String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.create(aggregateType, aggregateId, eventType, serializePayload(payload));
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));
        log.debug("Saved outbox event: type={}, aggregateType={}, aggregateId={}",
                eventType, aggregateType, aggregateId);
        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit) {
        return repository.findUnpublishedEventsForUpdate(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(Instant.now());
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            if (entity.getRetryCount() >= maxRetries) {
                log.error("Outbox event {} ({}) dead-lettered after {} attempts: {}",
                        eventId, entity.getEventType(), entity.getRetryCount(), errorMessage);
            } else {
                log.warn("Marked event {} as failed (retry #{}): {}", eventId, entity.getRetryCount(), errorMessage);
            }
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    /**
     * Deletes events published before the cutoff. Unpublished events are never removed.
     */
    @Transactional
    public int purgePublishedBefore(Instant cutoff) {
        int deleted = repository.deletePublishedEventsBefore(cutoff);
        if (deleted > 0) {
            log.info("Purged {} published outbox events older than {}", deleted, cutoff);
        }
        return deleted;
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
