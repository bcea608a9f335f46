package com.flagship.escrow_engine.consumer;

import com.flagship.escrow_engine.observability.EscrowMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Runs an event handler at most once per event and consumer group.
 *
 * The handler and the processed_events row share one transaction: either both
 * commit or the event is redelivered and runs again from scratch. A replayed
 * or duplicated delivery finds the row and is skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final EscrowMetrics metrics;

    /**
     * @return true if the handler ran, false if the event was already processed
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType,
                                String aggregateType, UUID aggregateId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            metrics.recordEventProcessed(eventType, false);
            return false;
        }

        try {
            handler.run();
            recordProcessed(ProcessedEvent.success(eventId, eventType, aggregateType, aggregateId, consumerGroup));
            metrics.recordEventProcessed(eventType, true);
            log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
            return true;
        } catch (RuntimeException e) {
            metrics.recordEventProcessingFailure(eventType, e.getClass().getSimpleName());
            log.error("Failed to process event {} ({}) by consumer group {}: {}",
                    eventId, eventType, consumerGroup, e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Records an event this consumer has no use for, so a replay does not look at it again.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType,
                          String aggregateType, UUID aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        recordProcessed(ProcessedEvent.skipped(eventId, eventType, aggregateType, aggregateId, consumerGroup, reason));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    private void recordProcessed(ProcessedEvent event) {
        repository.save(ProcessedEventEntity.fromDomain(event));
    }
}
