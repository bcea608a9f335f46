package com.flagship.escrow_engine.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.escrow_engine.contract.event.ContractCompletedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.UUID;

/**
 * Kafka consumer for the contracts topic.
 *
 * Offsets are acknowledged manually and only after the event was handled, so
 * a crash redelivers it; the processed_events table makes that replay a no-op.
 * Payloads that cannot be parsed are logged and acknowledged.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ContractEventConsumer {

    static final String CONSUMER_GROUP = "contract-referral-consumer";
    private static final String AGGREGATE_TYPE = "Contract";

    private final IdempotentEventProcessor eventProcessor;
    private final ContractEventHandler eventHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.contracts:contracts}",
        groupId = "${spring.kafka.consumer.group-id:escrow-engine-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        JsonNode node = parse(record.value());
        if (node == null) {
            log.warn("Could not parse contract event at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        UUID eventId = UUID.fromString(node.get("eventId").asText());
        UUID contractId = UUID.fromString(node.get("contractId").asText());
        String eventType = node.path("eventType").asText("");

        try {
            boolean processed = route(node, eventId, contractId, eventType);
            ack.acknowledge();
            if (processed) {
                log.info("Processed event: type={}, eventId={}, contractId={}", eventType, eventId, contractId);
            }
        } catch (RuntimeException e) {
            log.error("Error processing event {} at offset {}: {}", eventId, record.offset(), e.getMessage(), e);
            throw e;
        }
    }

    private boolean route(JsonNode node, UUID eventId, UUID contractId, String eventType) {
        if (ContractCompletedEvent.EVENT_TYPE.equals(eventType)) {
            UUID requesterId = UUID.fromString(node.get("requesterId").asText());
            UUID workerId = UUID.fromString(node.get("workerId").asText());
            Instant completedAt = node.hasNonNull("occurredAt")
                ? Instant.parse(node.get("occurredAt").asText())
                : null;
            return eventProcessor.processEvent(eventId, eventType, AGGREGATE_TYPE, contractId, CONSUMER_GROUP,
                    () -> eventHandler.onContractCompleted(contractId, requesterId, workerId, completedAt));
        }
        eventProcessor.skipEvent(eventId, eventType, AGGREGATE_TYPE, contractId, CONSUMER_GROUP,
                "Not relevant to referrals");
        return false;
    }

    private JsonNode parse(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.hasNonNull("eventId") || !node.hasNonNull("contractId")) {
                return null;
            }
            UUID.fromString(node.get("eventId").asText());
            UUID.fromString(node.get("contractId").asText());
            return node;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to parse contract event: {}", e.getMessage());
            return null;
        }
    }
}
