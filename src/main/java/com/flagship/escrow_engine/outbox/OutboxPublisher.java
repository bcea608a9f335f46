package com.flagship.escrow_engine.outbox;

import com.flagship.escrow_engine.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Polls the outbox and publishes contract, payment and referral events to Kafka.
 *
 * Batches are claimed with SELECT FOR UPDATE SKIP LOCKED, so several instances
 * can publish concurrently. Sends are synchronous and keyed by aggregate id,
 * which keeps the events of one contract or payment in order on their partition.
 *
 * A failed send increments the retry count. Events reaching max-retries stay in
 * the table as dead letters: no longer selected, counted by {@link OutboxMetrics}.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.contracts:contracts}")
    private String contractsTopic;

    @Value("${kafka.topic.payments:payments}")
    private String paymentsTopic;

    @Value("${kafka.topic.referrals:referrals}")
    private String referralsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Value("${outbox.cleanup.retention-days:7}")
    private int retentionDays;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize);
            if (events.isEmpty()) {
                return;
            }
            log.debug("Found {} unpublished events to process", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        String topic = getTopicForEvent(event);
        String key = event.getAggregateId().toString();

        try {
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(topic, key, event.getPayload());
            SendResult<String, String> result = future.get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "Interrupted while publishing");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, topic={}, error={}",
                    event.getId(), event.getEventType(), topic, e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    /**
     * Drops published events past the retention period. The table only needs
     * unpublished events and recent history.
     */
    @Scheduled(cron = "${outbox.cleanup.cron:0 15 4 * * *}", zone = "UTC")
    public void purgePublishedEvents() {
        try {
            outboxService.purgePublishedBefore(Instant.now().minus(Duration.ofDays(retentionDays)));
        } catch (Exception e) {
            log.error("Outbox cleanup failed", e);
        }
    }

    /**
     * Routes by aggregate type. Unknown types fall back to the payments topic.
     */
    String getTopicForEvent(OutboxEvent event) {
        return switch (event.getAggregateType()) {
            case "Contract" -> contractsTopic;
            case "Referral" -> referralsTopic;
            default -> paymentsTopic;
        };
    }
}
