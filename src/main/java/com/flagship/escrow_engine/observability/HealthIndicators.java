package com.flagship.escrow_engine.observability;

import com.flagship.escrow_engine.outbox.OutboxEventRepository;
import org.apache.kafka.common.Metric;
import org.apache.kafka.common.MetricName;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Actuator health indicators for the pieces the engine leans on outside the database.
 */
public class HealthIndicators {

    /**
     * DOWN once the outbox backlog passes the critical threshold: events such as
     * ContractCompleted are then not reaching the referral consumer. Dead letters
     * alone raise WARNING.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxRepository = outboxRepository;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                long deadLetters = outboxRepository.countDeadLetters(maxRetries);

                Health.Builder builder;
                if (backlogSize >= BACKLOG_CRITICAL_THRESHOLD) {
                    builder = Health.down();
                } else if (backlogSize >= BACKLOG_WARNING_THRESHOLD || deadLetters > 0) {
                    builder = Health.status("WARNING");
                } else {
                    builder = Health.up();
                }

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("deadLetters", deadLetters)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Redis only caches gateway order lookups, so an outage reports DEGRADED, not DOWN.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            var connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return degraded("No connection factory configured");
            }
            try (var connection = connectionFactory.getConnection()) {
                String result = connection.ping();
                return "PONG".equals(result)
                        ? Health.up().withDetail("response", result).build()
                        : degraded("Unexpected ping response: " + result);
            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private static Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("fallback", "gateway order lookups read from the database")
                    .build();
        }
    }

    /**
     * Kafka carries outbox events and notifications. Reports the producer's open
     * broker connections; zero connections after a send attempt means DOWN.
     */
    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private static final String PRODUCER_GROUP = "producer-metrics";

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                Map<MetricName, ? extends Metric> metrics = kafkaTemplate.metrics();
                double connections = metric(metrics, "connection-count");
                double sendErrors = metric(metrics, "record-error-total");
                Health.Builder builder = connections > 0 ? Health.up() : Health.down();
                return builder
                        .withDetail("connections", (long) connections)
                        .withDetail("recordErrors", (long) sendErrors)
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }

        private static double metric(Map<MetricName, ? extends Metric> metrics, String name) {
            return metrics.entrySet().stream()
                    .filter(e -> PRODUCER_GROUP.equals(e.getKey().group()) && name.equals(e.getKey().name()))
                    .map(e -> e.getValue().metricValue())
                    .filter(Number.class::isInstance)
                    .mapToDouble(v -> ((Number) v).doubleValue())
                    .sum();
        }
    }
}
