package com.flagship.escrow_engine.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for contracts, escrow and gateway traffic.
 *
 * Metrics exposed:
 * - contracts.transitions: contract status changes, tagged from/to
 * - payments.lifecycle: payment status changes, tagged by status and kind
 * - escrow.released: escrow releases, tagged by trigger
 * - gateway.calls / gateway.latency: provider traffic by operation and outcome
 * - automation.sweep: contracts processed per sweep and outcome
 * - referral.rewards: referral rewards granted by tier
 */
@Component
public class EscrowMetrics {

    private final MeterRegistry registry;

    private final Counter duplicateWebhooks;

    public EscrowMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.duplicateWebhooks = Counter.builder("gateway.webhooks.duplicate")
                .description("Webhooks for captures that were already applied")
                .register(registry);
    }

    public void recordContractTransition(String from, String to) {
        registry.counter("contracts.transitions",
                "from", sanitizeTag(from),
                "to", sanitizeTag(to)
        ).increment();
    }

    public void recordPaymentStatus(String status, String kind) {
        registry.counter("payments.lifecycle",
                "status", sanitizeTag(status),
                "kind", sanitizeTag(kind)
        ).increment();
    }

    public void recordEscrowReleased(String trigger, String currency) {
        registry.counter("escrow.released",
                "trigger", sanitizeTag(trigger),
                "currency", sanitizeTag(currency)
        ).increment();
    }

    /**
     * Records one gateway call, retries included.
     */
    public void recordGatewayCall(String operation, String outcome, long durationMs) {
        registry.counter("gateway.calls",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
        registry.timer("gateway.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void incrementDuplicateWebhooks() {
        duplicateWebhooks.increment();
    }

    public void recordSweep(String sweep, String outcome, int count) {
        if (count <= 0) {
            return;
        }
        registry.counter("automation.sweep",
                "sweep", sanitizeTag(sweep),
                "outcome", sanitizeTag(outcome)
        ).increment(count);
    }

    public void recordReferralReward(int tier) {
        registry.counter("referral.rewards", "tier", String.valueOf(tier)).increment();
    }

    /**
     * Records an idempotency cache hit (order already mapped to a payment).
     */
    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    // ==================== Event Processing Metrics ====================

    public void recordEventProcessed(String eventType, boolean wasNew) {
        registry.counter("event.processed",
                "event_type", sanitizeTag(eventType),
                "was_new", String.valueOf(wasNew)
        ).increment();
    }

    public void recordEventProcessingFailure(String eventType, String error) {
        registry.counter("event.processing.failure",
                "event_type", sanitizeTag(eventType),
                "error", sanitizeTag(error)
        ).increment();
    }

    /**
     * Registers a gauge over the in-memory audit retry queue.
     */
    public void registerAuditRetryGauge(Supplier<Number> supplier) {
        Gauge.builder("audit.retry.pending", supplier, s -> s.get().doubleValue())
                .description("Audit entries waiting for a write retry")
                .strongReference(true)
                .register(registry);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
