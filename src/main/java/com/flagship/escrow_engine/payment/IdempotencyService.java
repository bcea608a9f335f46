package com.flagship.escrow_engine.payment;

import com.flagship.escrow_engine.observability.EscrowMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves gateway order ids to payment ids.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to database (slower, but always available)
 * 3. Cache database hits in Redis for the next lookup
 *
 * Webhooks and client captures for the same order both go through here, so the
 * mapping stays correct even when Redis is down: the unique gateway_order_id
 * column is the source of truth.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "escrow:order:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final PaymentRepository paymentRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;
    private final EscrowMetrics metrics;

    public IdempotencyService(PaymentRepository paymentRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate,
                              EscrowMetrics metrics) {
        this.paymentRepository = paymentRepository;
        this.redisTemplate = redisTemplate;
        this.metrics = metrics;
    }

    /**
     * @return payment id owning the order, empty if no payment carries it
     */
    public Optional<UUID> resolvePaymentId(String gatewayOrderId) {
        if (gatewayOrderId == null || gatewayOrderId.isBlank()) {
            throw new IllegalArgumentException("Gateway order id cannot be null or blank");
        }

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + gatewayOrderId);
                if (cached != null) {
                    metrics.recordIdempotencyHit();
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for order {}. Falling back to database. Error: {}",
                        gatewayOrderId, e.getMessage());
            }
        }

        metrics.recordIdempotencyMiss();
        Optional<UUID> paymentId = paymentRepository.findByGatewayOrderId(gatewayOrderId)
            .map(PaymentEntity::getId);
        paymentId.ifPresent(id -> remember(gatewayOrderId, id));
        return paymentId;
    }

    /**
     * Caches an order mapping. Best effort; the database row is authoritative.
     */
    public void remember(String gatewayOrderId, UUID paymentId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + gatewayOrderId, paymentId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.debug("Failed to cache order {} in Redis: {}", gatewayOrderId, e.getMessage());
        }
    }
}
