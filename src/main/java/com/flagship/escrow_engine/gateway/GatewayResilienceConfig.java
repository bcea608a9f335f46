package com.flagship.escrow_engine.gateway;

import com.flagship.escrow_engine.exception.GatewayRejectedException;
import com.flagship.escrow_engine.exception.GatewayUnavailableException;
import com.flagship.escrow_engine.observability.EscrowMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Retry and circuit breaker for gateway calls, exposed as beans so tests can
 * build fresh instances instead of sharing process-wide state.
 *
 * Retry Strategy:
 * - Exponential backoff, bounded attempts
 * - Only GatewayUnavailableException is retried
 *
 * Circuit Breaker Strategy:
 * - Only unavailability counts as failure; a rejection is a healthy answer
 */
@Configuration
@Slf4j
public class GatewayResilienceConfig {

    @Bean
    public Retry gatewayRetry(GatewayProperties properties) {
        GatewayProperties.RetrySettings settings = properties.getRetry();
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(settings.getMaxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                settings.getInitialBackoff().toMillis(), settings.getMultiplier()))
            .retryExceptions(GatewayUnavailableException.class)
            .ignoreExceptions(GatewayRejectedException.class)
            .build();
        log.info("Gateway retry configured: maxAttempts={}, initialBackoff={}",
                settings.getMaxAttempts(), settings.getInitialBackoff());
        return Retry.of("paymentGateway", config);
    }

    @Bean
    public CircuitBreaker gatewayCircuitBreaker(GatewayProperties properties) {
        GatewayProperties.CircuitBreakerSettings settings = properties.getCircuitBreaker();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
            .failureRateThreshold(settings.getFailureRateThreshold())
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(settings.getSlidingWindowSize())
            .minimumNumberOfCalls(settings.getMinimumNumberOfCalls())
            .waitDurationInOpenState(settings.getWaitDurationInOpenState())
            .recordExceptions(GatewayUnavailableException.class)
            .ignoreExceptions(GatewayRejectedException.class)
            .build();
        return CircuitBreaker.of("paymentGateway", config);
    }

    /**
     * The gateway the rest of the engine uses: the configured provider behind retry and circuit breaker.
     */
    @Bean
    @Primary
    public PaymentGateway paymentGateway(@Qualifier("providerGateway") PaymentGateway provider,
                                         Retry gatewayRetry,
                                         CircuitBreaker gatewayCircuitBreaker,
                                         EscrowMetrics metrics) {
        return new RetryingPaymentGateway(provider, gatewayRetry, gatewayCircuitBreaker, metrics);
    }
}
