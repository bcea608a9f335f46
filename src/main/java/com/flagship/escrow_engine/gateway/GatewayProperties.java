package com.flagship.escrow_engine.gateway;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Payment gateway settings, bound from escrow.gateway.*.
 */
@ConfigurationProperties(prefix = "escrow.gateway")
@Getter
@Setter
public class GatewayProperties {

    /** simulated or paypal. */
    private String provider = "simulated";

    /** Unapproved orders older than this are treated as expired at the provider. */
    private Duration orderTtl = Duration.ofHours(3);

    /** Shared secret for X-Gateway-Signature on webhooks from the simulated provider. */
    private String webhookSecret = "change-me";

    private final RetrySettings retry = new RetrySettings();
    private final CircuitBreakerSettings circuitBreaker = new CircuitBreakerSettings();
    private final PayPal paypal = new PayPal();

    @Getter
    @Setter
    public static class RetrySettings {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double multiplier = 2.0;
    }

    @Getter
    @Setter
    public static class CircuitBreakerSettings {
        private float failureRateThreshold = 50;
        private int slidingWindowSize = 20;
        private int minimumNumberOfCalls = 10;
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class PayPal {
        private String baseUrl = "https://api-m.sandbox.paypal.com";
        private String clientId;
        private String clientSecret;
        private String returnUrl = "http://localhost:3000/payments/return";
        private String cancelUrl = "http://localhost:3000/payments/cancel";
        /** Id of the registered webhook, sent with every verify-webhook-signature call. */
        private String webhookId;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(20);
    }
}
