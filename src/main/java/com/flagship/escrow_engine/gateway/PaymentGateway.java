package com.flagship.escrow_engine.gateway;

import com.flagship.escrow_engine.money.Money;
import org.springframework.http.HttpHeaders;

/**
 * Uniform interface over external payment providers.
 *
 * Every operation fails with either
 * {@link com.flagship.escrow_engine.exception.GatewayUnavailableException} (transient, retryable) or
 * {@link com.flagship.escrow_engine.exception.GatewayRejectedException} (terminal, never retried).
 * Callers never branch on which provider is behind it.
 */
public interface PaymentGateway {

    /**
     * Opens an order the payer must approve at the returned URL.
     */
    GatewayOrder createOrder(Money amount, String description, String contractRef);

    /**
     * Captures an approved order.
     */
    GatewayCapture captureOrder(String orderId);

    /**
     * Refunds a capture.
     *
     * @param amount amount to refund, or null for the full capture
     */
    GatewayRefund refund(String captureId, Money amount);

    /**
     * Checks that a webhook was sent by the provider. Runs on the raw body, before it is trusted.
     *
     * @throws com.flagship.escrow_engine.exception.WebhookSignatureException when it was not
     */
    void verifyWebhook(HttpHeaders headers, byte[] body);
}
