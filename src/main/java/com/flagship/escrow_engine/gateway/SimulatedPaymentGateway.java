package com.flagship.escrow_engine.gateway;

import com.flagship.escrow_engine.exception.GatewayRejectedException;
import com.flagship.escrow_engine.money.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory provider for local runs. Orders are approved as soon as they are created.
 * Webhooks are signed with the shared webhook secret.
 */
@Component("providerGateway")
@ConditionalOnProperty(name = "escrow.gateway.provider", havingValue = "simulated", matchIfMissing = true)
@Slf4j
public class SimulatedPaymentGateway implements PaymentGateway {

    private final Map<String, Money> orders = new ConcurrentHashMap<>();
    private final Map<String, String> captures = new ConcurrentHashMap<>();
    private final Map<String, String> refunds = new ConcurrentHashMap<>();
    private final WebhookSignatureVerifier signatureVerifier;

    public SimulatedPaymentGateway(GatewayProperties properties) {
        this.signatureVerifier = new WebhookSignatureVerifier(properties);
    }

    @Override
    public GatewayOrder createOrder(Money amount, String description, String contractRef) {
        String orderId = "SIM-" + UUID.randomUUID();
        orders.put(orderId, amount);
        log.info("Simulated order created: orderId={}, amount={}, ref={}", orderId, amount, contractRef);
        return new GatewayOrder(orderId, "https://gateway.local/approve/" + orderId);
    }

    @Override
    public GatewayCapture captureOrder(String orderId) {
        if (!orders.containsKey(orderId)) {
            throw new GatewayRejectedException("ORDER_NOT_FOUND", "Unknown order " + orderId);
        }
        String captureId = captures.computeIfAbsent(orderId, id -> "CAP-" + UUID.randomUUID());
        return new GatewayCapture(captureId, "SIM-PAYER", "payer@gateway.local");
    }

    @Override
    public GatewayRefund refund(String captureId, Money amount) {
        if (!captures.containsValue(captureId)) {
            throw new GatewayRejectedException("CAPTURE_NOT_FOUND", "Unknown capture " + captureId);
        }
        String refundId = refunds.computeIfAbsent(captureId, id -> "REF-" + UUID.randomUUID());
        return new GatewayRefund(refundId);
    }

    @Override
    public void verifyWebhook(HttpHeaders headers, byte[] body) {
        signatureVerifier.verify(body, headers.getFirst(WebhookSignatureVerifier.SIGNATURE_HEADER));
    }
}
