package com.flagship.escrow_engine.payment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.escrow_engine.exception.ResourceNotFoundException;
import com.flagship.escrow_engine.exception.ValidationException;
import com.flagship.escrow_engine.gateway.GatewayCapture;
import com.flagship.escrow_engine.gateway.PaymentGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.Map;

/**
 * Receives gateway notifications. The provider verifies the raw body and
 * headers before anything is parsed.
 *
 * Only completed captures change state; they go through the same idempotent
 * path as client captures. Events for orders this service does not know are
 * acknowledged so the gateway stops redelivering them.
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
@Slf4j
public class GatewayWebhookController {

    static final String CAPTURE_COMPLETED = "PAYMENT.CAPTURE.COMPLETED";

    private final PaymentGateway paymentGateway;
    private final PaymentLedgerService paymentLedger;
    private final ObjectMapper objectMapper;

    @PostMapping("/payments")
    public ResponseEntity<Map<String, String>> receive(
            @RequestBody byte[] body,
            @RequestHeader HttpHeaders headers) {
        paymentGateway.verifyWebhook(headers, body);

        JsonNode event = parse(body);
        String eventType = event.path("event_type").asText("");
        JsonNode resource = event.path("resource");

        if (!CAPTURE_COMPLETED.equals(eventType)) {
            log.info("Webhook {} acknowledged without action", eventType);
            return ResponseEntity.ok(Map.of("status", "ignored"));
        }

        String orderId = resource.path("supplementary_data").path("related_ids").path("order_id").asText(null);
        String captureId = resource.path("id").asText(null);
        if (orderId == null || captureId == null) {
            throw new ValidationException("Capture webhook without order or capture id");
        }
        GatewayCapture capture = new GatewayCapture(captureId,
                resource.path("payer").path("payer_id").asText(null),
                resource.path("payer").path("email_address").asText(null));

        try {
            Payment payment = paymentLedger.confirmCapture(orderId, capture);
            log.info("Capture webhook applied: orderId={}, paymentId={}, status={}",
                    orderId, payment.getId(), payment.getStatus());
            return ResponseEntity.ok(Map.of("status", "applied"));
        } catch (ResourceNotFoundException e) {
            log.warn("Capture webhook for unknown order {}: {}", orderId, e.getMessage());
            return ResponseEntity.ok(Map.of("status", "unknown_order"));
        }
    }

    private JsonNode parse(byte[] body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node == null || !node.isObject()) {
                throw new ValidationException("Webhook body must be a JSON object");
            }
            return node;
        } catch (IOException e) {
            throw new ValidationException("Webhook body is not valid JSON");
        }
    }
}
