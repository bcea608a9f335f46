package com.flagship.escrow_engine.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.escrow_engine.exception.GatewayRejectedException;
import com.flagship.escrow_engine.exception.GatewayUnavailableException;
import com.flagship.escrow_engine.exception.WebhookSignatureException;
import com.flagship.escrow_engine.money.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * PayPal Orders v2 provider.
 *
 * Access tokens come from the client-credentials grant and are cached until shortly
 * before they expire. HTTP 5xx and I/O errors are reported as unavailable, 4xx as rejected.
 * Webhooks are checked with the verify-webhook-signature API against the configured webhook id.
 */
@Component("providerGateway")
@ConditionalOnProperty(name = "escrow.gateway.provider", havingValue = "paypal")
@Slf4j
public class PayPalPaymentGateway implements PaymentGateway {

    static final List<String> TRANSMISSION_HEADERS = List.of(
        "PAYPAL-AUTH-ALGO", "PAYPAL-CERT-URL", "PAYPAL-TRANSMISSION-ID",
        "PAYPAL-TRANSMISSION-SIG", "PAYPAL-TRANSMISSION-TIME");

    private final RestClient restClient;
    private final GatewayProperties.PayPal settings;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private volatile String accessToken;
    private volatile Instant accessTokenExpiry = Instant.EPOCH;

    @Autowired
    public PayPalPaymentGateway(RestClient.Builder builder, GatewayProperties properties,
                                ObjectMapper objectMapper, Clock clock) {
        this(builder.baseUrl(properties.getPaypal().getBaseUrl())
                .requestFactory(requestFactory(properties.getPaypal()))
                .build(),
            properties, objectMapper, clock);
    }

    PayPalPaymentGateway(RestClient restClient, GatewayProperties properties,
                         ObjectMapper objectMapper, Clock clock) {
        this.restClient = restClient;
        this.settings = properties.getPaypal();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    private static SimpleClientHttpRequestFactory requestFactory(GatewayProperties.PayPal settings) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) settings.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) settings.getReadTimeout().toMillis());
        return requestFactory;
    }

    @Override
    public GatewayOrder createOrder(Money amount, String description, String contractRef) {
        Map<String, Object> purchaseUnit = new LinkedHashMap<>();
        purchaseUnit.put("reference_id", contractRef);
        purchaseUnit.put("description", description);
        purchaseUnit.put("amount", amountBody(amount));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("intent", "CAPTURE");
        body.put("purchase_units", List.of(purchaseUnit));
        body.put("application_context", Map.of(
            "return_url", settings.getReturnUrl(),
            "cancel_url", settings.getCancelUrl(),
            "user_action", "PAY_NOW"));

        JsonNode response = exchange("create_order", () -> restClient.post()
            .uri("/v2/checkout/orders")
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + token())
            .contentType(MediaType.APPLICATION_JSON)
            .body(body)
            .retrieve()
            .body(JsonNode.class));

        String orderId = response.path("id").asText(null);
        String approvalUrl = null;
        for (JsonNode link : response.path("links")) {
            String rel = link.path("rel").asText();
            if ("approve".equals(rel) || "payer-action".equals(rel)) {
                approvalUrl = link.path("href").asText();
            }
        }
        if (orderId == null || approvalUrl == null) {
            throw new GatewayRejectedException("MALFORMED_RESPONSE", "Order response lacks id or approval link");
        }
        log.info("PayPal order created: orderId={}, ref={}", orderId, contractRef);
        return new GatewayOrder(orderId, approvalUrl);
    }

    @Override
    public GatewayCapture captureOrder(String orderId) {
        JsonNode response = exchange("capture_order", () -> restClient.post()
            .uri("/v2/checkout/orders/{orderId}/capture", orderId)
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + token())
            .header("PayPal-Request-Id", "capture-" + orderId)
            .contentType(MediaType.APPLICATION_JSON)
            .body(Map.of())
            .retrieve()
            .body(JsonNode.class));

        String status = response.path("status").asText();
        JsonNode capture = response.path("purchase_units").path(0).path("payments").path("captures").path(0);
        if (!"COMPLETED".equals(status) || capture.isMissingNode()) {
            throw new GatewayRejectedException(status.isEmpty() ? "CAPTURE_INCOMPLETE" : status,
                    "Order " + orderId + " was not captured");
        }
        JsonNode payer = response.path("payer");
        return new GatewayCapture(
            capture.path("id").asText(),
            payer.path("payer_id").asText(null),
            payer.path("email_address").asText(null));
    }

    @Override
    public GatewayRefund refund(String captureId, Money amount) {
        Map<String, Object> body = amount != null ? Map.of("amount", amountBody(amount)) : Map.of();
        JsonNode response = exchange("refund", () -> restClient.post()
            .uri("/v2/payments/captures/{captureId}/refund", captureId)
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + token())
            .header("PayPal-Request-Id", "refund-" + captureId)
            .contentType(MediaType.APPLICATION_JSON)
            .body(body)
            .retrieve()
            .body(JsonNode.class));
        return new GatewayRefund(response.path("id").asText());
    }

    @Override
    public void verifyWebhook(HttpHeaders headers, byte[] body) {
        if (settings.getWebhookId() == null || settings.getWebhookId().isBlank()) {
            throw new WebhookSignatureException("No PayPal webhook id configured");
        }
        Map<String, Object> request = new LinkedHashMap<>();
        for (String header : TRANSMISSION_HEADERS) {
            String value = headers.getFirst(header);
            if (value == null || value.isBlank()) {
                throw new WebhookSignatureException("Missing webhook header " + header);
            }
            request.put(header.substring("PAYPAL-".length()).toLowerCase(Locale.ROOT).replace('-', '_'), value);
        }
        request.put("webhook_id", settings.getWebhookId());
        request.put("webhook_event", webhookEvent(body));

        JsonNode response;
        try {
            response = exchange("verify_webhook", () -> restClient.post()
                .uri("/v1/notifications/verify-webhook-signature")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token())
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(JsonNode.class));
        } catch (GatewayRejectedException e) {
            throw new WebhookSignatureException("PayPal refused to verify webhook: " + e.getProviderCode());
        }
        String status = response.path("verification_status").asText("");
        if (!"SUCCESS".equals(status)) {
            log.warn("PayPal webhook verification failed: transmissionId={}, status={}",
                    request.get("transmission_id"), status);
            throw new WebhookSignatureException("PayPal webhook verification status " + status);
        }
    }

    private JsonNode webhookEvent(byte[] body) {
        try {
            JsonNode event = objectMapper.readTree(body);
            if (event == null || !event.isObject()) {
                throw new WebhookSignatureException("Webhook body is not a JSON object");
            }
            return event;
        } catch (IOException e) {
            throw new WebhookSignatureException("Webhook body is not valid JSON");
        }
    }

    private Map<String, Object> amountBody(Money amount) {
        return Map.of(
            "currency_code", amount.getCurrency().name(),
            "value", amount.toMajor().setScale(amount.getCurrency().getMinorDigits(), RoundingMode.UNNECESSARY)
                .toPlainString());
    }

    private String token() {
        if (accessToken != null && clock.instant().isBefore(accessTokenExpiry)) {
            return accessToken;
        }
        synchronized (this) {
            if (accessToken != null && clock.instant().isBefore(accessTokenExpiry)) {
                return accessToken;
            }
            MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
            form.add("grant_type", "client_credentials");
            JsonNode response = exchange("oauth_token", () -> restClient.post()
                .uri("/v1/oauth2/token")
                .headers(headers -> headers.setBasicAuth(settings.getClientId(), settings.getClientSecret()))
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .body(JsonNode.class));
            accessToken = response.path("access_token").asText();
            long expiresIn = response.path("expires_in").asLong(300);
            accessTokenExpiry = clock.instant().plusSeconds(Math.max(0, expiresIn - 60));
            return accessToken;
        }
    }

    private JsonNode exchange(String operation, Supplier<JsonNode> call) {
        try {
            JsonNode response = call.get();
            if (response == null) {
                throw new GatewayUnavailableException("Empty response from PayPal on " + operation);
            }
            return response;
        } catch (HttpServerErrorException e) {
            throw new GatewayUnavailableException(
                "PayPal " + operation + " failed with " + e.getStatusCode(), e);
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == 429) {
                throw new GatewayUnavailableException("PayPal rate limited " + operation, e);
            }
            if (e.getStatusCode().value() == 401) {
                accessToken = null;
            }
            String issue = issueOf(e);
            throw new GatewayRejectedException(issue, "PayPal rejected " + operation + ": " + issue);
        } catch (ResourceAccessException e) {
            throw new GatewayUnavailableException("PayPal unreachable on " + operation, e);
        }
    }

    private String issueOf(HttpClientErrorException e) {
        try {
            JsonNode error = e.getResponseBodyAs(JsonNode.class);
            if (error != null) {
                String issue = error.path("details").path(0).path("issue").asText(null);
                if (issue != null) {
                    return issue;
                }
                return error.path("name").asText(e.getStatusCode().toString());
            }
        } catch (RuntimeException parseFailure) {
            log.debug("Unparseable PayPal error body: {}", parseFailure.getMessage());
        }
        return e.getStatusCode().toString();
    }
}
