package com.flagship.escrow_engine.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.escrow_engine.exception.WebhookSignatureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class PayPalPaymentGatewayTest {

    private static final String BASE_URL = "https://paypal.test";
    private static final byte[] EVENT = """
            {"id":"WH-1","event_type":"PAYMENT.CAPTURE.COMPLETED","resource":{"id":"CAP-1"}}
            """.getBytes(StandardCharsets.UTF_8);

    private MockRestServiceServer server;
    private GatewayProperties properties;
    private PayPalPaymentGateway gateway;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getPaypal().setBaseUrl(BASE_URL);
        properties.getPaypal().setClientId("client");
        properties.getPaypal().setClientSecret("secret");
        properties.getPaypal().setWebhookId("WH-CONFIG-1");

        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        gateway = new PayPalPaymentGateway(builder.build(), properties, new ObjectMapper(),
                Clock.fixed(Instant.parse("2026-06-01T08:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Transmission headers and the webhook id are sent to PayPal for verification")
    void testVerifyWebhook_Success() {
        expectToken();
        server.expect(requestTo(BASE_URL + "/v1/notifications/verify-webhook-signature"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer TOKEN-1"))
            .andExpect(jsonPath("$.webhook_id").value("WH-CONFIG-1"))
            .andExpect(jsonPath("$.transmission_id").value("TX-1"))
            .andExpect(jsonPath("$.auth_algo").value("SHA256withRSA"))
            .andExpect(jsonPath("$.webhook_event.resource.id").value("CAP-1"))
            .andRespond(withSuccess("{\"verification_status\":\"SUCCESS\"}", MediaType.APPLICATION_JSON));

        assertDoesNotThrow(() -> gateway.verifyWebhook(transmissionHeaders(), EVENT));
        server.verify();
    }

    @Test
    @DisplayName("A FAILURE verification status rejects the webhook")
    void testVerifyWebhook_Failure() {
        expectToken();
        server.expect(requestTo(BASE_URL + "/v1/notifications/verify-webhook-signature"))
            .andRespond(withSuccess("{\"verification_status\":\"FAILURE\"}", MediaType.APPLICATION_JSON));

        assertThrows(WebhookSignatureException.class, () -> gateway.verifyWebhook(transmissionHeaders(), EVENT));
        server.verify();
    }

    @Test
    @DisplayName("A verification request PayPal refuses rejects the webhook")
    void testVerifyWebhook_PayPalRefuses() {
        expectToken();
        server.expect(requestTo(BASE_URL + "/v1/notifications/verify-webhook-signature"))
            .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"name\":\"VALIDATION_ERROR\"}"));

        assertThrows(WebhookSignatureException.class, () -> gateway.verifyWebhook(transmissionHeaders(), EVENT));
    }

    @Test
    @DisplayName("Missing transmission headers or webhook id reject without calling PayPal")
    void testVerifyWebhook_MissingInputs() {
        HttpHeaders partial = transmissionHeaders();
        partial.remove("PAYPAL-TRANSMISSION-SIG");
        assertThrows(WebhookSignatureException.class, () -> gateway.verifyWebhook(partial, EVENT));

        properties.getPaypal().setWebhookId(null);
        assertThrows(WebhookSignatureException.class, () -> gateway.verifyWebhook(transmissionHeaders(), EVENT));

        server.verify();
    }

    private void expectToken() {
        server.expect(requestTo(BASE_URL + "/v1/oauth2/token"))
            .andExpect(method(HttpMethod.POST))
            .andRespond(withSuccess("{\"access_token\":\"TOKEN-1\",\"expires_in\":3600}",
                    MediaType.APPLICATION_JSON));
    }

    private HttpHeaders transmissionHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.add("PAYPAL-AUTH-ALGO", "SHA256withRSA");
        headers.add("PAYPAL-CERT-URL", "https://api.paypal.com/certs/CERT-1");
        headers.add("PAYPAL-TRANSMISSION-ID", "TX-1");
        headers.add("PAYPAL-TRANSMISSION-SIG", "c2lnbmF0dXJl");
        headers.add("PAYPAL-TRANSMISSION-TIME", "2026-06-01T07:59:58Z");
        return headers;
    }
}
