package com.flagship.escrow_engine.payment;

import com.flagship.escrow_engine.exception.ResourceNotFoundException;
import com.flagship.escrow_engine.gateway.GatewayCapture;
import com.flagship.escrow_engine.gateway.GatewayProperties;
import com.flagship.escrow_engine.gateway.SimulatedPaymentGateway;
import com.flagship.escrow_engine.gateway.WebhookSignatureVerifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(GatewayWebhookController.class)
@Import(SimulatedPaymentGateway.class)
@EnableConfigurationProperties(GatewayProperties.class)
@TestPropertySource(properties = "escrow.gateway.webhook-secret=" + GatewayWebhookControllerTest.SECRET)
class GatewayWebhookControllerTest {

    static final String SECRET = "webhook-test-secret";

    private static final String CAPTURE_EVENT = """
            {"event_type":"PAYMENT.CAPTURE.COMPLETED",
             "resource":{"id":"CAP-9",
                         "payer":{"payer_id":"PAYER-1","email_address":"payer@example.com"},
                         "supplementary_data":{"related_ids":{"order_id":"ORDER-9"}}}}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PaymentLedgerService paymentLedger;

    @Test
    @DisplayName("A signed capture event confirms the payment")
    void testCaptureCompleted_Applied() throws Exception {
        when(paymentLedger.confirmCapture(eq("ORDER-9"), any())).thenReturn(Payment.builder()
            .id(UUID.randomUUID())
            .status(PaymentStatus.HELD_ESCROW)
            .build());

        send(CAPTURE_EVENT, sign(CAPTURE_EVENT))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("applied"));

        ArgumentCaptor<GatewayCapture> capture = ArgumentCaptor.forClass(GatewayCapture.class);
        verify(paymentLedger).confirmCapture(eq("ORDER-9"), capture.capture());
        assertEquals("CAP-9", capture.getValue().getCaptureId());
        assertEquals("PAYER-1", capture.getValue().getPayerId());
        assertEquals("payer@example.com", capture.getValue().getPayerEmail());
    }

    @Test
    @DisplayName("Other event types are acknowledged without action")
    void testOtherEvent_Ignored() throws Exception {
        String body = "{\"event_type\":\"CHECKOUT.ORDER.APPROVED\",\"resource\":{}}";

        send(body, sign(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ignored"));

        verify(paymentLedger, never()).confirmCapture(any(), any());
    }

    @Test
    @DisplayName("Captures of unknown orders are acknowledged so the provider stops retrying")
    void testUnknownOrder_Acknowledged() throws Exception {
        when(paymentLedger.confirmCapture(eq("ORDER-9"), any()))
            .thenThrow(new ResourceNotFoundException("Payment", "ORDER-9"));

        send(CAPTURE_EVENT, sign(CAPTURE_EVENT))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("unknown_order"));
    }

    @Test
    @DisplayName("A bad or missing signature is rejected with 401")
    void testBadSignature_Rejected() throws Exception {
        send(CAPTURE_EVENT, sign("{\"event_type\":\"other\"}"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.code").value("WEBHOOK_SIGNATURE_INVALID"));

        mockMvc.perform(post("/api/webhooks/payments")
                .contentType(MediaType.APPLICATION_JSON)
                .content(CAPTURE_EVENT))
            .andExpect(status().isUnauthorized());

        verify(paymentLedger, never()).confirmCapture(any(), any());
    }

    @Test
    @DisplayName("A capture event without ids is a validation error")
    void testCaptureWithoutIds_Rejected() throws Exception {
        String body = "{\"event_type\":\"PAYMENT.CAPTURE.COMPLETED\",\"resource\":{}}";

        send(body, sign(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    private ResultActions send(String body, String signature) throws Exception {
        return mockMvc.perform(post("/api/webhooks/payments")
            .contentType(MediaType.APPLICATION_JSON)
            .header(WebhookSignatureVerifier.SIGNATURE_HEADER, signature)
            .content(body));
    }

    private String sign(String body) {
        GatewayProperties properties = new GatewayProperties();
        properties.setWebhookSecret(SECRET);
        return new WebhookSignatureVerifier(properties).sign(body.getBytes(StandardCharsets.UTF_8));
    }
}
