package com.flagship.escrow_engine.gateway;

import com.flagship.escrow_engine.exception.WebhookSignatureException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Shared-secret webhook check used by the simulated provider: the X-Gateway-Signature
 * header carries the hex HMAC-SHA256 of the raw request body.
 */
public class WebhookSignatureVerifier {

    public static final String SIGNATURE_HEADER = "X-Gateway-Signature";
    private static final String ALGORITHM = "HmacSHA256";

    private final byte[] secret;

    public WebhookSignatureVerifier(GatewayProperties properties) {
        this.secret = properties.getWebhookSecret().getBytes(StandardCharsets.UTF_8);
    }

    public void verify(byte[] body, String signatureHeader) {
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new WebhookSignatureException("Missing " + SIGNATURE_HEADER + " header");
        }
        byte[] provided;
        try {
            provided = HexFormat.of().parseHex(signatureHeader.trim().toLowerCase());
        } catch (IllegalArgumentException e) {
            throw new WebhookSignatureException("Malformed webhook signature");
        }
        if (!MessageDigest.isEqual(hmac(body), provided)) {
            throw new WebhookSignatureException("Webhook signature does not match payload");
        }
    }

    public String sign(byte[] body) {
        return HexFormat.of().formatHex(hmac(body));
    }

    private byte[] hmac(byte[] body) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            return mac.doFinal(body);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
