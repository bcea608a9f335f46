package com.flagship.escrow_engine.audit;

import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 signatures over {@link AuditLogEntry#canonicalForm()}.
 */
@Component
public class AuditSigner {

    private static final String ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;

    public AuditSigner(AuditProperties properties) {
        this.key = new SecretKeySpec(properties.getSigningSecret().getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    public String sign(AuditLogEntry entry) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            byte[] digest = mac.doFinal(entry.canonicalForm().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to sign audit entry", e);
        }
    }

    public boolean verify(AuditLogEntry entry) {
        if (entry.getSignature() == null) {
            return false;
        }
        byte[] expected = sign(entry).getBytes(StandardCharsets.UTF_8);
        byte[] actual = entry.getSignature().getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, actual);
    }
}
