package com.flagship.escrow_engine.gateway;

import lombok.Value;

/**
 * Result of a successful capture, whether reported by a capture call or a webhook.
 */
@Value
public class GatewayCapture {
    String captureId;
    String payerId;
    String payerEmail;
}
