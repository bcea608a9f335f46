package com.flagship.escrow_engine.exception;

public class WebhookSignatureException extends EscrowException {

    public WebhookSignatureException(String message) {
        super(ErrorCode.WEBHOOK_SIGNATURE_INVALID, message);
    }
}
