package com.flagship.escrow_engine.exception;

/**
 * Transient gateway failure (timeout, 5xx, connection reset). Safe to retry.
 */
public class GatewayUnavailableException extends EscrowException {

    public GatewayUnavailableException(String message) {
        super(ErrorCode.GATEWAY_UNAVAILABLE, message);
    }

    public GatewayUnavailableException(String message, Throwable cause) {
        super(ErrorCode.GATEWAY_UNAVAILABLE, message, cause);
    }
}
