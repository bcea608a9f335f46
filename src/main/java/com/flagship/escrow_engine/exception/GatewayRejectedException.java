package com.flagship.escrow_engine.exception;

/**
 * Terminal gateway failure such as insufficient funds or an expired order.
 * Never retried.
 */
public class GatewayRejectedException extends EscrowException {

    private final String providerCode;

    public GatewayRejectedException(String providerCode, String message) {
        super(ErrorCode.GATEWAY_REJECTED, message);
        this.providerCode = providerCode;
    }

    public String getProviderCode() {
        return providerCode;
    }
}
