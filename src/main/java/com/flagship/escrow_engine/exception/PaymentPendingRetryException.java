package com.flagship.escrow_engine.exception;

/**
 * The gateway stayed unavailable for every retry attempt. The payment is left
 * in its last valid state and the caller may try again later.
 */
public class PaymentPendingRetryException extends EscrowException {

    public PaymentPendingRetryException(String message, Throwable cause) {
        super(ErrorCode.PAYMENT_PENDING_RETRY, message, cause);
    }
}
