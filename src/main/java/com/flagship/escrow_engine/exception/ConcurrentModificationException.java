package com.flagship.escrow_engine.exception;

/**
 * Lost a race on a guarded, non-idempotent transition.
 * Idempotent operations (capture, release) never surface this.
 */
public class ConcurrentModificationException extends EscrowException {

    public ConcurrentModificationException(String message) {
        super(ErrorCode.CONCURRENT_MODIFICATION, message);
    }

    public ConcurrentModificationException(String message, Throwable cause) {
        super(ErrorCode.CONCURRENT_MODIFICATION, message, cause);
    }
}
