package com.flagship.escrow_engine.exception;

/**
 * Base class for every failure the engine reports to its callers.
 * Each subclass carries a stable {@link ErrorCode}.
 */
public abstract class EscrowException extends RuntimeException {

    private final ErrorCode errorCode;

    protected EscrowException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected EscrowException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
