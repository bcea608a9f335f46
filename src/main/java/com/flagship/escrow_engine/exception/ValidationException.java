package com.flagship.escrow_engine.exception;

/**
 * Bad input. Rejected before any state is touched.
 */
public class ValidationException extends EscrowException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
