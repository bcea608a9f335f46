package com.flagship.escrow_engine.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable error codes returned to API clients.
 *
 * The code names are part of the public contract: clients branch on them,
 * so existing values must never be renamed.
 */
public enum ErrorCode {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    INVALID_AMOUNT(HttpStatus.BAD_REQUEST),
    CURRENCY_MISMATCH(HttpStatus.BAD_REQUEST),
    ALLOCATION_EXCEEDED(HttpStatus.BAD_REQUEST),
    PAIRING_CODE_MISMATCH(HttpStatus.BAD_REQUEST),
    PAIRING_EXPIRED(HttpStatus.BAD_REQUEST),
    REFERRAL_CAP_REACHED(HttpStatus.BAD_REQUEST),
    NOT_A_PARTY(HttpStatus.FORBIDDEN),
    ACTION_NOT_ALLOWED(HttpStatus.FORBIDDEN),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INVALID_TRANSITION(HttpStatus.CONFLICT),
    CONCURRENT_MODIFICATION(HttpStatus.CONFLICT),
    GATEWAY_REJECTED(HttpStatus.PAYMENT_REQUIRED),
    GATEWAY_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    PAYMENT_PENDING_RETRY(HttpStatus.SERVICE_UNAVAILABLE),
    WEBHOOK_SIGNATURE_INVALID(HttpStatus.UNAUTHORIZED),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
