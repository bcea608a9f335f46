package com.flagship.escrow_engine.exception;

public class InvalidAmountException extends ValidationException {

    public InvalidAmountException(String message) {
        super(ErrorCode.INVALID_AMOUNT, message);
    }
}
