package com.flagship.escrow_engine.exception;

import com.flagship.escrow_engine.money.CurrencyCode;

public class CurrencyMismatchException extends ValidationException {

    public CurrencyMismatchException(CurrencyCode left, CurrencyCode right) {
        super(ErrorCode.CURRENCY_MISMATCH,
            String.format("Cannot combine amounts in %s and %s", left, right));
    }
}
