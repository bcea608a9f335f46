package com.flagship.escrow_engine.payment;

/**
 * INITIAL funds the contract and starts the work once captured.
 * EXTENSION_TOP_UP covers a price increase accepted after the initial capture.
 */
public enum PaymentKind {
    INITIAL,
    EXTENSION_TOP_UP
}
