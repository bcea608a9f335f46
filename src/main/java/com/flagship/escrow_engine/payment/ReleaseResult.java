package com.flagship.escrow_engine.payment;

import lombok.Value;

/**
 * Outcome of a release call. transitioned is false when the payment had already been
 * released, so callers notify only on the call that moved the money.
 */
@Value
public class ReleaseResult {
    Payment payment;
    boolean transitioned;
}
