package com.flagship.escrow_engine.payment;

/**
 * Payment status.
 *
 * PENDING -> HELD_ESCROW -> COMPLETED, PENDING | HELD_ESCROW -> REFUNDED, PENDING -> FAILED.
 */
public enum PaymentStatus {
    /**
     * Recorded locally; a gateway order may or may not exist yet.
     */
    PENDING,

    /**
     * Captured and held for the worker until release.
     */
    HELD_ESCROW,

    /**
     * Paid out (escrow released, or captured on a contract without escrow).
     * Terminal.
     */
    COMPLETED,

    /**
     * Returned to the payer. Terminal.
     */
    REFUNDED,

    /**
     * Rejected by the gateway or expired before approval. Terminal.
     */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == REFUNDED || this == FAILED;
    }

    /**
     * Counts towards what the contract has already been charged.
     */
    public boolean isFunding() {
        return this == PENDING || this == HELD_ESCROW || this == COMPLETED;
    }
}
