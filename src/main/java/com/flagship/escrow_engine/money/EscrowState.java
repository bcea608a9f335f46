package com.flagship.escrow_engine.money;

/**
 * Where the contract's escrowed funds currently are.
 * Stored as text in contracts.escrow_status.
 */
public enum EscrowState {
    /** No captured funds yet. */
    PENDING,
    /** Funds captured and withheld from the worker. */
    HELD,
    /** Funds released to the worker. */
    RELEASED,
    /** Funds returned to the requester. */
    REFUNDED
}
