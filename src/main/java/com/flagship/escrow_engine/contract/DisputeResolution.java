package com.flagship.escrow_engine.contract;

public enum DisputeResolution {
    /** Held funds go to the worker; the contract completes. */
    RELEASE_TO_WORKER,
    /** Held funds return to the requester; the contract is cancelled. */
    REFUND_TO_REQUESTER
}
