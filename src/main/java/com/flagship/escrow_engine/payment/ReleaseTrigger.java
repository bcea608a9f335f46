package com.flagship.escrow_engine.payment;

/**
 * What caused held funds to be released.
 */
public enum ReleaseTrigger {
    REQUESTER_APPROVAL,
    AUTO_RELEASE,
    DISPUTE_RESOLUTION
}
