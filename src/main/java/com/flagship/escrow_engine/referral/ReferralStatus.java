package com.flagship.escrow_engine.referral;

/**
 * REGISTERED -> COMPLETED (referred user's first contract completed) -> CREDITED (reward applied).
 */
public enum ReferralStatus {
    REGISTERED,
    COMPLETED,
    CREDITED
}
