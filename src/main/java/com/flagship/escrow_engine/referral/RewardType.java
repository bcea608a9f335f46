package com.flagship.escrow_engine.referral;

public enum RewardType {
    TWO_FREE_CONTRACTS,
    ONE_FREE_CONTRACT,
    REDUCED_COMMISSION
}
