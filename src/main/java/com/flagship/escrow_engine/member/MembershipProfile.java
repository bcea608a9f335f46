package com.flagship.escrow_engine.member;

import com.flagship.escrow_engine.commission.MembershipTier;
import com.flagship.escrow_engine.money.CommissionRate;
import lombok.Value;

import java.util.UUID;

/**
 * Read model of a member as the engine sees it.
 */
@Value
public class MembershipProfile {
    UUID userId;
    String displayName;
    String email;
    MembershipTier tier;
    int freeContractsRemaining;
    CommissionRate currentCommissionRate;
    boolean identityVerified;
    String referralCode;
    boolean earlyAdopter;
}
