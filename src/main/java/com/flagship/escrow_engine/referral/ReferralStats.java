package com.flagship.escrow_engine.referral;

import com.flagship.escrow_engine.money.CommissionRate;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ReferralStats {
    String referralCode;
    int totalReferrals;
    int completedReferrals;
    int maxReferrals;
    boolean canReferMore;
    CommissionRate currentCommissionRate;
    int freeContractsRemaining;
    List<Referral> referrals;
}
