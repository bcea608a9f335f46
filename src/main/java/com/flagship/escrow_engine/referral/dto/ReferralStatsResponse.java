package com.flagship.escrow_engine.referral.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_engine.referral.ReferralStats;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class ReferralStatsResponse {

    @JsonProperty("referral_code")
    String referralCode;

    @JsonProperty("total_referrals")
    int totalReferrals;

    @JsonProperty("completed_referrals")
    int completedReferrals;

    @JsonProperty("max_referrals")
    int maxReferrals;

    @JsonProperty("can_refer_more")
    boolean canReferMore;

    @JsonProperty("current_commission_rate")
    BigDecimal currentCommissionRate;

    @JsonProperty("free_contracts_remaining")
    int freeContractsRemaining;

    @JsonProperty("referrals")
    List<ReferralResponse> referrals;

    public static ReferralStatsResponse from(ReferralStats stats) {
        return ReferralStatsResponse.builder()
            .referralCode(stats.getReferralCode())
            .totalReferrals(stats.getTotalReferrals())
            .completedReferrals(stats.getCompletedReferrals())
            .maxReferrals(stats.getMaxReferrals())
            .canReferMore(stats.isCanReferMore())
            .currentCommissionRate(stats.getCurrentCommissionRate() != null
                ? stats.getCurrentCommissionRate().getPercent() : null)
            .freeContractsRemaining(stats.getFreeContractsRemaining())
            .referrals(stats.getReferrals().stream().map(ReferralResponse::from).toList())
            .build();
    }
}
