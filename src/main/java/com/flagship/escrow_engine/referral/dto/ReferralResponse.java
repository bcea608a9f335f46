package com.flagship.escrow_engine.referral.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_engine.referral.Referral;
import com.flagship.escrow_engine.referral.ReferralStatus;
import com.flagship.escrow_engine.referral.RewardType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ReferralResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("referrer_id")
    UUID referrerId;

    @JsonProperty("referred_user_id")
    UUID referredUserId;

    @JsonProperty("status")
    ReferralStatus status;

    @JsonProperty("registered_at")
    Instant registeredAt;

    @JsonProperty("first_contract_completed_at")
    Instant firstContractCompletedAt;

    @JsonProperty("reward_type")
    RewardType rewardType;

    @JsonProperty("reward_tier")
    Integer rewardTier;

    @JsonProperty("reward_granted_at")
    Instant rewardGrantedAt;

    public static ReferralResponse from(Referral referral) {
        return ReferralResponse.builder()
            .id(referral.getId())
            .referrerId(referral.getReferrerId())
            .referredUserId(referral.getReferredUserId())
            .status(referral.getStatus())
            .registeredAt(referral.getRegisteredAt())
            .firstContractCompletedAt(referral.getFirstContractCompletedAt())
            .rewardType(referral.getRewardType())
            .rewardTier(referral.getRewardTier())
            .rewardGrantedAt(referral.getRewardGrantedAt())
            .build();
    }
}
