package com.flagship.escrow_engine.referral;

import com.flagship.escrow_engine.exception.InvalidTransitionException;
import com.flagship.escrow_engine.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One directed edge from a referrer to the user they referred.
 *
 * Each user is referred at most once. The reward tier is fixed when the
 * referral is credited and never changes afterwards.
 */
@Value
@Builder(toBuilder = true)
public class Referral {
    UUID id;
    UUID referrerId;
    UUID referredUserId;
    String usedCode;
    ReferralStatus status;
    Instant registeredAt;
    Instant firstContractCompletedAt;
    boolean rewardGranted;
    RewardType rewardType;
    Integer rewardTier;
    Instant rewardGrantedAt;
    Instant createdAt;
    Instant updatedAt;

    public static Referral register(UUID id, UUID referrerId, UUID referredUserId, String usedCode, Instant now) {
        if (referrerId.equals(referredUserId)) {
            throw new ValidationException("A member cannot refer themselves");
        }
        return Referral.builder()
            .id(id)
            .referrerId(referrerId)
            .referredUserId(referredUserId)
            .usedCode(usedCode)
            .status(ReferralStatus.REGISTERED)
            .registeredAt(now)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * REGISTERED -> COMPLETED.
     */
    public Referral complete(Instant completedAt) {
        if (status != ReferralStatus.REGISTERED) {
            throw InvalidTransitionException.of("referral", id, status, ReferralStatus.COMPLETED);
        }
        return toBuilder()
            .status(ReferralStatus.COMPLETED)
            .firstContractCompletedAt(completedAt)
            .updatedAt(completedAt)
            .build();
    }

    /**
     * COMPLETED -> CREDITED with the reward of the given tier.
     */
    public Referral credit(int tier, RewardType type, Instant now) {
        if (status != ReferralStatus.COMPLETED) {
            throw InvalidTransitionException.of("referral", id, status, ReferralStatus.CREDITED);
        }
        return toBuilder()
            .status(ReferralStatus.CREDITED)
            .rewardGranted(true)
            .rewardTier(tier)
            .rewardType(type)
            .rewardGrantedAt(now)
            .updatedAt(now)
            .build();
    }

    public boolean isOpen() {
        return status == ReferralStatus.REGISTERED;
    }
}
