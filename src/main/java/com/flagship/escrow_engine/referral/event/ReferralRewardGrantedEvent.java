package com.flagship.escrow_engine.referral.event;

import com.flagship.escrow_engine.referral.Referral;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published once per referrer and tier when a referral reward is credited.
 *
 * newCommissionRate is set only for the reduced-commission tier.
 */
@Value
public class ReferralRewardGrantedEvent {
    UUID eventId;
    UUID referralId;
    UUID referrerId;
    UUID referredUserId;
    int tier;
    String rewardType;
    int creditsGranted;
    String newCommissionRate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ReferralRewardGranted";

    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ReferralRewardGrantedEvent fromReferral(Referral referral, int creditsGranted,
                                                          String newCommissionRate, Instant now) {
        return new ReferralRewardGrantedEvent(
            UUID.randomUUID(),
            referral.getId(),
            referral.getReferrerId(),
            referral.getReferredUserId(),
            referral.getRewardTier(),
            referral.getRewardType().name(),
            creditsGranted,
            newCommissionRate,
            now
        );
    }
}
