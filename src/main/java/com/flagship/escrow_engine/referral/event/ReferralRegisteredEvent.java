package com.flagship.escrow_engine.referral.event;

import com.flagship.escrow_engine.referral.Referral;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ReferralRegisteredEvent {
    UUID eventId;
    UUID referralId;
    UUID referrerId;
    UUID referredUserId;
    int earlyAdopterCredits;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ReferralRegistered";

    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ReferralRegisteredEvent fromReferral(Referral referral, int earlyAdopterCredits, Instant now) {
        return new ReferralRegisteredEvent(UUID.randomUUID(), referral.getId(), referral.getReferrerId(),
                referral.getReferredUserId(), earlyAdopterCredits, now);
    }
}
