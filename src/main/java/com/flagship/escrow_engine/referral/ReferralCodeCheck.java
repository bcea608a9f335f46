package com.flagship.escrow_engine.referral;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Answer to "can this referral code still be used?".
 */
@Value
public class ReferralCodeCheck {
    @JsonProperty("valid")
    boolean valid;
    @JsonProperty("message")
    String message;
    @JsonProperty("referrer_name")
    String referrerName;
    @JsonProperty("code")
    String code;
    @JsonProperty("remaining_slots")
    int remainingSlots;

    static ReferralCodeCheck invalid(String message) {
        return new ReferralCodeCheck(false, message, null, null, 0);
    }
}
