package com.flagship.escrow_engine.referral;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Referral caps and rewards, bound from escrow.referral.*.
 */
@ConfigurationProperties(prefix = "escrow.referral")
@Getter
@Setter
public class ReferralProperties {

    private int maxReferrals = 3;

    private int firstRewardCredits = 2;

    private int secondRewardCredits = 1;

    /** Permanent commission rate granted by the third completed referral. */
    private BigDecimal reducedCommissionRate = new BigDecimal("3.00");

    /** Credits an early-adopter receives when registering with a referral code. */
    private int earlyAdopterCredits = 1;
}
