package com.flagship.escrow_engine.commission;

/**
 * Membership tier of the paying party. Stored as text in member_accounts.membership_tier.
 */
public enum MembershipTier {
    FREE,
    PRO,
    SUPER_PRO,
    FAMILY
}
