package com.flagship.escrow_engine.member;

import com.flagship.escrow_engine.money.CommissionRate;

import java.util.Optional;
import java.util.UUID;

/**
 * Boundary to the user/membership service.
 *
 * Reads tier, credits, rate and identity state; writes back consumed credits,
 * granted credits and lowered rates.
 */
public interface MembershipDirectory {

    /**
     * @throws com.flagship.escrow_engine.exception.ResourceNotFoundException if the member is unknown
     */
    MembershipProfile getProfile(UUID userId);

    boolean isIdentityVerified(UUID userId);

    Optional<MembershipProfile> findByReferralCode(String referralCode);

    /**
     * Locks the member row for the rest of the current transaction.
     */
    MembershipProfile lockForUpdate(UUID userId);

    /**
     * @return false if the member had no credit left
     */
    boolean consumeFreeContractCredit(UUID userId);

    void addFreeCredits(UUID userId, int credits);

    /**
     * Lowers the member's commission rate; never raises it.
     *
     * @return true if the stored rate changed
     */
    boolean applyReducedCommissionRate(UUID userId, CommissionRate rate);

    /**
     * Resolves a party reference for responses: an embedded summary when the
     * member is known locally, otherwise the bare id.
     */
    PartyRef resolveParty(UUID userId);
}
