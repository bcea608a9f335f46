package com.flagship.escrow_engine.member;

import com.flagship.escrow_engine.exception.ResourceNotFoundException;
import com.flagship.escrow_engine.money.CommissionRate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * MembershipDirectory backed by the local member_accounts projection.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaMembershipDirectory implements MembershipDirectory {

    private static final String RESOURCE = "Member";

    private final MemberAccountRepository repository;

    @Override
    @Transactional(readOnly = true)
    public MembershipProfile getProfile(UUID userId) {
        return repository.findById(userId)
            .map(MemberAccountEntity::toProfile)
            .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, userId));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isIdentityVerified(UUID userId) {
        return repository.findById(userId)
            .map(MemberAccountEntity::isIdentityVerified)
            .orElse(false);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MembershipProfile> findByReferralCode(String referralCode) {
        if (referralCode == null || referralCode.isBlank()) {
            return Optional.empty();
        }
        return repository.findByReferralCodeIgnoreCase(referralCode.trim())
            .map(MemberAccountEntity::toProfile);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public MembershipProfile lockForUpdate(UUID userId) {
        return lock(userId).toProfile();
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean consumeFreeContractCredit(UUID userId) {
        MemberAccountEntity member = lock(userId);
        boolean consumed = member.consumeFreeCredit();
        if (consumed) {
            log.info("Consumed free contract credit: userId={}, remaining={}",
                    userId, member.getFreeContractsRemaining());
        } else {
            log.warn("No free contract credit left to consume: userId={}", userId);
        }
        return consumed;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void addFreeCredits(UUID userId, int credits) {
        MemberAccountEntity member = lock(userId);
        member.addFreeCredits(credits);
        log.info("Granted free contract credits: userId={}, granted={}, remaining={}",
                userId, credits, member.getFreeContractsRemaining());
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean applyReducedCommissionRate(UUID userId, CommissionRate rate) {
        MemberAccountEntity member = lock(userId);
        boolean changed = member.lowerCommissionRate(rate);
        log.info("Commission rate update: userId={}, requested={}, changed={}", userId, rate, changed);
        return changed;
    }

    @Override
    @Transactional(readOnly = true)
    public PartyRef resolveParty(UUID userId) {
        return repository.findById(userId)
            .<PartyRef>map(m -> new PartyRef.Embedded(new PartyRef.PartyInfo(
                m.getUserId(), m.getDisplayName(), m.getEmail(), m.isIdentityVerified())))
            .orElseGet(() -> new PartyRef.Id(userId));
    }

    private MemberAccountEntity lock(UUID userId) {
        return repository.findByIdForUpdate(userId)
            .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, userId));
    }
}
