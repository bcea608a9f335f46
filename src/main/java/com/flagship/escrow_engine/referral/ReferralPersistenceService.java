package com.flagship.escrow_engine.referral;

import com.flagship.escrow_engine.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges {@link Referral} and its entity. Writes join the caller's transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReferralPersistenceService {

    private static final String RESOURCE = "Referral";

    private final ReferralRepository referralRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public Referral insert(Referral referral) {
        return referralRepository.saveAndFlush(ReferralEntity.fromDomain(referral)).toDomain();
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Referral lock(UUID referralId) {
        return referralRepository.findByIdForUpdate(referralId)
            .map(ReferralEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, referralId));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Referral update(Referral referral) {
        ReferralEntity existing = referralRepository.findById(referral.getId())
            .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, referral.getId()));
        existing.updateFromDomain(referral);
        ReferralEntity updated = referralRepository.saveAndFlush(existing);
        log.debug("Updated referral {} status={}", updated.getId(), updated.getStatus());
        return updated.toDomain();
    }

    @Transactional(readOnly = true)
    public boolean isReferred(UUID userId) {
        return referralRepository.existsByReferredUserId(userId);
    }

    @Transactional(readOnly = true)
    public Optional<Referral> findOpenReferral(UUID referredUserId) {
        return referralRepository.findByReferredUserIdAndStatus(referredUserId, ReferralStatus.REGISTERED)
            .map(ReferralEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public int countByReferrer(UUID referrerId) {
        return (int) referralRepository.countByReferrerId(referrerId);
    }

    /**
     * Referrals of this referrer whose referred user already completed a contract.
     */
    @Transactional(readOnly = true)
    public int countCompletedByReferrer(UUID referrerId) {
        return (int) referralRepository.countByReferrerIdAndStatusIn(referrerId,
            EnumSet.of(ReferralStatus.COMPLETED, ReferralStatus.CREDITED));
    }

    @Transactional(readOnly = true)
    public List<Referral> findByReferrer(UUID referrerId) {
        return referralRepository.findByReferrerIdOrderByCreatedAtDesc(referrerId).stream()
            .map(ReferralEntity::toDomain)
            .toList();
    }
}
