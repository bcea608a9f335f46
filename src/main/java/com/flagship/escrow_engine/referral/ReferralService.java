package com.flagship.escrow_engine.referral;

import com.flagship.escrow_engine.audit.AuditCategory;
import com.flagship.escrow_engine.audit.AuditLogEntry;
import com.flagship.escrow_engine.audit.AuditSeverity;
import com.flagship.escrow_engine.audit.AuditTrailService;
import com.flagship.escrow_engine.audit.FieldChange;
import com.flagship.escrow_engine.exception.ErrorCode;
import com.flagship.escrow_engine.exception.ValidationException;
import com.flagship.escrow_engine.member.MembershipDirectory;
import com.flagship.escrow_engine.member.MembershipProfile;
import com.flagship.escrow_engine.money.CommissionRate;
import com.flagship.escrow_engine.notification.Notification;
import com.flagship.escrow_engine.notification.NotificationDispatcher;
import com.flagship.escrow_engine.notification.NotificationType;
import com.flagship.escrow_engine.observability.EscrowMetrics;
import com.flagship.escrow_engine.outbox.OutboxService;
import com.flagship.escrow_engine.referral.event.ReferralRegisteredEvent;
import com.flagship.escrow_engine.referral.event.ReferralRewardGrantedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Referral chains and their rewards.
 *
 * A referrer may refer a limited number of members. When a referred member
 * completes their first contract the referrer earns the reward of the next
 * tier: free contract credits for tiers 1 and 2, a permanently reduced
 * commission rate for tier 3.
 *
 * Tier selection counts the referrer's completed referrals while holding the
 * referrer's member row lock, so two referred members finishing at the same
 * moment get tiers n and n+1, never the same tier twice. The unique
 * (referrer_id, reward_tier) index rejects a duplicate grant that slipped past.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReferralService {

    public static final String AGGREGATE_TYPE = "Referral";

    private final ReferralPersistenceService referrals;
    private final MembershipDirectory membershipDirectory;
    private final OutboxService outboxService;
    private final AuditTrailService auditTrailService;
    private final NotificationDispatcher notifications;
    private final ReferralProperties properties;
    private final EscrowMetrics metrics;
    private final Clock clock;

    /**
     * Links a new member to the owner of the referral code.
     *
     * @throws ValidationException for an unknown code, a self-referral, a member
     *         who was already referred, or a referrer at the cap
     */
    @Transactional
    public Referral registerReferral(UUID newUserId, String referralCode) {
        MembershipProfile referrer = membershipDirectory.findByReferralCode(referralCode)
            .orElseThrow(() -> new ValidationException("Invalid referral code: " + referralCode));
        if (referrer.getUserId().equals(newUserId)) {
            throw new ValidationException("A member cannot use their own referral code");
        }

        MembershipProfile referred = membershipDirectory.getProfile(newUserId);

        membershipDirectory.lockForUpdate(referrer.getUserId());
        if (referrals.isReferred(newUserId)) {
            throw new ValidationException("Member " + newUserId + " was already referred");
        }
        int existing = referrals.countByReferrer(referrer.getUserId());
        if (existing >= properties.getMaxReferrals()) {
            throw new ValidationException(ErrorCode.REFERRAL_CAP_REACHED, String.format(
                "Referrer %s reached the maximum of %d referrals", referrer.getUserId(), properties.getMaxReferrals()));
        }

        Instant now = clock.instant();
        Referral referral = referrals.insert(Referral.register(UUID.randomUUID(), referrer.getUserId(), newUserId,
                referralCode.trim().toUpperCase(), now));

        int bonus = 0;
        if (referred.isEarlyAdopter() && properties.getEarlyAdopterCredits() > 0) {
            bonus = properties.getEarlyAdopterCredits();
            membershipDirectory.addFreeCredits(newUserId, bonus);
        }

        outboxService.saveEvent(AGGREGATE_TYPE, referral.getId(), ReferralRegisteredEvent.EVENT_TYPE,
                ReferralRegisteredEvent.fromReferral(referral, bonus, now));
        audit(newUserId, "REFERRAL_REGISTERED", AuditSeverity.LOW, referral,
                "Registered with referral code of " + referrer.getUserId()
                        + (bonus > 0 ? ", early-adopter credit +" + bonus : ""),
                List.of(FieldChange.of("status", null, ReferralStatus.REGISTERED)));

        log.info("Referral registered: referralId={}, referrerId={}, referredUserId={}, slotsLeft={}",
                referral.getId(), referrer.getUserId(), newUserId, properties.getMaxReferrals() - existing - 1);
        return referral;
    }

    @Transactional(readOnly = true)
    public ReferralCodeCheck validateReferralCode(String referralCode) {
        Optional<MembershipProfile> referrer = membershipDirectory.findByReferralCode(referralCode);
        if (referrer.isEmpty()) {
            return ReferralCodeCheck.invalid("Invalid referral code");
        }
        int remaining = properties.getMaxReferrals() - referrals.countByReferrer(referrer.get().getUserId());
        if (remaining <= 0) {
            return ReferralCodeCheck.invalid("This referral code reached its referral limit");
        }
        return new ReferralCodeCheck(true, null, referrer.get().getDisplayName(),
                referrer.get().getReferralCode(), remaining);
    }

    @Transactional(readOnly = true)
    public ReferralStats getReferralStats(UUID userId) {
        MembershipProfile member = membershipDirectory.getProfile(userId);
        List<Referral> list = referrals.findByReferrer(userId);
        int completed = (int) list.stream().filter(r -> !r.isOpen()).count();
        return ReferralStats.builder()
            .referralCode(member.getReferralCode())
            .totalReferrals(list.size())
            .completedReferrals(completed)
            .maxReferrals(properties.getMaxReferrals())
            .canReferMore(list.size() < properties.getMaxReferrals())
            .currentCommissionRate(member.getCurrentCommissionRate())
            .freeContractsRemaining(member.getFreeContractsRemaining())
            .referrals(list)
            .build();
    }

    /**
     * Completes the member's open referral and credits the referrer's next reward tier.
     * Later completions by the same member find no open referral and do nothing.
     *
     * @return the credited or completed referral, empty when the member has no open referral
     */
    @Transactional
    public Optional<Referral> onFirstContractCompleted(UUID userId, Instant completedAt) {
        Optional<Referral> open = referrals.findOpenReferral(userId);
        if (open.isEmpty()) {
            log.debug("No open referral for member {}", userId);
            return Optional.empty();
        }
        UUID referrerId = open.get().getReferrerId();

        membershipDirectory.lockForUpdate(referrerId);
        Referral referral = referrals.lock(open.get().getId());
        if (!referral.isOpen()) {
            return Optional.empty();
        }

        int tier = referrals.countCompletedByReferrer(referrerId) + 1;
        Instant now = clock.instant();
        Referral completed = referrals.update(referral.complete(completedAt != null ? completedAt : now));
        audit(userId, "REFERRAL_COMPLETED", AuditSeverity.LOW, completed,
                "Referred member completed their first contract",
                List.of(FieldChange.of("status", ReferralStatus.REGISTERED, ReferralStatus.COMPLETED)));

        if (tier > properties.getMaxReferrals()) {
            log.warn("Referrer {} has no reward tier left for referral {}", referrerId, referral.getId());
            return Optional.of(completed);
        }
        return Optional.of(grantReward(completed, tier, now));
    }

    private Referral grantReward(Referral referral, int tier, Instant now) {
        UUID referrerId = referral.getReferrerId();
        RewardType type;
        int credits = 0;
        String newRate = null;
        switch (tier) {
            case 1 -> {
                type = RewardType.TWO_FREE_CONTRACTS;
                credits = properties.getFirstRewardCredits();
            }
            case 2 -> {
                type = RewardType.ONE_FREE_CONTRACT;
                credits = properties.getSecondRewardCredits();
            }
            default -> type = RewardType.REDUCED_COMMISSION;
        }

        Referral credited = referrals.update(referral.credit(tier, type, now));
        if (type != RewardType.REDUCED_COMMISSION) {
            if (credits > 0) {
                membershipDirectory.addFreeCredits(referrerId, credits);
            }
            audit(null, "REFERRAL_REWARD_GRANTED", AuditSeverity.MEDIUM, credited,
                    "Tier " + tier + " reward: " + credits + " free contract credits",
                    List.of(FieldChange.of("status", ReferralStatus.COMPLETED, ReferralStatus.CREDITED),
                            FieldChange.of("rewardTier", null, tier)));
        } else {
            CommissionRate rate = CommissionRate.of(properties.getReducedCommissionRate());
            boolean changed = membershipDirectory.applyReducedCommissionRate(referrerId, rate);
            newRate = rate.getPercent().toPlainString();
            auditTrailService.record(AuditLogEntry.builder()
                    .action("COMMISSION_RATE_REDUCED")
                    .category(AuditCategory.MEMBERSHIP)
                    .severity(AuditSeverity.CRITICAL)
                    .targetModel("Member")
                    .targetId(referrerId)
                    .description("Commission rate set to " + newRate + "% by referral tier " + tier
                            + (changed ? "" : " (already at or below)"))
                    .changes(List.of(FieldChange.of("currentCommissionRate", null, newRate)))
                    .build());
            audit(null, "REFERRAL_REWARD_GRANTED", AuditSeverity.MEDIUM, credited,
                    "Tier " + tier + " reward: commission rate " + newRate + "%",
                    List.of(FieldChange.of("status", ReferralStatus.COMPLETED, ReferralStatus.CREDITED),
                            FieldChange.of("rewardTier", null, tier)));
        }

        outboxService.saveEvent(AGGREGATE_TYPE, credited.getId(), ReferralRewardGrantedEvent.EVENT_TYPE,
                ReferralRewardGrantedEvent.fromReferral(credited, credits, newRate, now));
        Map<String, String> data = new HashMap<>();
        data.put("tier", String.valueOf(tier));
        data.put("rewardType", type.name());
        if (newRate != null) {
            data.put("commissionRate", newRate);
        }
        notifications.sendAfterCommit(Notification.of(referrerId, NotificationType.REFERRAL_REWARD_GRANTED,
                null, data, now));
        metrics.recordReferralReward(tier);

        log.info("Referral reward granted: referrerId={}, referralId={}, tier={}, type={}",
                referrerId, credited.getId(), tier, type);
        return credited;
    }

    private void audit(UUID actor, String action, AuditSeverity severity, Referral referral,
                       String description, List<FieldChange> changes) {
        auditTrailService.record(AuditLogEntry.builder()
                .performedBy(actor)
                .action(action)
                .category(AuditCategory.REFERRAL)
                .severity(severity)
                .targetModel(AGGREGATE_TYPE)
                .targetId(referral.getId())
                .description(description)
                .changes(changes)
                .build());
    }
}
