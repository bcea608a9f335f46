package com.flagship.escrow_engine.referral;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for referrals.
 *
 * Referrer and referred user are plain foreign keys to member_accounts; there is
 * no object graph between members. The unique (referrer_id, reward_tier) pair
 * lets each reward tier be credited once per referrer.
 */
@Entity
@Table(
    name = "referrals",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_referrals_referred_user", columnNames = "referred_user_id"),
        @UniqueConstraint(name = "uk_referrals_referrer_tier", columnNames = {"referrer_id", "reward_tier"})
    },
    indexes = {
        @Index(name = "idx_referrals_referrer_status", columnList = "referrer_id, status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReferralEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "referrer_id", nullable = false, updatable = false)
    private UUID referrerId;

    @Column(name = "referred_user_id", nullable = false, updatable = false)
    private UUID referredUserId;

    @Column(name = "used_code", length = 32, updatable = false)
    private String usedCode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ReferralStatus status;

    @Column(name = "registered_at", nullable = false, updatable = false)
    private Instant registeredAt;

    @Column(name = "first_contract_completed_at")
    private Instant firstContractCompletedAt;

    @Column(name = "reward_granted", nullable = false)
    private boolean rewardGranted;

    @Enumerated(EnumType.STRING)
    @Column(name = "reward_type", length = 32)
    private RewardType rewardType;

    @Column(name = "reward_tier")
    private Integer rewardTier;

    @Column(name = "reward_granted_at")
    private Instant rewardGrantedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(nullable = false)
    private Long version;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static ReferralEntity fromDomain(Referral referral) {
        ReferralEntity entity = new ReferralEntity();
        entity.id = referral.getId();
        entity.referrerId = referral.getReferrerId();
        entity.referredUserId = referral.getReferredUserId();
        entity.usedCode = referral.getUsedCode();
        entity.registeredAt = referral.getRegisteredAt();
        entity.createdAt = referral.getCreatedAt();
        entity.updateFromDomain(referral);
        return entity;
    }

    Referral toDomain() {
        return Referral.builder()
            .id(id)
            .referrerId(referrerId)
            .referredUserId(referredUserId)
            .usedCode(usedCode)
            .status(status)
            .registeredAt(registeredAt)
            .firstContractCompletedAt(firstContractCompletedAt)
            .rewardGranted(rewardGranted)
            .rewardType(rewardType)
            .rewardTier(rewardTier)
            .rewardGrantedAt(rewardGrantedAt)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    void updateFromDomain(Referral referral) {
        this.status = referral.getStatus();
        this.firstContractCompletedAt = referral.getFirstContractCompletedAt();
        this.rewardGranted = referral.isRewardGranted();
        this.rewardType = referral.getRewardType();
        this.rewardTier = referral.getRewardTier();
        this.rewardGrantedAt = referral.getRewardGrantedAt();
    }
}
