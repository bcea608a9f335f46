package com.flagship.escrow_engine.member;

import com.flagship.escrow_engine.commission.MembershipTier;
import com.flagship.escrow_engine.money.CommissionRate;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Local projection of a platform member: tier, credits and commission rate.
 *
 * Credits and rate only change through the guarded methods below.
 */
@Entity
@Table(name = "member_accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MemberAccountEntity {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "display_name")
    private String displayName;

    @Column(name = "email")
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(name = "membership_tier", nullable = false, length = 20)
    private MembershipTier membershipTier;

    @Column(name = "free_contracts_remaining", nullable = false)
    private int freeContractsRemaining;

    @Column(name = "current_commission_rate", precision = 5, scale = 2)
    private BigDecimal currentCommissionRate;

    @Column(name = "identity_verified", nullable = false)
    private boolean identityVerified;

    @Column(name = "referral_code", unique = true, length = 32)
    private String referralCode;

    @Column(name = "early_adopter", nullable = false)
    private boolean earlyAdopter;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public static MemberAccountEntity create(UUID userId, String displayName, String email,
                                             MembershipTier tier, boolean identityVerified,
                                             String referralCode, boolean earlyAdopter) {
        return new MemberAccountEntity(userId, displayName, email, tier, 0, null,
                identityVerified, referralCode, earlyAdopter, null, null, null);
    }

    public MembershipProfile toProfile() {
        return new MembershipProfile(
            userId,
            displayName,
            email,
            membershipTier,
            freeContractsRemaining,
            currentCommissionRate != null ? CommissionRate.of(currentCommissionRate) : null,
            identityVerified,
            referralCode,
            earlyAdopter
        );
    }

    /**
     * @return false if there was no credit left to consume
     */
    boolean consumeFreeCredit() {
        if (freeContractsRemaining <= 0) {
            return false;
        }
        freeContractsRemaining--;
        return true;
    }

    void addFreeCredits(int credits) {
        if (credits <= 0) {
            throw new IllegalArgumentException("Credits to add must be positive: " + credits);
        }
        freeContractsRemaining += credits;
    }

    /**
     * Lowers the member's rate. A higher rate than the current one is ignored.
     *
     * @return true if the stored rate changed
     */
    boolean lowerCommissionRate(CommissionRate rate) {
        if (currentCommissionRate != null && currentCommissionRate.compareTo(rate.getPercent()) <= 0) {
            return false;
        }
        currentCommissionRate = rate.getPercent();
        return true;
    }
}
