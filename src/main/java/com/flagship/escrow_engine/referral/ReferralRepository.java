package com.flagship.escrow_engine.referral;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ReferralRepository extends JpaRepository<ReferralEntity, UUID> {

    boolean existsByReferredUserId(UUID referredUserId);

    Optional<ReferralEntity> findByReferredUserIdAndStatus(UUID referredUserId, ReferralStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM ReferralEntity r WHERE r.id = :id")
    Optional<ReferralEntity> findByIdForUpdate(@Param("id") UUID id);

    long countByReferrerId(UUID referrerId);

    long countByReferrerIdAndStatusIn(UUID referrerId, Collection<ReferralStatus> statuses);

    List<ReferralEntity> findByReferrerIdOrderByCreatedAtDesc(UUID referrerId);
}
