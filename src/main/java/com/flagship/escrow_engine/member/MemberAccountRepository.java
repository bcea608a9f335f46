package com.flagship.escrow_engine.member;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface MemberAccountRepository extends JpaRepository<MemberAccountEntity, UUID> {

    Optional<MemberAccountEntity> findByReferralCodeIgnoreCase(String referralCode);

    /**
     * Row lock used to serialize reward grants and credit consumption per member.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM MemberAccountEntity m WHERE m.userId = :userId")
    Optional<MemberAccountEntity> findByIdForUpdate(@Param("userId") UUID userId);
}
