package com.flagship.escrow_engine.contract;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for contracts.
 *
 * The *SkipLocked claims back the automation sweeps: each re-checks eligibility
 * under the row lock and returns empty when another instance holds the row.
 */
@Repository
public interface ContractRepository extends JpaRepository<ContractEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM ContractEntity c WHERE c.id = :id")
    Optional<ContractEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Contracts the requester opened since the given instant; feeds the monthly tier quota.
     */
    long countByRequesterIdAndCreatedAtGreaterThanEqual(UUID requesterId, Instant since);

    @Query("""
        SELECT COALESCE(SUM(c.allocatedAmountMinor), 0) FROM ContractEntity c
        WHERE c.jobId = :jobId
        AND c.status <> com.flagship.escrow_engine.contract.ContractStatus.CANCELLED
        AND c.deleted = false
        """)
    long sumActiveAllocations(@Param("jobId") UUID jobId);

    long countByJobIdAndStatusNot(UUID jobId, ContractStatus status);

    boolean existsByJobIdAndWorkerIdAndStatusNot(UUID jobId, UUID workerId, ContractStatus status);


    // ==================== Sweep candidates (no lock) ====================

    @Query(value = """
        SELECT id FROM contracts
        WHERE status = 'WAITING_APPROVAL'
        AND escrow_status = 'HELD'
        AND work_completed_at <= :cutoff
        AND deleted = false
        ORDER BY work_completed_at ASC
        LIMIT :limit
        """, nativeQuery = true)
    List<UUID> findAutoReleaseCandidates(@Param("cutoff") Instant cutoff, @Param("limit") int limit);

    @Query(value = """
        SELECT id FROM contracts
        WHERE status = 'WAITING_APPROVAL'
        AND work_completed_at > :windowStart
        AND work_completed_at <= :windowEnd
        AND approval_reminder_sent_at IS NULL
        AND deleted = false
        ORDER BY work_completed_at ASC
        LIMIT :limit
        """, nativeQuery = true)
    List<UUID> findReminderCandidates(@Param("windowStart") Instant windowStart,
                                      @Param("windowEnd") Instant windowEnd,
                                      @Param("limit") int limit);

    @Query(value = """
        SELECT id FROM contracts
        WHERE status = 'IN_PROGRESS'
        AND end_date < :now
        AND overdue_flagged_at IS NULL
        AND deleted = false
        ORDER BY end_date ASC
        LIMIT :limit
        """, nativeQuery = true)
    List<UUID> findOverdueCandidates(@Param("now") Instant now, @Param("limit") int limit);

    @Query(value = """
        SELECT id FROM contracts
        WHERE status = 'PENDING'
        AND pairing_expiry <= :now
        AND deleted = false
        ORDER BY pairing_expiry ASC
        LIMIT :limit
        """, nativeQuery = true)
    List<UUID> findExpiredPairingCandidates(@Param("now") Instant now, @Param("limit") int limit);

    @Query(value = """
        SELECT id FROM contracts
        WHERE status = 'ACCEPTED'
        AND escrow_enabled = false
        AND start_date <= :now
        AND deleted = false
        ORDER BY start_date ASC
        LIMIT :limit
        """, nativeQuery = true)
    List<UUID> findScheduledStartCandidates(@Param("now") Instant now, @Param("limit") int limit);

    // ==================== Per-row claims ====================

    @Query(value = """
        SELECT * FROM contracts
        WHERE id = :id
        AND status = 'WAITING_APPROVAL'
        AND escrow_status = 'HELD'
        AND work_completed_at <= :cutoff
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    Optional<ContractEntity> claimForAutoRelease(@Param("id") UUID id, @Param("cutoff") Instant cutoff);

    @Query(value = """
        SELECT * FROM contracts
        WHERE id = :id
        AND status = 'WAITING_APPROVAL'
        AND approval_reminder_sent_at IS NULL
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    Optional<ContractEntity> claimForReminder(@Param("id") UUID id);

    @Query(value = """
        SELECT * FROM contracts
        WHERE id = :id
        AND status = 'IN_PROGRESS'
        AND end_date < :now
        AND overdue_flagged_at IS NULL
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    Optional<ContractEntity> claimForOverdue(@Param("id") UUID id, @Param("now") Instant now);

    @Query(value = """
        SELECT * FROM contracts
        WHERE id = :id
        AND status = 'PENDING'
        AND pairing_expiry <= :now
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    Optional<ContractEntity> claimExpiredPairing(@Param("id") UUID id, @Param("now") Instant now);

    @Query(value = """
        SELECT * FROM contracts
        WHERE id = :id
        AND status = 'ACCEPTED'
        AND escrow_enabled = false
        AND start_date <= :now
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    Optional<ContractEntity> claimScheduledStart(@Param("id") UUID id, @Param("now") Instant now);
}
