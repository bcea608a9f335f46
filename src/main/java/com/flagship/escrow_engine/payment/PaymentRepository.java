package com.flagship.escrow_engine.payment;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, UUID> {

    Optional<PaymentEntity> findByGatewayOrderId(String gatewayOrderId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentEntity p WHERE p.id = :id")
    Optional<PaymentEntity> findByIdForUpdate(@Param("id") UUID id);

    List<PaymentEntity> findByContractIdOrderByCreatedAtAsc(UUID contractId);

    List<PaymentEntity> findByContractIdAndStatusIn(UUID contractId, Collection<PaymentStatus> statuses);

    boolean existsByContractIdAndStatus(UUID contractId, PaymentStatus status);

    /**
     * PENDING payments whose order (or, lacking one, the payment itself) is older than the cutoff.
     */
    @Query("""
        SELECT p.id FROM PaymentEntity p
        WHERE p.status = com.flagship.escrow_engine.payment.PaymentStatus.PENDING
          AND COALESCE(p.orderCreatedAt, p.createdAt) < :cutoff
          AND p.refundRequestedAt IS NULL
        ORDER BY p.createdAt
        """)
    List<UUID> findStalePendingIds(@Param("cutoff") Instant cutoff, Pageable pageable);
}
