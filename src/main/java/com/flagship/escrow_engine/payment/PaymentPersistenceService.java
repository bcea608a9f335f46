package com.flagship.escrow_engine.payment;

import com.flagship.escrow_engine.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for payment persistence operations.
 *
 * This service bridges the domain layer (Payment) and persistence layer (PaymentEntity).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentPersistenceService {

    private static final String RESOURCE = "Payment";

    private final PaymentRepository paymentRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public Payment insert(Payment payment) {
        PaymentEntity saved = paymentRepository.saveAndFlush(PaymentEntity.fromDomain(payment));
        log.debug("Saved payment {} for contract {}", saved.getId(), saved.getContractId());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findById(UUID paymentId) {
        return paymentRepository.findById(paymentId).map(PaymentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Payment getById(UUID paymentId) {
        return findById(paymentId).orElseThrow(() -> new ResourceNotFoundException(RESOURCE, paymentId));
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findByGatewayOrderId(String orderId) {
        return paymentRepository.findByGatewayOrderId(orderId).map(PaymentEntity::toDomain);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Payment lock(UUID paymentId) {
        return paymentRepository.findByIdForUpdate(paymentId)
            .map(PaymentEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, paymentId));
    }

    @Transactional(readOnly = true)
    public List<Payment> findByContract(UUID contractId) {
        return paymentRepository.findByContractIdOrderByCreatedAtAsc(contractId).stream()
            .map(PaymentEntity::toDomain)
            .toList();
    }

    /**
     * Payments of a contract that are still PENDING or HELD_ESCROW.
     */
    @Transactional(readOnly = true)
    public List<Payment> findOpen(UUID contractId) {
        return paymentRepository.findByContractIdAndStatusIn(contractId,
                EnumSet.of(PaymentStatus.PENDING, PaymentStatus.HELD_ESCROW)).stream()
            .map(PaymentEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public boolean hasHeldPayments(UUID contractId) {
        return paymentRepository.existsByContractIdAndStatus(contractId, PaymentStatus.HELD_ESCROW);
    }

    @Transactional(readOnly = true)
    public List<UUID> findStalePendingIds(Instant cutoff, int limit) {
        return paymentRepository.findStalePendingIds(cutoff, PageRequest.of(0, limit));
    }

    /**
     * Writes the mutable state of a payment. The version check turns a lost race into
     * an ObjectOptimisticLockingFailureException at flush.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Payment update(Payment payment) {
        PaymentEntity existing = paymentRepository.findById(payment.getId())
            .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, payment.getId()));
        existing.updateFromDomain(payment);
        PaymentEntity updated = paymentRepository.saveAndFlush(existing);
        log.debug("Updated payment {} status={}", updated.getId(), updated.getStatus());
        return updated.toDomain();
    }
}
