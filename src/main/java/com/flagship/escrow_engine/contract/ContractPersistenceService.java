package com.flagship.escrow_engine.contract;

import com.flagship.escrow_engine.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the Contract domain object and ContractEntity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContractPersistenceService {

    private static final String RESOURCE = "Contract";

    private final ContractRepository contractRepository;

    @Transactional
    public Contract insert(Contract contract) {
        ContractEntity saved = contractRepository.save(ContractEntity.fromDomain(contract));
        log.debug("Saved contract {}", saved.getId());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Contract> findById(UUID contractId) {
        return contractRepository.findById(contractId).map(ContractEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Contract getById(UUID contractId) {
        return findById(contractId).orElseThrow(() -> new ResourceNotFoundException(RESOURCE, contractId));
    }

    /**
     * Loads the contract under a row lock held until the current transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Contract lock(UUID contractId) {
        return contractRepository.findByIdForUpdate(contractId)
            .map(ContractEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, contractId));
    }

    /**
     * Writes the mutable state of a contract loaded in the current transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Contract update(Contract contract) {
        ContractEntity existing = contractRepository.findById(contract.getId())
            .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, contract.getId()));
        existing.updateFromDomain(contract);
        ContractEntity updated = contractRepository.saveAndFlush(existing);
        log.debug("Updated contract {} status={}", updated.getId(), updated.getStatus());
        return updated.toDomain();
    }

    /**
     * Contracts the requester opened since the given instant (for monthly tier quotas).
     */
    @Transactional(readOnly = true)
    public int countCreatedSince(UUID requesterId, Instant since) {
        return (int) contractRepository.countByRequesterIdAndCreatedAtGreaterThanEqual(requesterId, since);
    }

    /**
     * Sum of allocated minor units over the job's non-cancelled, non-deleted contracts.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public long sumActiveAllocations(UUID jobId) {
        return contractRepository.sumActiveAllocations(jobId);
    }

    @Transactional(readOnly = true)
    public boolean hasActiveContract(UUID jobId, UUID workerId) {
        return contractRepository.existsByJobIdAndWorkerIdAndStatusNot(jobId, workerId, ContractStatus.CANCELLED);
    }

    @Transactional(readOnly = true)
    public int countActiveForJob(UUID jobId) {
        return (int) contractRepository.countByJobIdAndStatusNot(jobId, ContractStatus.CANCELLED);
    }

    // ==================== Sweeps ====================

    @Transactional(readOnly = true)
    public List<UUID> findAutoReleaseCandidates(Instant cutoff, int limit) {
        return contractRepository.findAutoReleaseCandidates(cutoff, limit);
    }

    @Transactional(readOnly = true)
    public List<UUID> findReminderCandidates(Instant windowStart, Instant windowEnd, int limit) {
        return contractRepository.findReminderCandidates(windowStart, windowEnd, limit);
    }

    @Transactional(readOnly = true)
    public List<UUID> findOverdueCandidates(Instant now, int limit) {
        return contractRepository.findOverdueCandidates(now, limit);
    }

    @Transactional(readOnly = true)
    public List<UUID> findExpiredPairingCandidates(Instant now, int limit) {
        return contractRepository.findExpiredPairingCandidates(now, limit);
    }

    @Transactional(readOnly = true)
    public List<UUID> findScheduledStartCandidates(Instant now, int limit) {
        return contractRepository.findScheduledStartCandidates(now, limit);
    }

    /**
     * Row-locks the contract if it still qualifies and no other worker holds it.
     * Empty when it was claimed elsewhere or no longer qualifies.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Contract> claimForAutoRelease(UUID contractId, Instant cutoff) {
        return contractRepository.claimForAutoRelease(contractId, cutoff).map(ContractEntity::toDomain);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Contract> claimForReminder(UUID contractId) {
        return contractRepository.claimForReminder(contractId).map(ContractEntity::toDomain);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Contract> claimForOverdue(UUID contractId, Instant now) {
        return contractRepository.claimForOverdue(contractId, now).map(ContractEntity::toDomain);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Contract> claimExpiredPairing(UUID contractId, Instant now) {
        return contractRepository.claimExpiredPairing(contractId, now).map(ContractEntity::toDomain);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Contract> claimScheduledStart(UUID contractId, Instant now) {
        return contractRepository.claimScheduledStart(contractId, now).map(ContractEntity::toDomain);
    }
}
