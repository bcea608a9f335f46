package com.flagship.escrow_engine.job;

import com.flagship.escrow_engine.audit.AuditSeverity;
import com.flagship.escrow_engine.commission.CommissionCalculator;
import com.flagship.escrow_engine.contract.Contract;
import com.flagship.escrow_engine.contract.ContractEventRecorder;
import com.flagship.escrow_engine.contract.ContractPersistenceService;
import com.flagship.escrow_engine.contract.ContractService;
import com.flagship.escrow_engine.contract.CreateContractCommand;
import com.flagship.escrow_engine.exception.ActionNotAllowedException;
import com.flagship.escrow_engine.exception.ErrorCode;
import com.flagship.escrow_engine.exception.ResourceNotFoundException;
import com.flagship.escrow_engine.exception.ValidationException;
import com.flagship.escrow_engine.money.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Splits a job budget across several workers, one contract each.
 *
 * Both operations hold a pessimistic lock on the job row, so two concurrent
 * selections cannot together allocate more than the job price.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkerAllocationService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final JobRepository jobRepository;
    private final ContractPersistenceService contracts;
    private final ContractService contractService;
    private final ContractEventRecorder contractEvents;
    private final CommissionCalculator commissionCalculator;
    private final Clock clock;

    @Transactional
    public List<Contract> selectWorkers(UUID jobId, UUID requesterId, List<WorkerAllocation> allocations) {
        if (allocations == null || allocations.isEmpty()) {
            throw new ValidationException("At least one worker allocation is required");
        }
        JobEntity job = lockJob(jobId);
        if (!job.getRequesterId().equals(requesterId)) {
            throw new ActionNotAllowedException("Only the job owner can select workers for job " + jobId);
        }
        if (contracts.countActiveForJob(jobId) + allocations.size() > job.getMaxWorkers()) {
            throw new ValidationException(String.format(
                "Job %s accepts at most %d workers", jobId, job.getMaxWorkers()));
        }

        Money price = job.getPrice();
        Money allocated = Money.of(contracts.sumActiveAllocations(jobId), price.getCurrency());
        Set<UUID> seen = new HashSet<>();
        List<Money> amounts = new ArrayList<>();
        for (WorkerAllocation allocation : allocations) {
            if (allocation.getWorkerId() == null) {
                throw new ValidationException("Worker id is required");
            }
            if (!seen.add(allocation.getWorkerId()) || contracts.hasActiveContract(jobId, allocation.getWorkerId())) {
                throw new ValidationException("Worker " + allocation.getWorkerId() + " already has a contract for job " + jobId);
            }
            Money amount = resolveAmount(allocation, price);
            amounts.add(amount);
            allocated = allocated.plus(amount);
        }
        if (allocated.isGreaterThan(price)) {
            throw new ValidationException(ErrorCode.ALLOCATION_EXCEEDED, String.format(
                "Allocations of %s exceed the budget %s of job %s", allocated, price, jobId));
        }

        List<Contract> created = new ArrayList<>();
        for (int i = 0; i < allocations.size(); i++) {
            WorkerAllocation allocation = allocations.get(i);
            Money amount = amounts.get(i);
            created.add(contractService.createContract(CreateContractCommand.builder()
                .requesterId(requesterId)
                .workerId(allocation.getWorkerId())
                .jobId(jobId)
                .title(job.getTitle())
                .basePrice(amount)
                .startDate(allocation.getStartDate())
                .endDate(allocation.getEndDate())
                .escrowEnabled(allocation.isEscrowEnabled())
                .allocatedAmount(amount)
                .percentageOfBudget(percentageOf(amount, price))
                .build()));
        }
        log.info("Selected {} workers for job {}: allocated {} of {}", created.size(), jobId, allocated, price);
        return created;
    }

    /**
     * Changes one worker's allocation while the contract is still a draft or pending.
     * The contract is repriced at its stored commission rate.
     */
    @Transactional
    public Contract reallocate(UUID contractId, UUID actor, Money amount) {
        Contract snapshot = contracts.getById(contractId);
        if (snapshot.getJobId() == null) {
            throw new ValidationException("Contract " + contractId + " is not part of a job allocation");
        }
        JobEntity job = lockJob(snapshot.getJobId());
        Contract contract = contracts.lock(contractId);
        if (!contract.getRequesterId().equals(actor)) {
            throw new ActionNotAllowedException("Only the requester can change allocations of contract " + contractId);
        }
        if (amount == null || amount.isZero()) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Allocation must be positive");
        }

        Money price = job.getPrice();
        Money current = contract.getAllocatedAmount() != null ? contract.getAllocatedAmount() : Money.zero(price.getCurrency());
        Money others = Money.of(contracts.sumActiveAllocations(job.getId()), price.getCurrency()).minus(current);
        if (others.plus(amount).isGreaterThan(price)) {
            throw new ValidationException(ErrorCode.ALLOCATION_EXCEEDED, String.format(
                "Allocation %s exceeds the remaining budget %s of job %s", amount, price.minus(others), job.getId()));
        }

        Instant now = clock.instant();
        Contract reallocated = contracts.update(contract.reallocate(amount, percentageOf(amount, price),
                commissionCalculator.commissionAt(amount, contract.getCommissionRate()), now));
        contractEvents.recordChange(contract, reallocated, actor, "CONTRACT_REALLOCATED", AuditSeverity.MEDIUM,
                "Allocation changed from " + current + " to " + amount, now);
        log.info("Contract {} reallocated: {} -> {}", contractId, current, amount);
        return reallocated;
    }

    private JobEntity lockJob(UUID jobId) {
        return jobRepository.findByIdForUpdate(jobId)
            .orElseThrow(() -> new ResourceNotFoundException("Job", jobId));
    }

    private static Money resolveAmount(WorkerAllocation allocation, Money price) {
        if ((allocation.getAmount() == null) == (allocation.getPercentage() == null)) {
            throw new ValidationException("Each allocation needs either an amount or a percentage");
        }
        Money amount;
        if (allocation.getAmount() != null) {
            amount = Money.ofMajor(allocation.getAmount(), price.getCurrency());
        } else {
            BigDecimal pct = allocation.getPercentage();
            if (pct.signum() <= 0 || pct.compareTo(HUNDRED) > 0) {
                throw new ValidationException("Percentage must be between 0 and 100: " + pct);
            }
            long minor = BigDecimal.valueOf(price.getMinorUnits())
                .multiply(pct)
                .divide(HUNDRED, 0, RoundingMode.HALF_UP)
                .longValueExact();
            amount = Money.of(minor, price.getCurrency());
        }
        if (amount.isZero()) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Allocation must be positive");
        }
        return amount;
    }

    private static BigDecimal percentageOf(Money amount, Money price) {
        if (price.isZero()) {
            return BigDecimal.ZERO.setScale(2);
        }
        return BigDecimal.valueOf(amount.getMinorUnits())
            .multiply(HUNDRED)
            .divide(BigDecimal.valueOf(price.getMinorUnits()), 2, RoundingMode.HALF_UP);
    }
}
