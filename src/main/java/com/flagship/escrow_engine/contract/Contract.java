package com.flagship.escrow_engine.contract;

import com.flagship.escrow_engine.exception.InvalidTransitionException;
import com.flagship.escrow_engine.exception.NotAPartyException;
import com.flagship.escrow_engine.exception.ValidationException;
import com.flagship.escrow_engine.money.CommissionRate;
import com.flagship.escrow_engine.money.CurrencyCode;
import com.flagship.escrow_engine.money.EscrowState;
import com.flagship.escrow_engine.money.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Contract domain object: one agreement between a requester and one worker.
 *
 * Key principles:
 * - Status moves only along the edges of {@link ContractStatus}
 * - Every transition returns a new instance; a refused transition throws
 *   and leaves the receiver untouched
 * - totalPrice == basePrice + commission at all times
 * - commissionRate is the rate fixed at creation and reused when an
 *   extension changes the price
 */
@Value
@Builder(toBuilder = true)
public class Contract {
    UUID id;
    UUID jobId;
    UUID requesterId;
    UUID workerId;
    String title;

    Money basePrice;
    Money commission;
    Money totalPrice;
    CommissionRate commissionRate;

    ContractStatus status;
    ContractStatus previousStatus;
    Instant startDate;
    Instant endDate;

    boolean escrowEnabled;
    Money escrowAmount;
    EscrowState escrowStatus;

    String pairingCode;
    Instant pairingExpiry;
    boolean requesterConfirmed;
    boolean workerConfirmed;
    boolean requesterSignedOff;
    boolean workerSignedOff;

    int extensionCount;
    @Builder.Default
    List<ExtensionRecord> extensionHistory = List.of();
    PendingExtension pendingExtension;

    Money allocatedAmount;
    BigDecimal percentageOfBudget;

    Instant workCompletedAt;
    Instant approvalReminderSentAt;
    Instant overdueFlaggedAt;

    UUID disputedBy;
    String disputeReason;
    Instant disputedAt;

    String cancellationReason;

    boolean deleted;
    Instant deletedAt;
    UUID deletedBy;
    String deletionReason;

    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new contract in DRAFT status with a priced commission.
     */
    public static Contract draft(UUID id, UUID jobId, UUID requesterId, UUID workerId, String title,
                                 Money basePrice, Money commission, CommissionRate commissionRate,
                                 Instant startDate, Instant endDate, boolean escrowEnabled,
                                 Money allocatedAmount, BigDecimal percentageOfBudget, Instant now) {
        if (requesterId == null || workerId == null) {
            throw new ValidationException("Requester and worker are required");
        }
        if (requesterId.equals(workerId)) {
            throw new ValidationException("Requester and worker must be different users");
        }
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            throw new ValidationException("End date must not be before start date");
        }
        return Contract.builder()
            .id(id)
            .jobId(jobId)
            .requesterId(requesterId)
            .workerId(workerId)
            .title(title)
            .basePrice(basePrice)
            .commission(commission)
            .totalPrice(basePrice.plus(commission))
            .commissionRate(commissionRate)
            .status(ContractStatus.DRAFT)
            .startDate(startDate)
            .endDate(endDate)
            .escrowEnabled(escrowEnabled)
            .escrowAmount(Money.zero(basePrice.getCurrency()))
            .escrowStatus(EscrowState.PENDING)
            .allocatedAmount(allocatedAmount)
            .percentageOfBudget(percentageOfBudget)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    public CurrencyCode getCurrency() {
        return basePrice.getCurrency();
    }

    public ContractParty partyOf(UUID userId) {
        if (requesterId.equals(userId)) {
            return ContractParty.REQUESTER;
        }
        if (workerId.equals(userId)) {
            return ContractParty.WORKER;
        }
        throw new NotAPartyException(userId, id);
    }

    public UUID counterpartOf(UUID userId) {
        return partyOf(userId) == ContractParty.REQUESTER ? workerId : requesterId;
    }

    public boolean hasFundsHeld() {
        return escrowStatus == EscrowState.HELD;
    }

    // ==================== Lifecycle ====================

    /**
     * DRAFT -> PENDING, issuing a fresh pairing code.
     */
    public Contract submit(String code, Duration pairingTtl, Instant now) {
        requireTransition(ContractStatus.PENDING);
        return toBuilder()
            .status(ContractStatus.PENDING)
            .pairingCode(code)
            .pairingExpiry(now.plus(pairingTtl))
            .requesterConfirmed(false)
            .workerConfirmed(false)
            .requesterSignedOff(false)
            .workerSignedOff(false)
            .updatedAt(now)
            .build();
    }

    /**
     * Replaces the pairing code while still PENDING; previous confirmations are dropped.
     */
    public Contract regeneratePairingCode(String code, Duration pairingTtl, Instant now) {
        requireStatus(ContractStatus.PENDING, "regenerate pairing code");
        return toBuilder()
            .pairingCode(code)
            .pairingExpiry(now.plus(pairingTtl))
            .requesterConfirmed(false)
            .workerConfirmed(false)
            .updatedAt(now)
            .build();
    }

    public boolean isPairingExpired(Instant now) {
        return pairingExpiry != null && !now.isBefore(pairingExpiry);
    }

    /**
     * Records one side's pairing confirmation. Returns ACCEPTED once both sides confirmed.
     * Code and expiry checks are done by the caller so their errors carry distinct codes.
     */
    public Contract confirmPairing(ContractParty party, Instant now) {
        requireStatus(ContractStatus.PENDING, "confirm pairing");
        if (!escrowEnabled) {
            throw new InvalidTransitionException(
                "Contract " + id + " has escrow disabled; both parties must sign off instead");
        }
        boolean requester = requesterConfirmed || party == ContractParty.REQUESTER;
        boolean worker = workerConfirmed || party == ContractParty.WORKER;
        return toBuilder()
            .requesterConfirmed(requester)
            .workerConfirmed(worker)
            .status(requester && worker ? ContractStatus.ACCEPTED : status)
            .updatedAt(now)
            .build();
    }

    /**
     * Explicit sign-off for contracts without escrow. Returns ACCEPTED once both sides signed.
     */
    public Contract signOff(ContractParty party, Instant now) {
        requireStatus(ContractStatus.PENDING, "sign off");
        if (escrowEnabled) {
            throw new InvalidTransitionException(
                "Contract " + id + " uses escrow; confirm the pairing code instead");
        }
        if (isPairingExpired(now)) {
            throw new InvalidTransitionException("Pairing window of contract " + id + " has expired");
        }
        boolean requester = requesterSignedOff || party == ContractParty.REQUESTER;
        boolean worker = workerSignedOff || party == ContractParty.WORKER;
        return toBuilder()
            .requesterSignedOff(requester)
            .workerSignedOff(worker)
            .status(requester && worker ? ContractStatus.ACCEPTED : status)
            .updatedAt(now)
            .build();
    }

    /**
     * ACCEPTED -> IN_PROGRESS.
     */
    public Contract start(Instant now) {
        requireTransition(ContractStatus.IN_PROGRESS);
        return toBuilder()
            .status(ContractStatus.IN_PROGRESS)
            .updatedAt(now)
            .build();
    }

    /**
     * Adds captured funds to the escrow. The initial hold also starts the work.
     */
    public Contract holdFunds(Money amount, boolean startWork, Instant now) {
        ContractBuilder next = toBuilder()
            .escrowAmount(escrowAmount.plus(amount))
            .escrowStatus(EscrowState.HELD)
            .updatedAt(now);
        if (startWork && status == ContractStatus.ACCEPTED) {
            next.status(ContractStatus.IN_PROGRESS);
        }
        return next.build();
    }

    /**
     * IN_PROGRESS -> WAITING_APPROVAL.
     */
    public Contract markWorkComplete(Instant now) {
        requireTransition(ContractStatus.WAITING_APPROVAL);
        return toBuilder()
            .status(ContractStatus.WAITING_APPROVAL)
            .workCompletedAt(now)
            .approvalReminderSentAt(null)
            .updatedAt(now)
            .build();
    }

    /**
     * WAITING_APPROVAL | DISPUTED -> COMPLETED. Held escrow becomes RELEASED.
     */
    public Contract complete(Instant now) {
        requireTransition(ContractStatus.COMPLETED);
        return toBuilder()
            .status(ContractStatus.COMPLETED)
            .escrowStatus(escrowStatus == EscrowState.HELD ? EscrowState.RELEASED : escrowStatus)
            .pendingExtension(null)
            .previousStatus(null)
            .updatedAt(now)
            .build();
    }

    /**
     * WAITING_APPROVAL -> DISPUTED.
     */
    public Contract openDispute(UUID openedBy, String reason, Instant now) {
        partyOf(openedBy);
        requireTransition(ContractStatus.DISPUTED);
        return toBuilder()
            .status(ContractStatus.DISPUTED)
            .disputedBy(openedBy)
            .disputeReason(reason)
            .disputedAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Any non-terminal -> CANCELLED. Callers decide whether a direct cancel is allowed.
     */
    public Contract cancel(String reason, Instant now) {
        requireTransition(ContractStatus.CANCELLED);
        return toBuilder()
            .status(ContractStatus.CANCELLED)
            .cancellationReason(reason)
            .pendingExtension(null)
            .previousStatus(null)
            .updatedAt(now)
            .build();
    }

    /**
     * Removes refunded funds from the escrow.
     */
    public Contract refundFunds(Money amount, Instant now) {
        Money remaining = escrowAmount.isGreaterThan(amount)
            ? escrowAmount.minus(amount)
            : Money.zero(getCurrency());
        return toBuilder()
            .escrowAmount(remaining)
            .escrowStatus(remaining.isZero() ? EscrowState.REFUNDED : escrowStatus)
            .updatedAt(now)
            .build();
    }

    public Contract markReminderSent(Instant now) {
        return toBuilder().approvalReminderSentAt(now).updatedAt(now).build();
    }

    public Contract flagOverdue(Instant now) {
        return toBuilder().overdueFlaggedAt(now).updatedAt(now).build();
    }

    /**
     * Marks a terminal contract as deleted. The row itself is kept.
     */
    public Contract softDelete(UUID actor, String reason, Instant now) {
        if (!status.isTerminal()) {
            throw new InvalidTransitionException(
                String.format("Only completed or cancelled contracts can be deleted; contract %s is %s", id, status));
        }
        if (deleted) {
            throw new InvalidTransitionException("Contract " + id + " is already deleted");
        }
        return toBuilder()
            .deleted(true)
            .deletedAt(now)
            .deletedBy(actor)
            .deletionReason(reason)
            .updatedAt(now)
            .build();
    }

    /**
     * Changes this worker's share of the job budget while the contract is not yet accepted.
     */
    public Contract reallocate(Money allocation, BigDecimal percentage, Money newCommission, Instant now) {
        if (status != ContractStatus.DRAFT && status != ContractStatus.PENDING) {
            throw new InvalidTransitionException(
                String.format("Allocation of contract %s cannot change in %s status", id, status));
        }
        return toBuilder()
            .allocatedAmount(allocation)
            .percentageOfBudget(percentage)
            .basePrice(allocation)
            .commission(newCommission)
            .totalPrice(allocation.plus(newCommission))
            .updatedAt(now)
            .build();
    }

    // ==================== Extensions ====================

    /**
     * Stages an extension request. Status is left unchanged and remembered in previousStatus.
     */
    public Contract requestExtension(UUID requestedBy, int days, Money newPrice, int maxExtensions, Instant now) {
        partyOf(requestedBy);
        if (status != ContractStatus.ACCEPTED && status != ContractStatus.IN_PROGRESS) {
            throw new InvalidTransitionException(
                String.format("Contract %s cannot be extended in %s status", id, status));
        }
        if (pendingExtension != null) {
            throw new InvalidTransitionException("Contract " + id + " already has a pending extension request");
        }
        if (extensionCount >= maxExtensions) {
            throw new InvalidTransitionException(
                String.format("Contract %s reached the maximum of %d extensions", id, maxExtensions));
        }
        if (days <= 0) {
            throw new ValidationException("Extension days must be positive: " + days);
        }
        Money stagedPrice = null;
        if (newPrice != null && !newPrice.equals(basePrice)) {
            if (newPrice.getCurrency() != getCurrency()) {
                throw new ValidationException("Extension price must be in " + getCurrency());
            }
            if (hasFundsHeld() && newPrice.compareTo(basePrice) < 0) {
                throw new InvalidTransitionException(
                    "Price of contract " + id + " cannot decrease once funds are held in escrow");
            }
            stagedPrice = newPrice;
        }
        return toBuilder()
            .pendingExtension(new PendingExtension(days, stagedPrice, requestedBy, now))
            .previousStatus(status)
            .updatedAt(now)
            .build();
    }

    /**
     * Applies the staged extension: later end date, history entry, and the new price
     * when it changed.
     *
     * @param newCommission commission on the staged price; ignored when the price is unchanged
     */
    public Contract acceptExtension(UUID respondedBy, Money newCommission, Instant now) {
        PendingExtension pending = requirePendingResponse(respondedBy);
        if (pending.changesPrice() && newCommission == null) {
            throw new ValidationException("Commission for the new price of contract " + id + " is required");
        }

        Instant newEndDate = endDate != null ? endDate.plus(Duration.ofDays(pending.getDays())) : null;
        List<ExtensionRecord> history = new ArrayList<>(extensionHistory);
        history.add(new ExtensionRecord(
            pending.getDays(),
            pending.changesPrice() ? basePrice.getMinorUnits() : null,
            pending.changesPrice() ? pending.getNewPrice().getMinorUnits() : null,
            pending.getRequestedBy(),
            pending.getRequestedAt(),
            respondedBy,
            now,
            endDate,
            newEndDate
        ));

        ContractBuilder next = toBuilder()
            .endDate(newEndDate)
            .extensionHistory(List.copyOf(history))
            .extensionCount(extensionCount + 1)
            .pendingExtension(null)
            .previousStatus(null)
            .overdueFlaggedAt(null)
            .updatedAt(now);

        if (pending.changesPrice()) {
            Money newBase = pending.getNewPrice();
            next.basePrice(newBase)
                .commission(newCommission)
                .totalPrice(newBase.plus(newCommission));
        }
        return next.build();
    }

    /**
     * Discards the staged extension and restores the status recorded at request time.
     */
    public Contract rejectExtension(UUID respondedBy, Instant now) {
        requirePendingResponse(respondedBy);
        return toBuilder()
            .status(previousStatus)
            .pendingExtension(null)
            .previousStatus(null)
            .updatedAt(now)
            .build();
    }

    private PendingExtension requirePendingResponse(UUID respondedBy) {
        partyOf(respondedBy);
        if (pendingExtension == null) {
            throw new InvalidTransitionException("Contract " + id + " has no pending extension request");
        }
        if (pendingExtension.getRequestedBy().equals(respondedBy)) {
            throw new InvalidTransitionException("An extension must be answered by the other party");
        }
        if (previousStatus != status) {
            throw new InvalidTransitionException(String.format(
                "Extension request on contract %s is stale: status moved from %s to %s",
                id, previousStatus, status));
        }
        return pendingExtension;
    }

    // ==================== Guards ====================

    private void requireTransition(ContractStatus target) {
        if (deleted) {
            throw new InvalidTransitionException("Contract " + id + " is deleted");
        }
        if (!status.canTransitionTo(target)) {
            throw InvalidTransitionException.of("contract", id, status, target);
        }
    }

    private void requireStatus(ContractStatus expected, String action) {
        if (status != expected) {
            throw new InvalidTransitionException(
                String.format("Cannot %s on contract %s in %s status", action, id, status));
        }
    }
}
