package com.flagship.escrow_engine.contract;

import com.flagship.escrow_engine.audit.AuditSeverity;
import com.flagship.escrow_engine.commission.CommissionCalculator;
import com.flagship.escrow_engine.commission.CommissionInput;
import com.flagship.escrow_engine.commission.CommissionQuote;
import com.flagship.escrow_engine.config.EscrowProperties;
import com.flagship.escrow_engine.contract.event.ContractExtensionEvent;
import com.flagship.escrow_engine.exception.ActionNotAllowedException;
import com.flagship.escrow_engine.exception.ConcurrentModificationException;
import com.flagship.escrow_engine.exception.ErrorCode;
import com.flagship.escrow_engine.exception.InvalidTransitionException;
import com.flagship.escrow_engine.exception.ValidationException;
import com.flagship.escrow_engine.member.MembershipDirectory;
import com.flagship.escrow_engine.member.MembershipProfile;
import com.flagship.escrow_engine.money.Money;
import com.flagship.escrow_engine.notification.Notification;
import com.flagship.escrow_engine.notification.NotificationDispatcher;
import com.flagship.escrow_engine.notification.NotificationType;
import com.flagship.escrow_engine.observability.CorrelationContext;
import com.flagship.escrow_engine.observability.EscrowMetrics;
import com.flagship.escrow_engine.payment.Payment;
import com.flagship.escrow_engine.payment.PaymentLedgerService;
import com.flagship.escrow_engine.payment.PaymentStatus;
import com.flagship.escrow_engine.payment.ReleaseTrigger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Contract lifecycle operations.
 *
 * Each operation locks the contract row, applies one domain transition and writes the
 * new state together with its outbox event and audit entry. Notifications go out only
 * after commit. Guard failures throw before anything is written.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContractService {

    private final ContractPersistenceService contracts;
    private final ContractEventRecorder contractEvents;
    private final CommissionCalculator commissionCalculator;
    private final MembershipDirectory membershipDirectory;
    private final PairingCodeGenerator pairingCodeGenerator;
    private final PaymentLedgerService paymentLedger;
    private final NotificationDispatcher notifications;
    private final TransactionTemplate transactionTemplate;
    private final EscrowProperties properties;
    private final EscrowMetrics metrics;
    private final Clock clock;

    /**
     * Prices and creates a DRAFT contract, consuming a free credit when the quote used one.
     */
    @Transactional
    public Contract createContract(CreateContractCommand command) {
        if (command.getBasePrice() == null || command.getBasePrice().isZero()) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Base price must be positive");
        }
        Instant now = clock.instant();
        MembershipProfile payer = membershipDirectory.lockForUpdate(command.getRequesterId());
        membershipDirectory.getProfile(command.getWorkerId());

        Instant monthStart = now.atZone(ZoneOffset.UTC)
            .withDayOfMonth(1)
            .truncatedTo(ChronoUnit.DAYS)
            .toInstant();
        CommissionQuote quote = commissionCalculator.calculate(CommissionInput.builder()
            .tier(payer.getTier())
            .freeContractsRemaining(payer.getFreeContractsRemaining())
            .currentCommissionRate(payer.getCurrentCommissionRate())
            .contractsThisMonth(contracts.countCreatedSince(payer.getUserId(), monthStart))
            .basePrice(command.getBasePrice())
            .build());

        if (quote.isConsumedFreeCredit() && !membershipDirectory.consumeFreeContractCredit(payer.getUserId())) {
            throw new ConcurrentModificationException("Free contract credit of " + payer.getUserId() + " was already used");
        }

        Contract draft = Contract.draft(UUID.randomUUID(), command.getJobId(), command.getRequesterId(),
            command.getWorkerId(), command.getTitle(), quote.getBasePrice(), quote.getCommission(),
            quote.getEffectiveRate(), command.getStartDate(), command.getEndDate(), command.isEscrowEnabled(),
            command.getAllocatedAmount(), command.getPercentageOfBudget(), now);
        Contract saved = contracts.insert(draft);
        contractEvents.recordCreated(saved, command.getRequesterId());

        log.info("Contract created: id={}, base={}, commission={}, rate={}, freeCredit={}",
                saved.getId(), saved.getBasePrice(), saved.getCommission(), saved.getCommissionRate(),
                quote.isConsumedFreeCredit());
        return saved;
    }

    @Transactional(readOnly = true)
    public Contract getContract(UUID contractId) {
        return contracts.getById(contractId);
    }

    /**
     * DRAFT -> PENDING. Both parties must have verified identities.
     */
    @Transactional
    public Contract submit(UUID contractId, UUID actor) {
        MDC.put(CorrelationContext.CONTRACT_ID_MDC_KEY, contractId.toString());
        try {
            Contract contract = contracts.lock(contractId);
            requireRole(contract, actor, ContractParty.REQUESTER, "submit");
            if (!membershipDirectory.isIdentityVerified(contract.getRequesterId())
                    || !membershipDirectory.isIdentityVerified(contract.getWorkerId())) {
                throw new InvalidTransitionException(
                    "Both parties must verify their identity before contract " + contractId + " is submitted");
            }
            Instant now = clock.instant();
            Contract submitted = transition(contract,
                contract.submit(pairingCodeGenerator.next(), properties.getContract().getPairingCodeTtl(), now),
                actor, "CONTRACT_SUBMITTED", AuditSeverity.LOW, "Contract submitted, pairing code issued", now);
            notifyPairingCode(submitted, now);
            return submitted;
        } finally {
            MDC.remove(CorrelationContext.CONTRACT_ID_MDC_KEY);
        }
    }

    @Transactional
    public Contract regeneratePairingCode(UUID contractId, UUID actor) {
        Contract contract = contracts.lock(contractId);
        contract.partyOf(actor);
        Instant now = clock.instant();
        Contract regenerated = transition(contract,
            contract.regeneratePairingCode(pairingCodeGenerator.next(), properties.getContract().getPairingCodeTtl(), now),
            actor, "PAIRING_CODE_REGENERATED", AuditSeverity.LOW, "Pairing code regenerated", now);
        notifyPairingCode(regenerated, now);
        return regenerated;
    }

    /**
     * One side confirms the pairing code. ACCEPTED once both sides did.
     */
    @Transactional
    public Contract confirmPairing(UUID contractId, UUID actor, String code) {
        MDC.put(CorrelationContext.CONTRACT_ID_MDC_KEY, contractId.toString());
        try {
            Contract contract = contracts.lock(contractId);
            ContractParty party = contract.partyOf(actor);
            Instant now = clock.instant();
            if (contract.getStatus() == ContractStatus.PENDING && contract.isPairingExpired(now)) {
                throw new ValidationException(ErrorCode.PAIRING_EXPIRED,
                    "Pairing code of contract " + contractId + " has expired");
            }
            if (contract.getStatus() == ContractStatus.PENDING && !codeMatches(contract.getPairingCode(), code)) {
                throw new ValidationException(ErrorCode.PAIRING_CODE_MISMATCH,
                    "Pairing code does not match contract " + contractId);
            }
            Contract confirmed = transition(contract, contract.confirmPairing(party, now), actor,
                "PAIRING_CONFIRMED", AuditSeverity.LOW, party + " confirmed the pairing code", now);
            if (confirmed.getStatus() == ContractStatus.ACCEPTED) {
                notifyBoth(confirmed, NotificationType.CONTRACT_ACCEPTED, Map.of(), now);
            }
            return confirmed;
        } finally {
            MDC.remove(CorrelationContext.CONTRACT_ID_MDC_KEY);
        }
    }

    /**
     * Explicit acceptance for contracts without escrow.
     */
    @Transactional
    public Contract signOff(UUID contractId, UUID actor) {
        Contract contract = contracts.lock(contractId);
        ContractParty party = contract.partyOf(actor);
        Instant now = clock.instant();
        Contract signed = transition(contract, contract.signOff(party, now), actor,
            "CONTRACT_SIGNED_OFF", AuditSeverity.LOW, party + " signed off", now);
        if (signed.getStatus() == ContractStatus.ACCEPTED) {
            notifyBoth(signed, NotificationType.CONTRACT_ACCEPTED, Map.of(), now);
        }
        return signed;
    }

    /**
     * IN_PROGRESS -> WAITING_APPROVAL, by the worker.
     */
    @Transactional
    public Contract markWorkComplete(UUID contractId, UUID actor) {
        Contract contract = contracts.lock(contractId);
        requireRole(contract, actor, ContractParty.WORKER, "mark work complete on");
        Instant now = clock.instant();
        Contract done = transition(contract, contract.markWorkComplete(now), actor,
            "WORK_COMPLETED", AuditSeverity.LOW, "Worker marked the work complete", now);
        notifications.sendAfterCommit(Notification.of(done.getRequesterId(), NotificationType.WORK_COMPLETED,
                done.getId(), Map.of(), now));
        return done;
    }

    /**
     * WAITING_APPROVAL -> COMPLETED, by the requester. Releases every held payment.
     */
    @Transactional
    public Contract approveCompletion(UUID contractId, UUID actor) {
        MDC.put(CorrelationContext.CONTRACT_ID_MDC_KEY, contractId.toString());
        try {
            Contract contract = contracts.lock(contractId);
            requireRole(contract, actor, ContractParty.REQUESTER, "approve");
            if (contract.getStatus() != ContractStatus.WAITING_APPROVAL) {
                throw InvalidTransitionException.of("contract", contractId, contract.getStatus(), ContractStatus.COMPLETED);
            }
            Instant now = clock.instant();
            if (contract.isEscrowEnabled()) {
                paymentLedger.releaseHeldPayments(contractId, actor, ReleaseTrigger.REQUESTER_APPROVAL, now);
                return contracts.lock(contractId);
            }
            Contract completed = transition(contract, contract.complete(now), actor,
                "CONTRACT_COMPLETED", AuditSeverity.LOW, "Requester approved the work", now);
            notifications.sendAfterCommit(Notification.of(completed.getWorkerId(), NotificationType.CONTRACT_COMPLETED,
                    completed.getId(), Map.of(), now));
            return completed;
        } finally {
            MDC.remove(CorrelationContext.CONTRACT_ID_MDC_KEY);
        }
    }

    /**
     * WAITING_APPROVAL -> DISPUTED, by either party.
     */
    @Transactional
    public Contract openDispute(UUID contractId, UUID actor, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("A dispute reason is required");
        }
        Contract contract = contracts.lock(contractId);
        Instant now = clock.instant();
        Contract disputed = transition(contract, contract.openDispute(actor, reason, now), actor,
            "DISPUTE_OPENED", AuditSeverity.MEDIUM, "Dispute opened: " + reason, now);
        notifications.sendAfterCommit(Notification.of(disputed.counterpartOf(actor), NotificationType.DISPUTE_OPENED,
                disputed.getId(), Map.of("reason", reason), now));
        return disputed;
    }

    /**
     * Settles a dispute: funds either go to the worker (COMPLETED) or back to the
     * requester (CANCELLED). Refunds call the gateway, so this runs outside a
     * surrounding transaction.
     *
     * @param actor the operator resolving the dispute
     */
    public Contract resolveDispute(UUID contractId, UUID actor, DisputeResolution resolution, String note) {
        if (resolution == null) {
            throw new ValidationException("A resolution is required");
        }
        MDC.put(CorrelationContext.CONTRACT_ID_MDC_KEY, contractId.toString());
        try {
            Contract contract = contracts.getById(contractId);
            requireStatus(contract, ContractStatus.DISPUTED, "resolve a dispute on");
            String reason = note != null && !note.isBlank() ? note : "Dispute resolved: " + resolution;

            if (resolution == DisputeResolution.REFUND_TO_REQUESTER) {
                List<Payment> held = paymentLedger.findByContract(contractId).stream()
                    .filter(p -> p.getStatus() == PaymentStatus.HELD_ESCROW)
                    .toList();
                for (Payment payment : held) {
                    paymentLedger.refund(payment.getId(), reason, actor);
                }
            }

            Contract resolved = transactionTemplate.execute(status -> {
                Contract current = contracts.lock(contractId);
                Instant now = clock.instant();
                Contract after = current;
                if (current.getStatus() == ContractStatus.DISPUTED) {
                    if (resolution == DisputeResolution.REFUND_TO_REQUESTER) {
                        paymentLedger.failOpenOrders(contractId, "Contract cancelled", now);
                        after = contracts.update(current.cancel(reason, now));
                    } else if (current.isEscrowEnabled()) {
                        paymentLedger.releaseHeldPayments(contractId, actor, ReleaseTrigger.DISPUTE_RESOLUTION, now);
                        current = contracts.lock(contractId);
                        after = current;
                    } else {
                        after = contracts.update(current.complete(now));
                    }
                }
                contractEvents.recordChange(current, after, actor, "DISPUTE_RESOLVED", AuditSeverity.HIGH,
                        "Dispute resolved (" + resolution + "): " + reason, now);
                notifyBoth(after, NotificationType.DISPUTE_RESOLVED, Map.of("resolution", resolution.name()), now);
                return after;
            });
            log.info("Dispute resolved: contractId={}, resolution={}, status={}",
                    contractId, resolution, resolved.getStatus());
            return resolved;
        } finally {
            MDC.remove(CorrelationContext.CONTRACT_ID_MDC_KEY);
        }
    }

    /**
     * Direct cancellation: only before any funds are held. Funded contracts go through
     * a dispute or a refund.
     */
    @Transactional
    public Contract cancel(UUID contractId, UUID actor, String reason) {
        Contract contract = contracts.lock(contractId);
        contract.partyOf(actor);
        if (!contract.getStatus().isDirectlyCancellable()) {
            throw new InvalidTransitionException(String.format(
                "Contract %s cannot be cancelled directly in %s status; open a dispute instead",
                contractId, contract.getStatus()));
        }
        if (paymentLedger.hasHeldPayments(contractId)) {
            throw new InvalidTransitionException(
                "Contract " + contractId + " has funds held in escrow; request a refund instead");
        }
        Instant now = clock.instant();
        paymentLedger.failOpenOrders(contractId, "Contract cancelled", now);
        Contract cancelled = transition(contract, contract.cancel(reason, now), actor,
            "CONTRACT_CANCELLED", AuditSeverity.LOW, "Contract cancelled: " + reason, now);
        notifications.sendAfterCommit(Notification.of(cancelled.counterpartOf(actor), NotificationType.CONTRACT_CANCELLED,
                cancelled.getId(), reason != null ? Map.of("reason", reason) : Map.of(), now));
        return cancelled;
    }

    // ==================== Extensions ====================

    @Transactional
    public Contract requestExtension(UUID contractId, UUID actor, int days, Money newPrice) {
        Contract contract = contracts.lock(contractId);
        Instant now = clock.instant();
        Contract requested = transition(contract,
            contract.requestExtension(actor, days, newPrice, properties.getContract().getMaxExtensions(), now),
            actor, "EXTENSION_REQUESTED", AuditSeverity.MEDIUM,
            "Extension of " + days + " days requested" + (newPrice != null ? " at " + newPrice : ""), now);
        PendingExtension pending = requested.getPendingExtension();
        contractEvents.publish(contractId, ContractExtensionEvent.of(contractId, ContractExtensionEvent.REQUESTED,
                days, pending.changesPrice() ? pending.getNewPrice().getMinorUnits() : null, actor, now));
        notifications.sendAfterCommit(Notification.of(requested.counterpartOf(actor), NotificationType.EXTENSION_REQUESTED,
                contractId, Map.of("days", String.valueOf(days)), now));
        return requested;
    }

    /**
     * The counterpart accepts or rejects the staged extension. An accepted price change
     * voids open orders for the old amount; the requester then pays the difference as
     * a separate top-up.
     */
    @Transactional
    public Contract respondToExtension(UUID contractId, UUID actor, boolean accept) {
        Contract contract = contracts.lock(contractId);
        PendingExtension pending = contract.getPendingExtension();
        Instant now = clock.instant();

        Contract after;
        if (accept) {
            Money newCommission = pending.changesPrice()
                ? commissionCalculator.commissionAt(pending.getNewPrice(), contract.getCommissionRate())
                : null;
            after = transition(contract, contract.acceptExtension(actor, newCommission, now), actor, "EXTENSION_ACCEPTED",
                AuditSeverity.MEDIUM, "Extension accepted", now);
            if (pending.changesPrice()) {
                paymentLedger.failOpenOrders(contractId, "Contract repriced by extension", now);
            }
        } else {
            after = transition(contract, contract.rejectExtension(actor, now), actor, "EXTENSION_REJECTED",
                AuditSeverity.MEDIUM, "Extension rejected", now);
        }
        contractEvents.publish(contractId, ContractExtensionEvent.of(contractId,
                accept ? ContractExtensionEvent.ACCEPTED : ContractExtensionEvent.REJECTED,
                pending.getDays(), pending.changesPrice() ? pending.getNewPrice().getMinorUnits() : null, actor, now));
        notifications.sendAfterCommit(Notification.of(pending.getRequestedBy(),
                accept ? NotificationType.EXTENSION_ACCEPTED : NotificationType.EXTENSION_REJECTED,
                contractId, Map.of("days", String.valueOf(pending.getDays())), now));
        return after;
    }

    /**
     * Hides a completed or cancelled contract. The row and its history stay.
     */
    @Transactional
    public Contract softDelete(UUID contractId, UUID actor, String reason) {
        Contract contract = contracts.lock(contractId);
        contract.partyOf(actor);
        Instant now = clock.instant();
        return transition(contract, contract.softDelete(actor, reason, now), actor,
            "CONTRACT_DELETED", AuditSeverity.HIGH, "Contract deleted: " + reason, now);
    }

    // ==================== Helpers ====================

    private Contract transition(Contract before, Contract after, UUID actor, String action,
                                AuditSeverity severity, String description, Instant now) {
        Contract saved = contracts.update(after);
        contractEvents.recordChange(before, saved, actor, action, severity, description, now);
        if (before.getStatus() != saved.getStatus()) {
            metrics.recordContractTransition(before.getStatus().name(), saved.getStatus().name());
            log.info("Contract {} moved {} -> {} ({})", saved.getId(), before.getStatus(), saved.getStatus(), action);
        }
        return saved;
    }

    private static void requireRole(Contract contract, UUID actor, ContractParty role, String action) {
        if (contract.partyOf(actor) != role) {
            throw new ActionNotAllowedException(String.format(
                "Only the %s can %s contract %s", role.name().toLowerCase(), action, contract.getId()));
        }
    }

    private static void requireStatus(Contract contract, ContractStatus expected, String action) {
        if (contract.getStatus() != expected) {
            throw new InvalidTransitionException(String.format(
                "Cannot %s contract %s in %s status", action, contract.getId(), contract.getStatus()));
        }
    }

    private static boolean codeMatches(String expected, String provided) {
        if (expected == null || provided == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                provided.trim().getBytes(StandardCharsets.UTF_8));
    }

    private void notifyPairingCode(Contract contract, Instant now) {
        notifyBoth(contract, NotificationType.PAIRING_CODE_ISSUED, Map.of(
            "pairingCode", contract.getPairingCode(),
            "expiresAt", contract.getPairingExpiry().toString()), now);
    }

    private void notifyBoth(Contract contract, NotificationType type, Map<String, String> data, Instant now) {
        notifications.sendAfterCommit(Notification.of(contract.getRequesterId(), type, contract.getId(), data, now));
        notifications.sendAfterCommit(Notification.of(contract.getWorkerId(), type, contract.getId(), data, now));
    }
}
