package com.flagship.escrow_engine.escrow;

import com.flagship.escrow_engine.audit.AuditSeverity;
import com.flagship.escrow_engine.config.EscrowProperties;
import com.flagship.escrow_engine.contract.Contract;
import com.flagship.escrow_engine.contract.ContractEventRecorder;
import com.flagship.escrow_engine.contract.ContractPersistenceService;
import com.flagship.escrow_engine.notification.Notification;
import com.flagship.escrow_engine.notification.NotificationDispatcher;
import com.flagship.escrow_engine.notification.NotificationType;
import com.flagship.escrow_engine.observability.CorrelationContext;
import com.flagship.escrow_engine.observability.EscrowMetrics;
import com.flagship.escrow_engine.payment.PaymentLedgerService;
import com.flagship.escrow_engine.payment.ReleaseTrigger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Time-driven contract maintenance.
 *
 * Every sweep reads candidate ids without locks, then handles each contract in
 * its own transaction that first claims the row with FOR UPDATE SKIP LOCKED.
 * A contract another node is already handling, or that no longer qualifies, is
 * skipped. One failing contract is logged and does not stop the sweep.
 *
 * Sweeps take "now" as a parameter; the scheduler passes the clock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowAutomationService {

    static final String AUTO_RELEASE = "auto_release";
    static final String REMINDER = "reminder";
    static final String OVERDUE = "overdue";
    static final String PAIRING_EXPIRY = "pairing_expiry";
    static final String SCHEDULED_START = "scheduled_start";
    static final String STALE_ORDERS = "stale_orders";

    private final ContractPersistenceService contracts;
    private final ContractEventRecorder contractEvents;
    private final PaymentLedgerService paymentLedger;
    private final NotificationDispatcher notifications;
    private final TransactionTemplate transactionTemplate;
    private final EscrowProperties properties;
    private final EscrowMetrics metrics;
    private final Clock clock;

    /**
     * Releases escrow of contracts waiting for approval longer than the auto-release period.
     *
     * @return number of contracts completed by this run
     */
    public int sweepAutoRelease(Instant now) {
        Instant cutoff = now.minus(properties.getAutomation().getAutoReleaseAfter());
        SweepBudget budget = budget();
        List<UUID> candidates = contracts.findAutoReleaseCandidates(cutoff, budget.remaining());
        return sweep(AUTO_RELEASE, candidates, budget, contractId -> {
            Optional<Contract> claimed = contracts.claimForAutoRelease(contractId, cutoff);
            if (claimed.isEmpty()) {
                return false;
            }
            boolean released = paymentLedger.releaseHeldPayments(contractId, null, ReleaseTrigger.AUTO_RELEASE, now);
            if (released) {
                Contract contract = claimed.get();
                Map<String, String> data = Map.of("amount", contract.getEscrowAmount().toString());
                notifications.sendAfterCommit(Notification.of(contract.getRequesterId(),
                        NotificationType.ESCROW_AUTO_RELEASED, contractId, data, now));
                notifications.sendAfterCommit(Notification.of(contract.getWorkerId(),
                        NotificationType.ESCROW_AUTO_RELEASED, contractId, data, now));
            }
            return released;
        });
    }

    /**
     * Reminds requesters whose approval is due soon. Each contract is reminded once.
     */
    public int sweepReminders(Instant now) {
        Instant windowStart = now.minus(properties.getAutomation().getAutoReleaseAfter());
        Instant windowEnd = now.minus(properties.getAutomation().getReminderAfter());
        SweepBudget budget = budget();
        List<UUID> candidates = contracts.findReminderCandidates(windowStart, windowEnd, budget.remaining());
        return sweep(REMINDER, candidates, budget, contractId -> {
            Optional<Contract> claimed = contracts.claimForReminder(contractId);
            if (claimed.isEmpty()) {
                return false;
            }
            Contract contract = claimed.get();
            Contract reminded = contracts.update(contract.markReminderSent(now));
            Instant releaseAt = contract.getWorkCompletedAt().plus(properties.getAutomation().getAutoReleaseAfter());
            notifications.sendAfterCommit(Notification.of(reminded.getRequesterId(), NotificationType.APPROVAL_REMINDER,
                    contractId, Map.of("autoReleaseAt", releaseAt.toString()), now));
            return true;
        });
    }

    /**
     * Flags in-progress contracts past their end date. Status is unchanged.
     */
    public int sweepOverdue(Instant now) {
        SweepBudget budget = budget();
        List<UUID> candidates = contracts.findOverdueCandidates(now, budget.remaining());
        return sweep(OVERDUE, candidates, budget, contractId -> {
            Optional<Contract> claimed = contracts.claimForOverdue(contractId, now);
            if (claimed.isEmpty()) {
                return false;
            }
            Contract contract = claimed.get();
            Contract flagged = contracts.update(contract.flagOverdue(now));
            contractEvents.recordChange(contract, flagged, null, "CONTRACT_OVERDUE", AuditSeverity.LOW,
                    "Contract passed its end date " + contract.getEndDate(), now);
            Map<String, String> data = Map.of("endDate", String.valueOf(contract.getEndDate()));
            notifications.sendAfterCommit(Notification.of(flagged.getRequesterId(), NotificationType.CONTRACT_OVERDUE,
                    contractId, data, now));
            notifications.sendAfterCommit(Notification.of(flagged.getWorkerId(), NotificationType.CONTRACT_OVERDUE,
                    contractId, data, now));
            return true;
        });
    }

    /**
     * Cancels pending contracts whose pairing code expired unconfirmed.
     */
    public int sweepPairingExpiry(Instant now) {
        SweepBudget budget = budget();
        List<UUID> candidates = contracts.findExpiredPairingCandidates(now, budget.remaining());
        return sweep(PAIRING_EXPIRY, candidates, budget, contractId -> {
            Optional<Contract> claimed = contracts.claimExpiredPairing(contractId, now);
            if (claimed.isEmpty()) {
                return false;
            }
            Contract contract = claimed.get();
            Contract cancelled = contracts.update(contract.cancel("Pairing code expired", now));
            contractEvents.recordChange(contract, cancelled, null, "PAIRING_EXPIRED", AuditSeverity.LOW,
                    "Pairing code expired at " + contract.getPairingExpiry(), now);
            metrics.recordContractTransition(contract.getStatus().name(), cancelled.getStatus().name());
            notifications.sendAfterCommit(Notification.of(cancelled.getRequesterId(), NotificationType.PAIRING_EXPIRED,
                    contractId, Map.of(), now));
            notifications.sendAfterCommit(Notification.of(cancelled.getWorkerId(), NotificationType.PAIRING_EXPIRED,
                    contractId, Map.of(), now));
            return true;
        });
    }

    /**
     * Starts accepted contracts without escrow once their start date is reached.
     */
    public int sweepScheduledStarts(Instant now) {
        SweepBudget budget = budget();
        List<UUID> candidates = contracts.findScheduledStartCandidates(now, budget.remaining());
        return sweep(SCHEDULED_START, candidates, budget, contractId -> {
            Optional<Contract> claimed = contracts.claimScheduledStart(contractId, now);
            if (claimed.isEmpty()) {
                return false;
            }
            Contract contract = claimed.get();
            Contract started = contracts.update(contract.start(now));
            contractEvents.recordChange(contract, started, null, "CONTRACT_STARTED", AuditSeverity.LOW,
                    "Start date " + contract.getStartDate() + " reached", now);
            metrics.recordContractTransition(contract.getStatus().name(), started.getStatus().name());
            return true;
        });
    }

    /**
     * Fails payments whose gateway order expired before the payer approved it.
     */
    public int sweepStaleOrders(Instant now) {
        try {
            int failed = paymentLedger.failStaleOrders(now, properties.getAutomation().getMaxContractsPerRun());
            metrics.recordSweep(STALE_ORDERS, "processed", failed);
            return failed;
        } catch (RuntimeException e) {
            log.error("Stale order sweep failed: {}", e.getMessage(), e);
            metrics.recordSweep(STALE_ORDERS, "failed", 1);
            return 0;
        }
    }

    private SweepBudget budget() {
        return new SweepBudget(properties.getAutomation().getMaxContractsPerRun(),
                properties.getAutomation().getMaxRunDuration(), clock);
    }

    private int sweep(String name, List<UUID> candidates, SweepBudget budget, Function<UUID, Boolean> handler) {
        int processed = 0;
        int skipped = 0;
        int failed = 0;
        for (UUID contractId : candidates) {
            if (!budget.tryAcquire()) {
                log.info("Sweep {} stopped at its run budget; {} candidates left for the next run",
                        name, candidates.size() - processed - skipped - failed);
                break;
            }
            MDC.put(CorrelationContext.CONTRACT_ID_MDC_KEY, contractId.toString());
            try {
                Boolean done = transactionTemplate.execute(status -> handler.apply(contractId));
                if (Boolean.TRUE.equals(done)) {
                    processed++;
                } else {
                    skipped++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Sweep {} failed for contract {}: {}", name, contractId, e.getMessage(), e);
            } finally {
                MDC.remove(CorrelationContext.CONTRACT_ID_MDC_KEY);
            }
        }
        metrics.recordSweep(name, "processed", processed);
        metrics.recordSweep(name, "skipped", skipped);
        metrics.recordSweep(name, "failed", failed);
        if (processed > 0 || failed > 0) {
            log.info("Sweep {} finished: processed={}, skipped={}, failed={}", name, processed, skipped, failed);
        }
        return processed;
    }
}
