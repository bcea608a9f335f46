package com.flagship.escrow_engine.payment;

import com.flagship.escrow_engine.audit.AuditCategory;
import com.flagship.escrow_engine.audit.AuditLogEntry;
import com.flagship.escrow_engine.audit.AuditSeverity;
import com.flagship.escrow_engine.audit.AuditTrailService;
import com.flagship.escrow_engine.audit.FieldChange;
import com.flagship.escrow_engine.contract.Contract;
import com.flagship.escrow_engine.contract.ContractEventRecorder;
import com.flagship.escrow_engine.contract.ContractParty;
import com.flagship.escrow_engine.contract.ContractPersistenceService;
import com.flagship.escrow_engine.contract.ContractStatus;
import com.flagship.escrow_engine.exception.ActionNotAllowedException;
import com.flagship.escrow_engine.exception.ConcurrentModificationException;
import com.flagship.escrow_engine.exception.GatewayRejectedException;
import com.flagship.escrow_engine.exception.InvalidTransitionException;
import com.flagship.escrow_engine.exception.ResourceNotFoundException;
import com.flagship.escrow_engine.exception.ValidationException;
import com.flagship.escrow_engine.gateway.GatewayCapture;
import com.flagship.escrow_engine.gateway.GatewayOrder;
import com.flagship.escrow_engine.gateway.GatewayProperties;
import com.flagship.escrow_engine.gateway.PaymentGateway;
import com.flagship.escrow_engine.money.Money;
import com.flagship.escrow_engine.notification.Notification;
import com.flagship.escrow_engine.notification.NotificationDispatcher;
import com.flagship.escrow_engine.notification.NotificationType;
import com.flagship.escrow_engine.observability.CorrelationContext;
import com.flagship.escrow_engine.observability.EscrowMetrics;
import com.flagship.escrow_engine.outbox.OutboxService;
import com.flagship.escrow_engine.payment.event.EscrowHeldEvent;
import com.flagship.escrow_engine.payment.event.EscrowReleasedEvent;
import com.flagship.escrow_engine.payment.event.PaymentCompletedEvent;
import com.flagship.escrow_engine.payment.event.PaymentEvent;
import com.flagship.escrow_engine.payment.event.PaymentFailedEvent;
import com.flagship.escrow_engine.payment.event.PaymentOrderOpenedEvent;
import com.flagship.escrow_engine.payment.event.PaymentRefundedEvent;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Payment ledger: orders, captures, escrow holds, releases and refunds.
 *
 * Key principles:
 * - Gateway calls never run inside a database transaction. Every operation that
 *   talks to the gateway is split into a short transaction before the call and
 *   one after it.
 * - Locks are always taken contract first, then payment.
 * - Capture and release are idempotent: repeating them returns the stored record.
 * - Every transition writes its outbox event in the same transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentLedgerService {

    public static final String AGGREGATE_TYPE = "Payment";

    private final PaymentPersistenceService payments;
    private final ContractPersistenceService contracts;
    private final ContractEventRecorder contractEvents;
    private final OutboxService outboxService;
    private final AuditTrailService auditTrailService;
    private final PaymentGateway gateway;
    private final IdempotencyService idempotencyService;
    private final NotificationDispatcher notifications;
    private final TransactionTemplate transactionTemplate;
    private final GatewayProperties gatewayProperties;
    private final EscrowMetrics metrics;
    private final Clock clock;

    // ==================== Orders ====================

    /**
     * Opens a gateway order for whatever the contract still owes.
     *
     * An existing PENDING payment with an order is returned as is, so a requester
     * who reloads the checkout page gets the same approval URL.
     */
    public Payment createContractPaymentOrder(UUID contractId, UUID actor) {
        MDC.put(CorrelationContext.CONTRACT_ID_MDC_KEY, contractId.toString());
        try {
            Payment payment = transactionTemplate.execute(status -> preparePayment(contractId, actor));
            if (payment.hasOrder()) {
                log.info("Reusing open order {} for contract {}", payment.getGatewayOrderId(), contractId);
                return payment;
            }
            return openOrder(payment.getId());
        } finally {
            MDC.remove(CorrelationContext.CONTRACT_ID_MDC_KEY);
        }
    }

    /**
     * Creates the gateway order for a PENDING payment that has none yet.
     *
     * The payment row exists before the gateway is called. A rejection marks it FAILED;
     * exhausted retries leave it PENDING without an order for the next attempt to reuse.
     */
    public Payment openOrder(UUID paymentId) {
        MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, paymentId.toString());
        try {
            Payment payment = payments.getById(paymentId);
            if (payment.getStatus() != PaymentStatus.PENDING || payment.hasOrder()) {
                return payment;
            }
            Contract contract = contracts.getById(payment.getContractId());

            GatewayOrder order;
            try {
                order = gateway.createOrder(payment.getAmount(), describe(contract, payment),
                        contract.getId().toString());
            } catch (GatewayRejectedException e) {
                Instant now = clock.instant();
                transactionTemplate.executeWithoutResult(status -> {
                    Payment current = payments.lock(paymentId);
                    if (current.getStatus() == PaymentStatus.PENDING) {
                        markFailed(current, "Gateway rejected order: " + e.getProviderCode(), now);
                    }
                });
                throw e;
            }

            Instant now = clock.instant();
            Payment opened = transactionTemplate.execute(status -> {
                contracts.lock(payment.getContractId());
                Payment current = payments.lock(paymentId);
                if (current.getStatus() != PaymentStatus.PENDING || current.hasOrder()) {
                    log.warn("Payment {} changed while order {} was being created (status={}, order={}); "
                            + "new order left unused", paymentId, order.getOrderId(),
                            current.getStatus(), current.getGatewayOrderId());
                    return current;
                }
                Payment withOrder = payments.update(current.withOrder(order.getOrderId(), order.getApprovalUrl(), now));
                publish(withOrder, PaymentOrderOpenedEvent.fromPayment(withOrder, now));
                audit(current.getPayerId(), "PAYMENT_ORDER_OPENED", AuditSeverity.LOW, withOrder,
                        "Gateway order opened for " + withOrder.getAmount(),
                        List.of(FieldChange.of("gatewayOrderId", null, order.getOrderId())));
                return withOrder;
            });
            if (opened.hasOrder()) {
                idempotencyService.remember(opened.getGatewayOrderId(), opened.getId());
            }
            log.info("Payment order opened: paymentId={}, orderId={}, amount={}, kind={}",
                    opened.getId(), opened.getGatewayOrderId(), opened.getAmount(), opened.getKind());
            return opened;
        } finally {
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }

    private Payment preparePayment(UUID contractId, UUID actor) {
        Contract contract = contracts.lock(contractId);
        if (contract.partyOf(actor) != ContractParty.REQUESTER) {
            throw new ActionNotAllowedException("Only the requester pays for contract " + contractId);
        }
        if (contract.isDeleted() || !isPayable(contract.getStatus())) {
            throw new InvalidTransitionException(String.format(
                "Contract %s cannot be paid in %s status", contractId, contract.getStatus()));
        }

        List<Payment> existing = payments.findByContract(contractId);
        Payment reusable = null;
        Money funded = Money.zero(contract.getCurrency());
        Money feesCharged = Money.zero(contract.getCurrency());
        boolean captured = false;
        for (Payment payment : existing) {
            if (payment.getStatus() == PaymentStatus.PENDING && payment.getRefundRequestedAt() == null) {
                if (payment.hasOrder()) {
                    return payment;
                }
                reusable = payment;
                continue;
            }
            if (payment.getStatus().isFunding()) {
                funded = funded.plus(payment.getAmount());
                feesCharged = feesCharged.plus(payment.getPlatformFee());
                captured = true;
            }
        }

        if (!contract.getTotalPrice().isGreaterThan(funded)) {
            throw new ValidationException("Contract " + contractId + " is already fully funded");
        }
        Money outstanding = contract.getTotalPrice().minus(funded);
        Instant now = clock.instant();

        if (reusable != null) {
            if (reusable.getAmount().equals(outstanding)) {
                return reusable;
            }
            markFailed(reusable, "Superseded by a repriced order", now);
        }

        Money fee = contract.getCommission().isGreaterThan(feesCharged)
            ? contract.getCommission().minus(feesCharged)
            : Money.zero(contract.getCurrency());
        if (fee.isGreaterThan(outstanding)) {
            fee = outstanding;
        }
        PaymentKind kind = captured ? PaymentKind.EXTENSION_TOP_UP : PaymentKind.INITIAL;
        Payment created = payments.insert(Payment.pending(UUID.randomUUID(), contract, outstanding, fee, kind, now));
        metrics.recordPaymentStatus(PaymentStatus.PENDING.name(), kind.name());
        audit(actor, "PAYMENT_CREATED", AuditSeverity.LOW, created,
                "Payment of " + outstanding + " created for contract " + contractId,
                List.of(FieldChange.of("status", null, PaymentStatus.PENDING)));
        return created;
    }

    private static boolean isPayable(ContractStatus status) {
        return status == ContractStatus.ACCEPTED
            || status == ContractStatus.IN_PROGRESS
            || status == ContractStatus.WAITING_APPROVAL;
    }

    // ==================== Capture ====================

    /**
     * Applies a successful capture reported by the gateway (webhook or client capture).
     *
     * Idempotent on the order id: a payment already past PENDING is returned unchanged.
     */
    public Payment confirmCapture(String gatewayOrderId, GatewayCapture capture) {
        UUID paymentId = idempotencyService.resolvePaymentId(gatewayOrderId)
            .orElseThrow(() -> new ResourceNotFoundException("Payment order", gatewayOrderId));
        Payment snapshot = payments.getById(paymentId);

        MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, paymentId.toString());
        MDC.put(CorrelationContext.CONTRACT_ID_MDC_KEY, snapshot.getContractId().toString());
        try {
            CaptureOutcome outcome;
            try {
                outcome = transactionTemplate.execute(status -> applyCapture(snapshot.getContractId(), paymentId, capture));
            } catch (ObjectOptimisticLockingFailureException e) {
                Payment current = payments.getById(paymentId);
                if (current.getStatus() != PaymentStatus.PENDING || current.isCaptured()) {
                    log.info("Capture of order {} already applied concurrently", gatewayOrderId);
                    return current;
                }
                throw new ConcurrentModificationException("Payment " + paymentId + " was modified concurrently", e);
            }
            if (outcome.isRefundRequired()) {
                return refundLateCapture(outcome.getPayment());
            }
            return outcome.getPayment();
        } finally {
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
            MDC.remove(CorrelationContext.CONTRACT_ID_MDC_KEY);
        }
    }

    private CaptureOutcome applyCapture(UUID contractId, UUID paymentId, GatewayCapture capture) {
        Contract contract = contracts.lock(contractId);
        Payment payment = payments.lock(paymentId);
        Instant now = clock.instant();

        if (payment.awaitsLateCaptureRefund()) {
            log.warn("Capture of {} payment {} is still unrefunded, retrying the gateway refund",
                    payment.getStatus(), paymentId);
            return new CaptureOutcome(payment, true);
        }
        if (payment.isCaptured()) {
            metrics.incrementDuplicateWebhooks();
            log.info("Payment {} already {}, capture ignored", paymentId, payment.getStatus());
            return new CaptureOutcome(payment, false);
        }

        if (payment.getStatus() != PaymentStatus.PENDING) {
            Payment recorded = payments.update(payment.recordLateCapture(capture, now));
            log.warn("Capture {} arrived for {} payment {}; returning the funds to the payer",
                    capture.getCaptureId(), payment.getStatus(), paymentId);
            audit(null, "CAPTURE_ON_" + payment.getStatus() + "_PAYMENT", AuditSeverity.HIGH, recorded,
                    "Gateway capture " + capture.getCaptureId() + " arrived after the payment was "
                            + payment.getStatus().name().toLowerCase(),
                    List.of(FieldChange.of("gatewayCaptureId", null, capture.getCaptureId())));
            return new CaptureOutcome(recorded, true);
        }

        if (payment.getRefundRequestedAt() != null) {
            Payment recorded = payments.update(payment.recordCaptureDuringRefund(capture, now));
            log.warn("Capture {} arrived while payment {} is being refunded; the refund returns it",
                    capture.getCaptureId(), paymentId);
            audit(null, "CAPTURE_DURING_REFUND", AuditSeverity.HIGH, recorded,
                    "Gateway capture " + capture.getCaptureId() + " arrived during a refund",
                    List.of(FieldChange.of("gatewayCaptureId", null, capture.getCaptureId())));
            return new CaptureOutcome(recorded, false);
        }

        return new CaptureOutcome(settleCapture(contract, payments.update(payment.capture(capture, now)), now), false);
    }

    /**
     * Side effects of a payment that just moved to HELD_ESCROW or COMPLETED.
     */
    private Payment settleCapture(Contract contract, Payment captured, Instant now) {
        metrics.recordPaymentStatus(captured.getStatus().name(), captured.getKind().name());

        if (captured.isEscrow()) {
            Contract held = contracts.update(
                contract.holdFunds(captured.getAmount(), captured.getKind() == PaymentKind.INITIAL, now));
            contractEvents.recordChange(contract, held, captured.getPayerId(), "ESCROW_HELD", AuditSeverity.MEDIUM,
                    captured.getAmount() + " held in escrow", now);
            publish(captured, EscrowHeldEvent.fromPayment(captured, now));
            audit(captured.getPayerId(), "ESCROW_HELD", AuditSeverity.MEDIUM, captured,
                    captured.getAmount() + " captured and held in escrow",
                    List.of(FieldChange.of("status", PaymentStatus.PENDING, PaymentStatus.HELD_ESCROW)));
            notifications.sendAfterCommit(Notification.of(contract.getWorkerId(), NotificationType.FUNDS_HELD,
                    contract.getId(), Map.of("amount", captured.getAmount().toString()), now));
        } else {
            publish(captured, PaymentCompletedEvent.fromPayment(captured, now));
            audit(captured.getPayerId(), "PAYMENT_COMPLETED", AuditSeverity.MEDIUM, captured,
                    captured.getAmount() + " captured without escrow",
                    List.of(FieldChange.of("status", PaymentStatus.PENDING, PaymentStatus.COMPLETED)));
        }
        log.info("Capture applied: paymentId={}, status={}, captureId={}",
                captured.getId(), captured.getStatus(), captured.getGatewayCaptureId());
        return captured;
    }

    /**
     * Returns a capture that reached a FAILED or REFUNDED payment. A gateway failure is
     * rethrown; the next delivery of the capture retries the refund.
     */
    private Payment refundLateCapture(Payment payment) {
        String refundId;
        try {
            refundId = gateway.refund(payment.getGatewayCaptureId(), null).getRefundId();
        } catch (RuntimeException e) {
            log.error("Refund of late capture {} for payment {} failed: {}",
                    payment.getGatewayCaptureId(), payment.getId(), e.getMessage());
            throw e;
        }
        Payment refunded = transactionTemplate.execute(status -> {
            Payment current = payments.lock(payment.getId());
            if (!current.awaitsLateCaptureRefund()) {
                return current;
            }
            Payment recorded = payments.update(current.recordLateCaptureRefund(refundId, clock.instant()));
            audit(null, "LATE_CAPTURE_REFUNDED", AuditSeverity.HIGH, recorded,
                    "Capture " + recorded.getGatewayCaptureId() + " returned to the payer",
                    List.of(FieldChange.of("refundId", null, refundId)));
            return recorded;
        });
        log.info("Late capture refunded: paymentId={}, captureId={}, refundId={}",
                payment.getId(), payment.getGatewayCaptureId(), refundId);
        return refunded;
    }

    /**
     * Client-driven capture after the payer approved the order.
     *
     * Skips the gateway when the payment was already captured. If the gateway rejects the
     * capture because a webhook confirmed it in the meantime, the confirmed record is returned.
     */
    public Payment captureContractPayment(String gatewayOrderId) {
        UUID paymentId = idempotencyService.resolvePaymentId(gatewayOrderId)
            .orElseThrow(() -> new ResourceNotFoundException("Payment order", gatewayOrderId));
        Payment payment = payments.getById(paymentId);
        if (payment.getStatus() != PaymentStatus.PENDING || payment.isCaptured()) {
            log.info("Order {} already captured or settled (status={}), gateway not called",
                    gatewayOrderId, payment.getStatus());
            return payment;
        }

        GatewayCapture capture;
        try {
            capture = gateway.captureOrder(gatewayOrderId);
        } catch (GatewayRejectedException e) {
            Payment current = payments.getById(paymentId);
            if (current.getStatus() != PaymentStatus.PENDING) {
                log.info("Capture of order {} rejected ({}) but payment is already {}",
                        gatewayOrderId, e.getProviderCode(), current.getStatus());
                return current;
            }
            throw e;
        }
        return confirmCapture(gatewayOrderId, capture);
    }

    // ==================== Release ====================

    /**
     * Releases one held payment at the requester's request.
     */
    public ReleaseResult releaseEscrow(UUID paymentId, UUID releasedBy) {
        Payment snapshot = payments.getById(paymentId);
        MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, paymentId.toString());
        try {
            return transactionTemplate.execute(status -> {
                Contract contract = contracts.lock(snapshot.getContractId());
                Payment payment = payments.lock(paymentId);
                if (payment.getStatus() == PaymentStatus.COMPLETED) {
                    return new ReleaseResult(payment, false);
                }
                if (contract.partyOf(releasedBy) != ContractParty.REQUESTER) {
                    throw new ActionNotAllowedException("Only the requester can release escrow of contract "
                            + contract.getId());
                }
                requireReleasable(contract);
                Payment released = release(payment, releasedBy, ReleaseTrigger.REQUESTER_APPROVAL, clock.instant());
                completeWhenSettled(contract, releasedBy, clock.instant());
                return new ReleaseResult(released, true);
            });
        } catch (ObjectOptimisticLockingFailureException e) {
            Payment current = payments.getById(paymentId);
            if (current.getStatus() == PaymentStatus.COMPLETED) {
                return new ReleaseResult(current, false);
            }
            throw new ConcurrentModificationException("Payment " + paymentId + " was modified concurrently", e);
        } finally {
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }

    /**
     * Releases every held payment of a contract and completes it.
     * Runs inside the caller's transaction, which must already hold the contract lock
     * or be prepared to take it.
     *
     * @param actor user who triggered the release, null for the scheduler
     * @return true if this call moved the contract to COMPLETED
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean releaseHeldPayments(UUID contractId, UUID actor, ReleaseTrigger trigger, Instant now) {
        Contract contract = contracts.lock(contractId);
        if (contract.getStatus() == ContractStatus.COMPLETED) {
            return false;
        }
        requireReleasable(contract);
        List<Payment> held = new ArrayList<>();
        for (Payment open : payments.findOpen(contractId)) {
            if (open.getStatus() == PaymentStatus.HELD_ESCROW) {
                held.add(payments.lock(open.getId()));
            }
        }
        for (Payment payment : held) {
            release(payment, actor, trigger, now);
        }
        return completeWhenSettled(contract, actor, now);
    }

    public boolean hasHeldPayments(UUID contractId) {
        return payments.hasHeldPayments(contractId);
    }

    private static void requireReleasable(Contract contract) {
        if (contract.getStatus() != ContractStatus.WAITING_APPROVAL && contract.getStatus() != ContractStatus.DISPUTED) {
            throw new InvalidTransitionException(String.format(
                "Escrow of contract %s cannot be released in %s status", contract.getId(), contract.getStatus()));
        }
    }

    private Payment release(Payment payment, UUID actor, ReleaseTrigger trigger, Instant now) {
        Payment released = payments.update(payment.release(actor, now));
        publish(released, EscrowReleasedEvent.fromPayment(released, trigger.name(), now));
        audit(actor, "ESCROW_RELEASED", AuditSeverity.MEDIUM, released,
                released.getAmount() + " released to worker (" + trigger + ")",
                List.of(FieldChange.of("status", PaymentStatus.HELD_ESCROW, PaymentStatus.COMPLETED)));
        metrics.recordPaymentStatus(PaymentStatus.COMPLETED.name(), released.getKind().name());
        metrics.recordEscrowReleased(trigger.name(), released.getAmount().getCurrency().name());
        log.info("Escrow released: paymentId={}, amount={}, trigger={}", released.getId(), released.getAmount(), trigger);
        return released;
    }

    /**
     * Completes the contract once none of its payments is held any more.
     */
    private boolean completeWhenSettled(Contract contract, UUID actor, Instant now) {
        if (payments.hasHeldPayments(contract.getId())) {
            return false;
        }
        failOpenOrders(contract.getId(), "Contract completed", now);
        Contract completed = contracts.update(contract.complete(now));
        contractEvents.recordChange(contract, completed, actor, "CONTRACT_COMPLETED", AuditSeverity.MEDIUM,
                "Contract completed, escrow released", now);
        metrics.recordContractTransition(contract.getStatus().name(), completed.getStatus().name());
        if (actor != null) {
            notifications.sendAfterCommit(Notification.of(completed.getWorkerId(), NotificationType.ESCROW_RELEASED,
                    completed.getId(), Map.of("amount", completed.getEscrowAmount().toString()), now));
        }
        return true;
    }

    /**
     * Fails every PENDING payment of a contract that is not being refunded.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int failOpenOrders(UUID contractId, String reason, Instant now) {
        int failed = 0;
        for (Payment open : payments.findOpen(contractId)) {
            if (open.getStatus() != PaymentStatus.PENDING) {
                continue;
            }
            Payment payment = payments.lock(open.getId());
            if (payment.getStatus() == PaymentStatus.PENDING && payment.getRefundRequestedAt() == null) {
                markFailed(payment, reason, now);
                failed++;
            }
        }
        return failed;
    }

    // ==================== Refund ====================

    /**
     * Refunds a PENDING or HELD_ESCROW payment.
     *
     * A refundRequestedAt claim is committed before the gateway is called and blocks any
     * concurrent release. A failed gateway refund drops the claim again.
     */
    public Payment refund(UUID paymentId, String reason, UUID actor) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("Refund reason is required");
        }
        Payment snapshot = payments.getById(paymentId);
        UUID contractId = snapshot.getContractId();

        MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, paymentId.toString());
        try {
            Payment claimed = transactionTemplate.execute(status -> {
                contracts.lock(contractId);
                Payment payment = payments.lock(paymentId);
                return payments.update(payment.claimRefund(clock.instant()));
            });

            String refundId = claimed.isCaptured() ? refundAtGateway(contractId, claimed) : null;
            Payment refunded = transactionTemplate.execute(status ->
                    applyRefund(contractId, paymentId, refundId, reason, actor, clock.instant()));
            if (refunded == null) {
                Payment captured = payments.getById(paymentId);
                String lateRefundId = refundAtGateway(contractId, captured);
                refunded = transactionTemplate.execute(status ->
                        applyRefund(contractId, paymentId, lateRefundId, reason, actor, clock.instant()));
            }
            log.info("Payment refunded: paymentId={}, amount={}, refundId={}",
                    paymentId, refunded.getAmount(), refunded.getRefundId());
            return refunded;
        } finally {
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }

    private String refundAtGateway(UUID contractId, Payment payment) {
        try {
            return gateway.refund(payment.getGatewayCaptureId(), null).getRefundId();
        } catch (RuntimeException e) {
            log.error("Gateway refund failed for payment {}: {}", payment.getId(), e.getMessage());
            transactionTemplate.executeWithoutResult(status -> dropRefundClaim(contractId, payment.getId()));
            throw e;
        }
    }

    /**
     * Drops the refund claim. A capture recorded while the claim was held is applied now.
     */
    private void dropRefundClaim(UUID contractId, UUID paymentId) {
        Contract contract = contracts.lock(contractId);
        Payment payment = payments.lock(paymentId);
        Instant now = clock.instant();
        Payment released = payments.update(payment.releaseRefundClaim(now));
        if (released.getStatus() == PaymentStatus.PENDING && released.isCaptured()) {
            log.info("Applying capture {} recorded during the failed refund of payment {}",
                    released.getGatewayCaptureId(), paymentId);
            settleCapture(contract, payments.update(released.applyRecordedCapture(now)), now);
        }
    }

    /**
     * @return the refunded payment, or null when the payment was captured after the claim
     *         and the capture still has to be refunded at the gateway
     */
    private Payment applyRefund(UUID contractId, UUID paymentId, String refundId, String reason,
                                UUID actor, Instant now) {
        Contract contract = contracts.lock(contractId);
        Payment payment = payments.lock(paymentId);
        if (payment.isCaptured() && refundId == null) {
            log.info("Payment {} was captured ({}) while its refund was in flight",
                    paymentId, payment.getGatewayCaptureId());
            return null;
        }
        boolean wasHeld = payment.getStatus() == PaymentStatus.HELD_ESCROW;
        boolean pendingTopUp = payment.getStatus() == PaymentStatus.PENDING
            && payment.getKind() == PaymentKind.EXTENSION_TOP_UP;

        Payment refunded = payments.update(payment.refund(refundId, reason, actor, now));
        publish(refunded, PaymentRefundedEvent.fromPayment(refunded, now));
        audit(actor, "PAYMENT_REFUNDED", AuditSeverity.HIGH, refunded,
                refunded.getAmount() + " refunded: " + reason,
                List.of(FieldChange.of("status", payment.getStatus(), PaymentStatus.REFUNDED)));
        metrics.recordPaymentStatus(PaymentStatus.REFUNDED.name(), refunded.getKind().name());

        Contract after = wasHeld ? contract.refundFunds(refunded.getAmount(), now) : contract;
        boolean cancel = !contract.getStatus().isTerminal() && !pendingTopUp
            && !payments.hasHeldPayments(contractId);
        if (cancel) {
            failOpenOrders(contractId, "Contract cancelled after refund", now);
            after = after.cancel(reason, now);
        }
        if (after != contract) {
            Contract saved = contracts.update(after);
            contractEvents.recordChange(contract, saved, actor, "CONTRACT_REFUNDED", AuditSeverity.HIGH,
                    "Escrow refunded to requester: " + reason, now);
            if (saved.getStatus() != contract.getStatus()) {
                metrics.recordContractTransition(contract.getStatus().name(), saved.getStatus().name());
            }
        }
        notifications.sendAfterCommit(Notification.of(refunded.getPayerId(), NotificationType.PAYMENT_REFUNDED,
                contractId, Map.of("amount", refunded.getAmount().toString()), now));
        return refunded;
    }

    // ==================== Expiry ====================

    /**
     * Fails PENDING payments whose order is older than the gateway's order lifetime.
     *
     * @return number of payments failed
     */
    public int failStaleOrders(Instant now, int limit) {
        Instant cutoff = now.minus(gatewayProperties.getOrderTtl());
        int failed = 0;
        for (UUID paymentId : payments.findStalePendingIds(cutoff, limit)) {
            Boolean done = transactionTemplate.execute(status -> {
                Payment snapshot = payments.getById(paymentId);
                contracts.lock(snapshot.getContractId());
                Payment payment = payments.lock(paymentId);
                if (payment.getStatus() != PaymentStatus.PENDING || payment.getRefundRequestedAt() != null) {
                    return false;
                }
                markFailed(payment, "Gateway order expired unapproved", now);
                return true;
            });
            if (Boolean.TRUE.equals(done)) {
                failed++;
            }
        }
        if (failed > 0) {
            log.info("Failed {} stale payment orders older than {}", failed, cutoff);
        }
        return failed;
    }

    public List<Payment> findByContract(UUID contractId) {
        return payments.findByContract(contractId);
    }

    public Payment getPayment(UUID paymentId) {
        return payments.getById(paymentId);
    }

    // ==================== Helpers ====================

    private void markFailed(Payment payment, String reason, Instant now) {
        Payment failed = payments.update(payment.fail(reason, now));
        publish(failed, PaymentFailedEvent.fromPayment(failed, now));
        audit(null, "PAYMENT_FAILED", AuditSeverity.LOW, failed, reason,
                List.of(FieldChange.of("status", PaymentStatus.PENDING, PaymentStatus.FAILED)));
        metrics.recordPaymentStatus(PaymentStatus.FAILED.name(), failed.getKind().name());
        log.info("Payment {} failed: {}", failed.getId(), reason);
    }

    private void publish(Payment payment, PaymentEvent event) {
        outboxService.saveEvent(AGGREGATE_TYPE, payment.getId(), event.getEventType(), event);
    }

    private void audit(UUID actor, String action, AuditSeverity severity, Payment payment,
                       String description, List<FieldChange> changes) {
        auditTrailService.record(AuditLogEntry.builder()
                .performedBy(actor)
                .action(action)
                .category(AuditCategory.PAYMENT)
                .severity(severity)
                .targetModel(AGGREGATE_TYPE)
                .targetId(payment.getId())
                .description(description)
                .changes(changes)
                .build());
    }

    @Value
    private static class CaptureOutcome {
        Payment payment;
        boolean refundRequired;
    }

    private static String describe(Contract contract, Payment payment) {
        String title = contract.getTitle() != null ? contract.getTitle() : "Contract " + contract.getId();
        return payment.getKind() == PaymentKind.EXTENSION_TOP_UP ? title + " (extension)" : title;
    }
}
