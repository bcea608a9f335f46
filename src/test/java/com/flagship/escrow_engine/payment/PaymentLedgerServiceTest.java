package com.flagship.escrow_engine.payment;

import com.flagship.escrow_engine.audit.AuditTrailService;
import com.flagship.escrow_engine.contract.Contract;
import com.flagship.escrow_engine.contract.ContractEventRecorder;
import com.flagship.escrow_engine.contract.ContractParty;
import com.flagship.escrow_engine.contract.ContractPersistenceService;
import com.flagship.escrow_engine.contract.ContractStatus;
import com.flagship.escrow_engine.audit.AuditLogEntry;
import com.flagship.escrow_engine.audit.AuditSeverity;
import com.flagship.escrow_engine.exception.ActionNotAllowedException;
import com.flagship.escrow_engine.exception.GatewayUnavailableException;
import com.flagship.escrow_engine.exception.InvalidTransitionException;
import com.flagship.escrow_engine.exception.ResourceNotFoundException;
import com.flagship.escrow_engine.exception.ValidationException;
import com.flagship.escrow_engine.gateway.GatewayCapture;
import com.flagship.escrow_engine.gateway.GatewayOrder;
import com.flagship.escrow_engine.gateway.GatewayProperties;
import com.flagship.escrow_engine.gateway.GatewayRefund;
import com.flagship.escrow_engine.gateway.PaymentGateway;
import com.flagship.escrow_engine.money.CommissionRate;
import com.flagship.escrow_engine.money.CurrencyCode;
import com.flagship.escrow_engine.money.EscrowState;
import com.flagship.escrow_engine.money.Money;
import com.flagship.escrow_engine.notification.Notification;
import com.flagship.escrow_engine.notification.NotificationDispatcher;
import com.flagship.escrow_engine.notification.NotificationService;
import com.flagship.escrow_engine.notification.NotificationType;
import com.flagship.escrow_engine.observability.EscrowMetrics;
import com.flagship.escrow_engine.outbox.OutboxService;
import com.flagship.escrow_engine.payment.event.EscrowHeldEvent;
import com.flagship.escrow_engine.payment.event.EscrowReleasedEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Payment ledger flows against in-memory contract and payment stores.
 * The transaction template runs callbacks one at a time, like row locks would.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PaymentLedgerServiceTest {

    private static final Instant NOW = Instant.parse("2026-06-01T08:00:00Z");
    private static final String ORDER_ID = "ORDER-1";

    @Mock
    private PaymentPersistenceService payments;
    @Mock
    private ContractPersistenceService contracts;
    @Mock
    private ContractEventRecorder contractEvents;
    @Mock
    private OutboxService outboxService;
    @Mock
    private AuditTrailService auditTrailService;
    @Mock
    private PaymentGateway gateway;
    @Mock
    private IdempotencyService idempotencyService;
    @Mock
    private NotificationService notificationService;
    @Mock
    private TransactionTemplate transactionTemplate;

    private final Map<UUID, Contract> contractStore = new ConcurrentHashMap<>();
    private final Map<UUID, Payment> paymentStore = new ConcurrentHashMap<>();
    private final Object txLock = new Object();
    private final AtomicReference<Runnable> afterNextTransaction = new AtomicReference<>();

    private SimpleMeterRegistry registry;
    private PaymentLedgerService service;
    private UUID requester;
    private UUID worker;
    private Contract contract;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        service = new PaymentLedgerService(payments, contracts, contractEvents, outboxService, auditTrailService,
                gateway, idempotencyService, new NotificationDispatcher(notificationService), transactionTemplate,
                new GatewayProperties(), new EscrowMetrics(registry), Clock.fixed(NOW, ZoneOffset.UTC));

        when(transactionTemplate.execute(any())).thenAnswer(inv -> {
            TransactionCallback<?> callback = inv.getArgument(0);
            Object result;
            synchronized (txLock) {
                result = callback.doInTransaction(null);
            }
            Runnable hook = afterNextTransaction.getAndSet(null);
            if (hook != null) {
                hook.run();
            }
            return result;
        });
        doAnswer(inv -> {
            Consumer<TransactionStatus> action = inv.getArgument(0);
            synchronized (txLock) {
                action.accept(null);
            }
            return null;
        }).when(transactionTemplate).executeWithoutResult(any());

        when(contracts.getById(any())).thenAnswer(inv -> contractStore.get((UUID) inv.getArgument(0)));
        when(contracts.lock(any())).thenAnswer(inv -> contractStore.get((UUID) inv.getArgument(0)));
        when(contracts.update(any())).thenAnswer(inv -> {
            Contract c = inv.getArgument(0);
            contractStore.put(c.getId(), c);
            return c;
        });

        when(payments.getById(any())).thenAnswer(inv -> paymentStore.get((UUID) inv.getArgument(0)));
        when(payments.lock(any())).thenAnswer(inv -> paymentStore.get((UUID) inv.getArgument(0)));
        when(payments.insert(any())).thenAnswer(inv -> save(inv.getArgument(0)));
        when(payments.update(any())).thenAnswer(inv -> save(inv.getArgument(0)));
        when(payments.findByContract(any())).thenAnswer(inv -> byContract(inv.getArgument(0)));
        when(payments.findOpen(any())).thenAnswer(inv -> byContract(inv.getArgument(0)).stream()
                .filter(p -> !p.isTerminal()).collect(Collectors.toList()));
        when(payments.hasHeldPayments(any())).thenAnswer(inv -> byContract(inv.getArgument(0)).stream()
                .anyMatch(p -> p.getStatus() == PaymentStatus.HELD_ESCROW));

        when(gateway.createOrder(any(), anyString(), anyString()))
                .thenReturn(new GatewayOrder(ORDER_ID, "https://pay.example.com/" + ORDER_ID));

        requester = UUID.randomUUID();
        worker = UUID.randomUUID();
        contract = Contract.draft(UUID.randomUUID(), null, requester, worker, "Kitchen renovation",
                        Money.of(10000, CurrencyCode.USD), Money.of(500, CurrencyCode.USD), CommissionRate.of("5.00"),
                        NOW, NOW.plus(Duration.ofDays(14)), true, null, null, NOW)
                .submit("123456", Duration.ofMinutes(30), NOW)
                .confirmPairing(ContractParty.REQUESTER, NOW)
                .confirmPairing(ContractParty.WORKER, NOW);
        contractStore.put(contract.getId(), contract);
    }

    private Payment save(Payment payment) {
        paymentStore.put(payment.getId(), payment);
        return payment;
    }

    private List<Payment> byContract(UUID contractId) {
        return paymentStore.values().stream()
                .filter(p -> p.getContractId().equals(contractId))
                .collect(Collectors.toList());
    }

    private Payment openOrder() {
        Payment payment = service.createContractPaymentOrder(contract.getId(), requester);
        when(idempotencyService.resolvePaymentId(ORDER_ID)).thenReturn(Optional.of(payment.getId()));
        return payment;
    }

    private Payment heldPayment() {
        openOrder();
        return service.confirmCapture(ORDER_ID, new GatewayCapture("CAP-1", "PAYER-1", "payer@example.com"));
    }

    private void workComplete() {
        Contract current = contractStore.get(contract.getId());
        contractStore.put(current.getId(), current.markWorkComplete(NOW));
    }

    private List<AuditLogEntry> auditEntries(String action) {
        ArgumentCaptor<AuditLogEntry> captor = ArgumentCaptor.forClass(AuditLogEntry.class);
        verify(auditTrailService, atLeast(0)).record(captor.capture());
        return captor.getAllValues().stream()
                .filter(e -> action.equals(e.getAction()))
                .collect(Collectors.toList());
    }

    private List<Notification> sentNotifications() {
        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(notificationService, atLeast(0)).send(captor.capture());
        return captor.getAllValues();
    }

    @Nested
    @DisplayName("Orders")
    class Orders {

        @Test
        @DisplayName("Order covers the contract total and carries the platform fee")
        void testCreateOrder_ChargesTotalPrice() {
            Payment payment = openOrder();

            assertEquals(PaymentStatus.PENDING, payment.getStatus());
            assertEquals(10500, payment.getAmount().getMinorUnits());
            assertEquals(500, payment.getPlatformFee().getMinorUnits());
            assertEquals(PaymentKind.INITIAL, payment.getKind());
            assertEquals(ORDER_ID, payment.getGatewayOrderId());
            verify(idempotencyService).remember(ORDER_ID, payment.getId());
        }

        @Test
        @DisplayName("Asking again returns the open order without calling the gateway")
        void testCreateOrder_ReusesOpenOrder() {
            Payment first = openOrder();
            Payment second = service.createContractPaymentOrder(contract.getId(), requester);

            assertEquals(first.getId(), second.getId());
            verify(gateway, times(1)).createOrder(any(), anyString(), anyString());
        }

        @Test
        @DisplayName("Only the requester pays, and only an accepted contract")
        void testCreateOrder_Guards() {
            assertThrows(ActionNotAllowedException.class,
                    () -> service.createContractPaymentOrder(contract.getId(), worker));

            Contract draft = Contract.draft(UUID.randomUUID(), null, requester, worker, "Draft",
                    Money.of(100, CurrencyCode.USD), Money.zero(CurrencyCode.USD), CommissionRate.ZERO,
                    null, null, true, null, null, NOW);
            contractStore.put(draft.getId(), draft);
            assertThrows(InvalidTransitionException.class,
                    () -> service.createContractPaymentOrder(draft.getId(), requester));
            assertTrue(paymentStore.isEmpty());
        }
    }

    @Nested
    @DisplayName("Capture")
    class Capture {

        @Test
        @DisplayName("Capture holds the funds and starts the work")
        void testConfirmCapture_HoldsEscrow() {
            Payment held = heldPayment();

            assertEquals(PaymentStatus.HELD_ESCROW, held.getStatus());
            Contract current = contractStore.get(contract.getId());
            assertEquals(ContractStatus.IN_PROGRESS, current.getStatus());
            assertEquals(EscrowState.HELD, current.getEscrowStatus());
            assertEquals(10500, current.getEscrowAmount().getMinorUnits());
        }

        @Test
        @DisplayName("A repeated webhook is a no-op: one transition, one event, one notification")
        void testConfirmCapture_DuplicateIsNoOp() {
            heldPayment();
            Payment again = service.confirmCapture(ORDER_ID, new GatewayCapture("CAP-1", "PAYER-1", null));

            assertEquals(PaymentStatus.HELD_ESCROW, again.getStatus());
            assertEquals(10500, contractStore.get(contract.getId()).getEscrowAmount().getMinorUnits());
            verify(outboxService, times(1)).saveEvent(eq(PaymentLedgerService.AGGREGATE_TYPE), eq(again.getId()),
                    eq(EscrowHeldEvent.EVENT_TYPE), any());
            assertEquals(1, sentNotifications().size());
            assertEquals(1.0, registry.get("gateway.webhooks.duplicate").counter().count());
        }

        @Test
        @DisplayName("Unknown order ids are reported as not found")
        void testConfirmCapture_UnknownOrder() {
            when(idempotencyService.resolvePaymentId("NOPE")).thenReturn(Optional.empty());

            assertThrows(ResourceNotFoundException.class,
                    () -> service.confirmCapture("NOPE", new GatewayCapture("C", null, null)));
        }

        @Test
        @DisplayName("Client capture skips the gateway once the webhook already applied it")
        void testCaptureContractPayment_AlreadyCaptured() {
            Payment held = heldPayment();

            Payment result = service.captureContractPayment(ORDER_ID);

            assertEquals(held.getId(), result.getId());
            verify(gateway, never()).captureOrder(anyString());
        }
    }

    @Nested
    @DisplayName("Release")
    class Release {

        @Test
        @DisplayName("Release completes the contract; a second release changes nothing and notifies nobody")
        void testReleaseEscrow_Idempotent() {
            Payment held = heldPayment();
            workComplete();

            ReleaseResult first = service.releaseEscrow(held.getId(), requester);
            ReleaseResult second = service.releaseEscrow(held.getId(), requester);

            assertTrue(first.isTransitioned());
            assertFalse(second.isTransitioned());
            assertEquals(PaymentStatus.COMPLETED, second.getPayment().getStatus());
            Contract completed = contractStore.get(contract.getId());
            assertEquals(ContractStatus.COMPLETED, completed.getStatus());
            assertEquals(EscrowState.RELEASED, completed.getEscrowStatus());

            long released = sentNotifications().stream()
                    .filter(n -> n.getType() == NotificationType.ESCROW_RELEASED).count();
            assertEquals(1, released);
            verify(outboxService, times(1)).saveEvent(any(), eq(held.getId()), eq(EscrowReleasedEvent.EVENT_TYPE), any());
        }

        @Test
        @DisplayName("Two concurrent releases move the money once")
        void testReleaseEscrow_Concurrent() throws Exception {
            Payment held = heldPayment();
            workComplete();

            ExecutorService executor = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            try {
                Future<ReleaseResult> a = executor.submit(() -> {
                    start.await();
                    return service.releaseEscrow(held.getId(), requester);
                });
                Future<ReleaseResult> b = executor.submit(() -> {
                    start.await();
                    return service.releaseEscrow(held.getId(), requester);
                });
                start.countDown();

                int transitions = (a.get().isTransitioned() ? 1 : 0) + (b.get().isTransitioned() ? 1 : 0);
                assertEquals(1, transitions);
            } finally {
                executor.shutdownNow();
            }
            assertEquals(PaymentStatus.COMPLETED, paymentStore.get(held.getId()).getStatus());
            verify(contractEvents, times(1)).recordChange(any(), any(), any(), eq("CONTRACT_COMPLETED"), any(), any(), any());
        }

        @Test
        @DisplayName("Release before the work is submitted is rejected")
        void testReleaseEscrow_NotWaitingApproval() {
            Payment held = heldPayment();

            assertThrows(InvalidTransitionException.class, () -> service.releaseEscrow(held.getId(), requester));
            assertEquals(PaymentStatus.HELD_ESCROW, paymentStore.get(held.getId()).getStatus());
        }

        @Test
        @DisplayName("The worker cannot release escrow")
        void testReleaseEscrow_WorkerRejected() {
            Payment held = heldPayment();
            workComplete();

            assertThrows(ActionNotAllowedException.class, () -> service.releaseEscrow(held.getId(), worker));
        }

        @Test
        @DisplayName("Scheduler release completes the contract without a user notification")
        void testReleaseHeldPayments_AutoRelease() {
            Payment held = heldPayment();
            workComplete();

            assertTrue(service.releaseHeldPayments(contract.getId(), null, ReleaseTrigger.AUTO_RELEASE, NOW));
            assertFalse(service.releaseHeldPayments(contract.getId(), null, ReleaseTrigger.AUTO_RELEASE, NOW));

            Payment released = paymentStore.get(held.getId());
            assertTrue(released.isAutoReleased());
            assertNull(released.getEscrowReleasedBy());
            assertTrue(sentNotifications().stream().noneMatch(n -> n.getType() == NotificationType.ESCROW_RELEASED));
        }
    }

    @Nested
    @DisplayName("Refund")
    class Refund {

        @Test
        @DisplayName("Refunding the only held payment empties the escrow and cancels the contract")
        void testRefund_HeldPaymentCancelsContract() {
            Payment held = heldPayment();
            when(gateway.refund("CAP-1", null)).thenReturn(new GatewayRefund("REF-1"));

            Payment refunded = service.refund(held.getId(), "Worker never showed up", null);

            assertEquals(PaymentStatus.REFUNDED, refunded.getStatus());
            assertEquals("REF-1", refunded.getRefundId());
            Contract cancelled = contractStore.get(contract.getId());
            assertEquals(ContractStatus.CANCELLED, cancelled.getStatus());
            assertEquals(EscrowState.REFUNDED, cancelled.getEscrowStatus());
            assertTrue(cancelled.getEscrowAmount().isZero());
        }

        @Test
        @DisplayName("Refund needs a reason and a refundable payment")
        void testRefund_Guards() {
            Payment held = heldPayment();
            workComplete();
            service.releaseEscrow(held.getId(), requester);

            assertThrows(ValidationException.class,
                    () -> service.refund(held.getId(), " ", null));
            assertThrows(InvalidTransitionException.class, () -> service.refund(held.getId(), "late", null));
            verify(gateway, never()).refund(anyString(), any());
        }

        @Test
        @DisplayName("A capture that lands after a pending order was refunded is returned to the payer once")
        void testRefund_PendingOrderThenLateCapture() {
            Payment pending = openOrder();
            Payment refunded = service.refund(pending.getId(), "Requester changed their mind", requester);
            assertEquals(PaymentStatus.REFUNDED, refunded.getStatus());
            assertNull(refunded.getRefundId());
            verify(gateway, never()).refund(anyString(), any());

            when(gateway.refund("CAP-9", null)).thenReturn(new GatewayRefund("REF-9"));
            GatewayCapture capture = new GatewayCapture("CAP-9", "PAYER-1", "payer@example.com");
            Payment afterCapture = service.confirmCapture(ORDER_ID, capture);
            Payment redelivered = service.confirmCapture(ORDER_ID, capture);

            assertEquals(PaymentStatus.REFUNDED, afterCapture.getStatus());
            assertEquals("CAP-9", afterCapture.getGatewayCaptureId());
            assertEquals("REF-9", afterCapture.getRefundId());
            assertEquals("REF-9", redelivered.getRefundId());
            verify(gateway, times(1)).refund("CAP-9", null);

            List<AuditLogEntry> flagged = auditEntries("CAPTURE_ON_REFUNDED_PAYMENT");
            assertEquals(1, flagged.size());
            assertEquals(AuditSeverity.HIGH, flagged.get(0).getSeverity());
            assertEquals(1, auditEntries("LATE_CAPTURE_REFUNDED").size());

            Contract cancelled = contractStore.get(contract.getId());
            assertEquals(ContractStatus.CANCELLED, cancelled.getStatus());
            assertTrue(cancelled.getEscrowAmount().isZero());
            verify(outboxService, never()).saveEvent(any(), any(), eq(EscrowHeldEvent.EVENT_TYPE), any());
        }

        @Test
        @DisplayName("A capture that lands while a pending order is being refunded is refunded at the gateway")
        void testRefund_CaptureDuringRefund() {
            Payment pending = openOrder();
            when(gateway.refund("CAP-7", null)).thenReturn(new GatewayRefund("REF-7"));
            AtomicReference<Payment> duringRefund = new AtomicReference<>();
            afterNextTransaction.set(() -> duringRefund.set(
                    service.confirmCapture(ORDER_ID, new GatewayCapture("CAP-7", "PAYER-1", null))));

            Payment refunded = service.refund(pending.getId(), "Requester changed their mind", requester);

            assertEquals(PaymentStatus.PENDING, duringRefund.get().getStatus());
            assertEquals("CAP-7", duringRefund.get().getGatewayCaptureId());
            assertEquals(PaymentStatus.REFUNDED, refunded.getStatus());
            assertEquals("CAP-7", refunded.getGatewayCaptureId());
            assertEquals("REF-7", refunded.getRefundId());
            verify(gateway, times(1)).refund("CAP-7", null);

            Contract cancelled = contractStore.get(contract.getId());
            assertEquals(ContractStatus.CANCELLED, cancelled.getStatus());
            assertEquals(EscrowState.PENDING, cancelled.getEscrowStatus());
            verify(outboxService, never()).saveEvent(any(), any(), eq(EscrowHeldEvent.EVENT_TYPE), any());
        }

        @Test
        @DisplayName("When the refund of a capture that landed mid-refund fails, the funds are held as usual")
        void testRefund_GatewayFailureKeepsRecordedCapture() {
            Payment pending = openOrder();
            when(gateway.refund("CAP-7", null)).thenThrow(new GatewayUnavailableException("gateway down"));
            afterNextTransaction.set(() ->
                    service.confirmCapture(ORDER_ID, new GatewayCapture("CAP-7", "PAYER-1", null)));

            assertThrows(GatewayUnavailableException.class,
                    () -> service.refund(pending.getId(), "Requester changed their mind", requester));

            Payment held = paymentStore.get(pending.getId());
            assertEquals(PaymentStatus.HELD_ESCROW, held.getStatus());
            assertNull(held.getRefundRequestedAt());
            Contract current = contractStore.get(contract.getId());
            assertEquals(ContractStatus.IN_PROGRESS, current.getStatus());
            assertEquals(EscrowState.HELD, current.getEscrowStatus());
            assertEquals(10500, current.getEscrowAmount().getMinorUnits());
        }
    }

    @Test
    @DisplayName("Orders past the gateway lifetime are failed")
    void testFailStaleOrders() {
        Payment pending = openOrder();
        when(payments.findStalePendingIds(NOW.minus(Duration.ofHours(3)), 50)).thenReturn(List.of(pending.getId()));

        assertEquals(1, service.failStaleOrders(NOW, 50));
        assertEquals(PaymentStatus.FAILED, paymentStore.get(pending.getId()).getStatus());
        assertEquals(0, service.failStaleOrders(NOW, 50));
    }
}
