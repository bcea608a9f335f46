package com.flagship.escrow_engine.contract;

import com.flagship.escrow_engine.commission.CommissionCalculator;
import com.flagship.escrow_engine.commission.CommissionProperties;
import com.flagship.escrow_engine.commission.MembershipTier;
import com.flagship.escrow_engine.config.EscrowProperties;
import com.flagship.escrow_engine.exception.ActionNotAllowedException;
import com.flagship.escrow_engine.exception.ConcurrentModificationException;
import com.flagship.escrow_engine.exception.ErrorCode;
import com.flagship.escrow_engine.exception.InvalidTransitionException;
import com.flagship.escrow_engine.exception.NotAPartyException;
import com.flagship.escrow_engine.exception.ValidationException;
import com.flagship.escrow_engine.member.MembershipDirectory;
import com.flagship.escrow_engine.member.MembershipProfile;
import com.flagship.escrow_engine.money.CommissionRate;
import com.flagship.escrow_engine.money.CurrencyCode;
import com.flagship.escrow_engine.money.Money;
import com.flagship.escrow_engine.notification.Notification;
import com.flagship.escrow_engine.notification.NotificationDispatcher;
import com.flagship.escrow_engine.notification.NotificationService;
import com.flagship.escrow_engine.notification.NotificationType;
import com.flagship.escrow_engine.observability.EscrowMetrics;
import com.flagship.escrow_engine.payment.PaymentLedgerService;
import com.flagship.escrow_engine.payment.ReleaseTrigger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ContractServiceTest {

    private static final Instant NOW = Instant.parse("2026-07-15T10:00:00Z");

    @Mock
    private ContractPersistenceService contracts;
    @Mock
    private ContractEventRecorder contractEvents;
    @Mock
    private MembershipDirectory membershipDirectory;
    @Mock
    private PairingCodeGenerator pairingCodeGenerator;
    @Mock
    private PaymentLedgerService paymentLedger;
    @Mock
    private NotificationService notificationService;
    @Mock
    private TransactionTemplate transactionTemplate;

    private final Map<UUID, Contract> store = new HashMap<>();
    private ContractService service;
    private UUID requester;
    private UUID worker;

    @BeforeEach
    void setUp() {
        service = new ContractService(contracts, contractEvents, new CommissionCalculator(new CommissionProperties()),
                membershipDirectory, pairingCodeGenerator, paymentLedger, new NotificationDispatcher(notificationService),
                transactionTemplate, new EscrowProperties(), new EscrowMetrics(new SimpleMeterRegistry()),
                Clock.fixed(NOW, ZoneOffset.UTC));

        requester = UUID.randomUUID();
        worker = UUID.randomUUID();
        when(membershipDirectory.lockForUpdate(requester)).thenReturn(profile(requester, 0));
        when(membershipDirectory.getProfile(worker)).thenReturn(profile(worker, 0));
        when(membershipDirectory.isIdentityVerified(any())).thenReturn(true);
        when(pairingCodeGenerator.next()).thenReturn("482913");

        when(contracts.insert(any())).thenAnswer(inv -> put(inv.getArgument(0)));
        when(contracts.update(any())).thenAnswer(inv -> put(inv.getArgument(0)));
        when(contracts.lock(any())).thenAnswer(inv -> store.get((UUID) inv.getArgument(0)));
        when(contracts.getById(any())).thenAnswer(inv -> store.get((UUID) inv.getArgument(0)));
    }

    private Contract put(Contract contract) {
        store.put(contract.getId(), contract);
        return contract;
    }

    private MembershipProfile profile(UUID userId, int freeCredits) {
        return new MembershipProfile(userId, "Member", userId + "@example.com", MembershipTier.FREE, freeCredits,
                CommissionRate.of("5.00"), true, "CODE" + userId.toString().substring(0, 4), false);
    }

    private Contract create(boolean escrow) {
        return service.createContract(CreateContractCommand.builder()
                .requesterId(requester)
                .workerId(worker)
                .title("Fence repair")
                .basePrice(Money.of(10000, CurrencyCode.USD))
                .startDate(NOW)
                .endDate(NOW.plus(Duration.ofDays(7)))
                .escrowEnabled(escrow)
                .build());
    }

    private Contract pending(boolean escrow) {
        return service.submit(create(escrow).getId(), requester);
    }

    private List<Notification> sent() {
        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(notificationService, atLeast(0)).send(captor.capture());
        return captor.getAllValues();
    }

    @Test
    @DisplayName("New contract is a priced draft at the payer's rate")
    void testCreateContract_PricedDraft() {
        Contract contract = create(true);

        assertEquals(ContractStatus.DRAFT, contract.getStatus());
        assertEquals(500, contract.getCommission().getMinorUnits());
        assertEquals(10500, contract.getTotalPrice().getMinorUnits());
        verify(contractEvents).recordCreated(contract, requester);
        verify(membershipDirectory, never()).consumeFreeContractCredit(any());
    }

    @Test
    @DisplayName("A free credit zeroes the commission and is consumed")
    void testCreateContract_ConsumesFreeCredit() {
        when(membershipDirectory.lockForUpdate(requester)).thenReturn(profile(requester, 1));
        when(membershipDirectory.consumeFreeContractCredit(requester)).thenReturn(true);

        Contract contract = create(true);

        assertTrue(contract.getCommission().isZero());
        assertEquals(10000, contract.getTotalPrice().getMinorUnits());
        verify(membershipDirectory).consumeFreeContractCredit(requester);
    }

    @Test
    @DisplayName("A credit used up by a concurrent request is reported, nothing is inserted")
    void testCreateContract_CreditRace() {
        when(membershipDirectory.lockForUpdate(requester)).thenReturn(profile(requester, 1));
        when(membershipDirectory.consumeFreeContractCredit(requester)).thenReturn(false);

        assertThrows(ConcurrentModificationException.class, () -> create(true));
        verify(contracts, never()).insert(any());
    }

    @Test
    @DisplayName("Submit issues a pairing code to both parties")
    void testSubmit_NotifiesBothParties() {
        Contract contract = pending(true);

        assertEquals(ContractStatus.PENDING, contract.getStatus());
        assertEquals("482913", contract.getPairingCode());
        assertEquals(NOW.plus(Duration.ofMinutes(30)), contract.getPairingExpiry());
        List<Notification> notifications = sent();
        assertEquals(2, notifications.size());
        notifications.forEach(n -> assertEquals(NotificationType.PAIRING_CODE_ISSUED, n.getType()));
    }

    @Test
    @DisplayName("Submit requires verified identities and the requester")
    void testSubmit_Guards() {
        Contract draft = create(true);
        assertThrows(ActionNotAllowedException.class, () -> service.submit(draft.getId(), worker));

        when(membershipDirectory.isIdentityVerified(worker)).thenReturn(false);
        assertThrows(InvalidTransitionException.class, () -> service.submit(draft.getId(), requester));
        assertEquals(ContractStatus.DRAFT, store.get(draft.getId()).getStatus());
    }

    @Test
    @DisplayName("Wrong or expired pairing codes are rejected with distinct error codes")
    void testConfirmPairing_CodeChecks() {
        Contract contract = pending(true);

        ValidationException mismatch = assertThrows(ValidationException.class,
                () -> service.confirmPairing(contract.getId(), worker, "000000"));
        assertEquals(ErrorCode.PAIRING_CODE_MISMATCH, mismatch.getErrorCode());

        put(contract.toBuilder().pairingExpiry(NOW.minusSeconds(1)).build());
        ValidationException expired = assertThrows(ValidationException.class,
                () -> service.confirmPairing(contract.getId(), worker, "482913"));
        assertEquals(ErrorCode.PAIRING_EXPIRED, expired.getErrorCode());

        assertThrows(NotAPartyException.class,
                () -> service.confirmPairing(contract.getId(), UUID.randomUUID(), "482913"));
    }

    @Test
    @DisplayName("Both confirmations accept the contract")
    void testConfirmPairing_Accepts() {
        Contract contract = pending(true);

        service.confirmPairing(contract.getId(), worker, " 482913 ");
        Contract accepted = service.confirmPairing(contract.getId(), requester, "482913");

        assertEquals(ContractStatus.ACCEPTED, accepted.getStatus());
        assertEquals(2, sent().stream().filter(n -> n.getType() == NotificationType.CONTRACT_ACCEPTED).count());
    }

    @Test
    @DisplayName("Approval of an escrow contract releases through the payment ledger")
    void testApproveCompletion_Escrow() {
        Contract contract = pending(true);
        put(store.get(contract.getId())
                .confirmPairing(ContractParty.REQUESTER, NOW)
                .confirmPairing(ContractParty.WORKER, NOW)
                .holdFunds(Money.of(10500, CurrencyCode.USD), true, NOW));
        service.markWorkComplete(contract.getId(), worker);

        service.approveCompletion(contract.getId(), requester);

        verify(paymentLedger).releaseHeldPayments(contract.getId(), requester, ReleaseTrigger.REQUESTER_APPROVAL, NOW);
    }

    @Test
    @DisplayName("Only the worker marks work complete and only the requester approves")
    void testRoles() {
        Contract contract = pending(false);
        service.signOff(contract.getId(), requester);
        service.signOff(contract.getId(), worker);
        put(store.get(contract.getId()).start(NOW));

        assertThrows(ActionNotAllowedException.class, () -> service.markWorkComplete(contract.getId(), requester));
        service.markWorkComplete(contract.getId(), worker);
        assertThrows(ActionNotAllowedException.class, () -> service.approveCompletion(contract.getId(), worker));

        Contract completed = service.approveCompletion(contract.getId(), requester);
        assertEquals(ContractStatus.COMPLETED, completed.getStatus());
        verify(paymentLedger, never()).releaseHeldPayments(any(), any(), any(), any());
    }

    @Test
    @DisplayName("Funded contracts cannot be cancelled directly")
    void testCancel_Guards() {
        Contract contract = pending(true);
        when(paymentLedger.hasHeldPayments(contract.getId())).thenReturn(true);
        assertThrows(InvalidTransitionException.class, () -> service.cancel(contract.getId(), requester, "no"));

        when(paymentLedger.hasHeldPayments(contract.getId())).thenReturn(false);
        Contract cancelled = service.cancel(contract.getId(), worker, "Busy");
        assertEquals(ContractStatus.CANCELLED, cancelled.getStatus());
        verify(paymentLedger).failOpenOrders(eq(contract.getId()), anyString(), eq(NOW));
    }

    @Test
    @DisplayName("Accepted price change voids open orders for the old amount")
    void testRespondToExtension_PriceChange() {
        Contract contract = pending(true);
        put(store.get(contract.getId())
                .confirmPairing(ContractParty.REQUESTER, NOW)
                .confirmPairing(ContractParty.WORKER, NOW));

        service.requestExtension(contract.getId(), worker, 3, Money.of(12000, CurrencyCode.USD));
        Contract extended = service.respondToExtension(contract.getId(), requester, true);

        assertEquals(12600, extended.getTotalPrice().getMinorUnits());
        assertEquals(1, extended.getExtensionCount());
        verify(paymentLedger).failOpenOrders(eq(contract.getId()), anyString(), eq(NOW));
        verify(contractEvents, atLeast(2)).publish(eq(contract.getId()), any());
    }

    @Test
    @DisplayName("An extension reprices with the configured minimum commission")
    void testRespondToExtension_MinimumCommission() {
        CommissionProperties commission = new CommissionProperties();
        commission.setMinimumMinorUnits(1000);
        service = new ContractService(contracts, contractEvents, new CommissionCalculator(commission),
                membershipDirectory, pairingCodeGenerator, paymentLedger, new NotificationDispatcher(notificationService),
                transactionTemplate, new EscrowProperties(), new EscrowMetrics(new SimpleMeterRegistry()),
                Clock.fixed(NOW, ZoneOffset.UTC));
        Contract contract = pending(true);
        assertEquals(1000, contract.getCommission().getMinorUnits());
        put(store.get(contract.getId())
                .confirmPairing(ContractParty.REQUESTER, NOW)
                .confirmPairing(ContractParty.WORKER, NOW));

        service.requestExtension(contract.getId(), worker, 3, Money.of(12000, CurrencyCode.USD));
        Contract extended = service.respondToExtension(contract.getId(), requester, true);

        assertEquals(1000, extended.getCommission().getMinorUnits());
        assertEquals(13000, extended.getTotalPrice().getMinorUnits());
    }

    @Test
    @DisplayName("Dispute needs a reason and notifies the other party")
    void testOpenDispute() {
        Contract contract = pending(true);
        put(store.get(contract.getId())
                .confirmPairing(ContractParty.REQUESTER, NOW)
                .confirmPairing(ContractParty.WORKER, NOW)
                .holdFunds(Money.of(10500, CurrencyCode.USD), true, NOW)
                .markWorkComplete(NOW));

        assertThrows(ValidationException.class, () -> service.openDispute(contract.getId(), requester, " "));
        Contract disputed = service.openDispute(contract.getId(), requester, "Unfinished");

        assertEquals(ContractStatus.DISPUTED, disputed.getStatus());
        assertTrue(sent().stream().anyMatch(n -> n.getType() == NotificationType.DISPUTE_OPENED
                && n.getRecipientId().equals(worker)));
    }
}
