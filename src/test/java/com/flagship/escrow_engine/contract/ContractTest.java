package com.flagship.escrow_engine.contract;

import com.flagship.escrow_engine.exception.InvalidTransitionException;
import com.flagship.escrow_engine.exception.NotAPartyException;
import com.flagship.escrow_engine.exception.ValidationException;
import com.flagship.escrow_engine.money.CommissionRate;
import com.flagship.escrow_engine.money.CurrencyCode;
import com.flagship.escrow_engine.money.EscrowState;
import com.flagship.escrow_engine.money.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ContractTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Duration TTL = Duration.ofMinutes(30);

    private final UUID requester = UUID.randomUUID();
    private final UUID worker = UUID.randomUUID();

    private Contract draft(boolean escrow) {
        return Contract.draft(UUID.randomUUID(), null, requester, worker, "Garden work",
                Money.of(10000, CurrencyCode.USD), Money.of(500, CurrencyCode.USD), CommissionRate.of("5.00"),
                NOW, NOW.plus(Duration.ofDays(10)), escrow, null, null, NOW);
    }

    private Contract accepted() {
        Contract pending = draft(true).submit("123456", TTL, NOW);
        return pending.confirmPairing(ContractParty.REQUESTER, NOW).confirmPairing(ContractParty.WORKER, NOW);
    }

    private Contract inProgress() {
        return accepted().holdFunds(Money.of(10500, CurrencyCode.USD), true, NOW);
    }

    @Test
    @DisplayName("Draft prices the contract and starts with an empty escrow")
    void testDraft_Initialization() {
        Contract contract = draft(true);

        assertEquals(ContractStatus.DRAFT, contract.getStatus());
        assertEquals(10500, contract.getTotalPrice().getMinorUnits());
        assertEquals(EscrowState.PENDING, contract.getEscrowStatus());
        assertTrue(contract.getEscrowAmount().isZero());
        assertTrue(contract.getExtensionHistory().isEmpty());
    }

    @Test
    @DisplayName("Requester and worker must be different members")
    void testDraft_SamePartiesRejected() {
        assertThrows(ValidationException.class, () -> Contract.draft(UUID.randomUUID(), null, requester, requester,
                "x", Money.of(100, CurrencyCode.USD), Money.zero(CurrencyCode.USD), CommissionRate.ZERO,
                null, null, true, null, null, NOW));
    }

    @Test
    @DisplayName("Pairing becomes ACCEPTED only after both sides confirmed")
    void testPairing_BothSidesRequired() {
        Contract pending = draft(true).submit("123456", TTL, NOW);
        assertEquals(ContractStatus.PENDING, pending.getStatus());
        assertEquals(NOW.plus(TTL), pending.getPairingExpiry());

        Contract half = pending.confirmPairing(ContractParty.WORKER, NOW);
        assertEquals(ContractStatus.PENDING, half.getStatus());
        assertTrue(half.isWorkerConfirmed());

        Contract both = half.confirmPairing(ContractParty.REQUESTER, NOW);
        assertEquals(ContractStatus.ACCEPTED, both.getStatus());
    }

    @Test
    @DisplayName("Regenerating the code drops earlier confirmations")
    void testRegeneratePairingCode_ResetsConfirmations() {
        Contract half = draft(true).submit("123456", TTL, NOW).confirmPairing(ContractParty.WORKER, NOW);
        Contract regenerated = half.regeneratePairingCode("654321", TTL, NOW.plusSeconds(60));

        assertEquals("654321", regenerated.getPairingCode());
        assertFalse(regenerated.isWorkerConfirmed());
        assertEquals(NOW.plusSeconds(60).plus(TTL), regenerated.getPairingExpiry());
    }

    @Test
    @DisplayName("Contracts without escrow are accepted by sign-off, not by pairing")
    void testSignOff_WithoutEscrow() {
        Contract pending = draft(false).submit("123456", TTL, NOW);
        assertThrows(InvalidTransitionException.class, () -> pending.confirmPairing(ContractParty.REQUESTER, NOW));

        Contract accepted = pending.signOff(ContractParty.REQUESTER, NOW).signOff(ContractParty.WORKER, NOW);
        assertEquals(ContractStatus.ACCEPTED, accepted.getStatus());
        assertThrows(InvalidTransitionException.class,
                () -> draft(false).submit("1", TTL, NOW).signOff(ContractParty.WORKER, NOW.plus(TTL)));
    }

    @Test
    @DisplayName("First hold moves ACCEPTED to IN_PROGRESS and later holds add up")
    void testHoldFunds() {
        Contract held = inProgress();
        assertEquals(ContractStatus.IN_PROGRESS, held.getStatus());
        assertEquals(EscrowState.HELD, held.getEscrowStatus());

        Contract topUp = held.holdFunds(Money.of(1050, CurrencyCode.USD), false, NOW);
        assertEquals(11550, topUp.getEscrowAmount().getMinorUnits());
        assertEquals(ContractStatus.IN_PROGRESS, topUp.getStatus());
    }

    @Test
    @DisplayName("Completing releases held escrow")
    void testComplete_ReleasesEscrow() {
        Contract completed = inProgress().markWorkComplete(NOW).complete(NOW);
        assertEquals(ContractStatus.COMPLETED, completed.getStatus());
        assertEquals(EscrowState.RELEASED, completed.getEscrowStatus());
    }

    @Test
    @DisplayName("Skipping ahead fails and leaves the contract unchanged")
    void testIllegalTransitions_LeaveRecordUnchanged() {
        Contract draft = draft(true);
        Contract snapshot = draft.toBuilder().build();

        assertThrows(InvalidTransitionException.class, () -> draft.complete(NOW));
        assertThrows(InvalidTransitionException.class, () -> draft.start(NOW));
        assertThrows(InvalidTransitionException.class, () -> draft.markWorkComplete(NOW));
        assertThrows(InvalidTransitionException.class, () -> draft.openDispute(requester, "x", NOW));
        assertEquals(snapshot, draft);

        Contract accepted = accepted();
        assertThrows(InvalidTransitionException.class, () -> accepted.complete(NOW));
        assertThrows(InvalidTransitionException.class, () -> accepted.submit("1", TTL, NOW));

        Contract cancelled = accepted.cancel("changed plans", NOW);
        assertThrows(InvalidTransitionException.class, () -> cancelled.cancel("again", NOW));
        assertThrows(InvalidTransitionException.class, () -> cancelled.start(NOW));
    }

    @Test
    @DisplayName("Only parties can open disputes")
    void testDispute_PartyOnly() {
        Contract waiting = inProgress().markWorkComplete(NOW);
        assertThrows(NotAPartyException.class, () -> waiting.openDispute(UUID.randomUUID(), "x", NOW));

        Contract disputed = waiting.openDispute(worker, "Not paid", NOW);
        assertEquals(ContractStatus.DISPUTED, disputed.getStatus());
        assertEquals(worker, disputed.getDisputedBy());
    }

    @Test
    @DisplayName("Accepted extension moves the end date, reprices and records history")
    void testExtension_AcceptReprices() {
        Contract contract = inProgress();
        Contract requested = contract.requestExtension(worker, 5, Money.of(12000, CurrencyCode.USD), 1, NOW);
        assertEquals(ContractStatus.IN_PROGRESS, requested.getPreviousStatus());
        assertNotNull(requested.getPendingExtension());

        assertThrows(InvalidTransitionException.class, () -> requested.acceptExtension(worker, Money.of(600, CurrencyCode.USD), NOW));

        assertThrows(ValidationException.class, () -> requested.acceptExtension(requester, null, NOW));

        Contract accepted = requested.acceptExtension(requester, Money.of(600, CurrencyCode.USD), NOW);
        assertEquals(contract.getEndDate().plus(Duration.ofDays(5)), accepted.getEndDate());
        assertEquals(12000, accepted.getBasePrice().getMinorUnits());
        assertEquals(600, accepted.getCommission().getMinorUnits());
        assertEquals(12600, accepted.getTotalPrice().getMinorUnits());
        assertEquals(1, accepted.getExtensionCount());
        assertEquals(1, accepted.getExtensionHistory().size());
        assertEquals(10000L, accepted.getExtensionHistory().get(0).previousPriceMinor());
        assertNull(accepted.getPendingExtension());

        assertThrows(InvalidTransitionException.class,
                () -> accepted.requestExtension(worker, 2, null, 1, NOW));
    }

    @Test
    @DisplayName("Price cannot drop once funds are held")
    void testExtension_NoPriceDecreaseWhileHeld() {
        assertThrows(InvalidTransitionException.class,
                () -> inProgress().requestExtension(worker, 5, Money.of(9000, CurrencyCode.USD), 1, NOW));
    }

    @Test
    @DisplayName("Rejected extension restores the previous status and clears the request")
    void testExtension_Reject() {
        Contract requested = accepted().requestExtension(requester, 3, null, 1, NOW);
        Contract rejected = requested.rejectExtension(worker, NOW);

        assertEquals(ContractStatus.ACCEPTED, rejected.getStatus());
        assertNull(rejected.getPendingExtension());
        assertNull(rejected.getPreviousStatus());
        assertEquals(0, rejected.getExtensionCount());
    }

    @Test
    @DisplayName("Refunds drain the escrow and mark it REFUNDED when empty")
    void testRefundFunds() {
        Contract held = inProgress();
        Contract partial = held.refundFunds(Money.of(500, CurrencyCode.USD), NOW);
        assertEquals(10000, partial.getEscrowAmount().getMinorUnits());
        assertEquals(EscrowState.HELD, partial.getEscrowStatus());

        Contract drained = partial.refundFunds(Money.of(10000, CurrencyCode.USD), NOW);
        assertTrue(drained.getEscrowAmount().isZero());
        assertEquals(EscrowState.REFUNDED, drained.getEscrowStatus());
    }

    @Test
    @DisplayName("Only terminal contracts can be soft-deleted, once")
    void testSoftDelete() {
        assertThrows(InvalidTransitionException.class, () -> accepted().softDelete(requester, "x", NOW));

        Contract deleted = accepted().cancel("no", NOW).softDelete(requester, "cleanup", NOW);
        assertTrue(deleted.isDeleted());
        assertThrows(InvalidTransitionException.class, () -> deleted.softDelete(requester, "again", NOW));
    }

    @Test
    @DisplayName("Reallocation is allowed only before acceptance")
    void testReallocate() {
        Money allocation = Money.of(4000, CurrencyCode.USD);
        Contract reallocated = draft(true).reallocate(allocation, null, Money.of(200, CurrencyCode.USD), NOW);
        assertEquals(4200, reallocated.getTotalPrice().getMinorUnits());

        assertThrows(InvalidTransitionException.class,
                () -> accepted().reallocate(allocation, null, Money.of(200, CurrencyCode.USD), NOW));
    }
}
