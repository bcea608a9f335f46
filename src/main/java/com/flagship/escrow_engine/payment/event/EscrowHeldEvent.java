package com.flagship.escrow_engine.payment.event;

import com.flagship.escrow_engine.payment.Payment;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Funds were captured and are held in escrow for the worker.
 */
@Value
public class EscrowHeldEvent implements PaymentEvent {
    UUID eventId;
    UUID paymentId;
    UUID contractId;
    UUID payerId;
    UUID recipientId;
    String kind;
    long amountMinor;
    String currency;
    String gatewayCaptureId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EscrowHeld";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static EscrowHeldEvent fromPayment(Payment payment, Instant now) {
        return new EscrowHeldEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getContractId(),
            payment.getPayerId(),
            payment.getRecipientId(),
            payment.getKind().name(),
            payment.getAmount().getMinorUnits(),
            payment.getAmount().getCurrency().name(),
            payment.getGatewayCaptureId(),
            now
        );
    }
}
