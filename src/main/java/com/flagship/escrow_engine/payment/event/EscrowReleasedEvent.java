package com.flagship.escrow_engine.payment.event;

import com.flagship.escrow_engine.payment.Payment;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Held funds were released to the worker.
 */
@Value
public class EscrowReleasedEvent implements PaymentEvent {
    UUID eventId;
    UUID paymentId;
    UUID contractId;
    UUID recipientId;
    long amountMinor;
    long platformFeeMinor;
    String currency;
    UUID releasedBy;
    String trigger;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EscrowReleased";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static EscrowReleasedEvent fromPayment(Payment payment, String trigger, Instant now) {
        return new EscrowReleasedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getContractId(),
            payment.getRecipientId(),
            payment.getAmount().getMinorUnits(),
            payment.getPlatformFee().getMinorUnits(),
            payment.getAmount().getCurrency().name(),
            payment.getEscrowReleasedBy(),
            trigger,
            now
        );
    }
}
