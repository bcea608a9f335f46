package com.flagship.escrow_engine.payment.event;

import com.flagship.escrow_engine.payment.Payment;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The gateway rejected the payment or its order expired unapproved.
 */
@Value
public class PaymentFailedEvent implements PaymentEvent {
    UUID eventId;
    UUID paymentId;
    UUID contractId;
    long amountMinor;
    String currency;
    String failureReason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentFailed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentFailedEvent fromPayment(Payment payment, Instant now) {
        return new PaymentFailedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getContractId(),
            payment.getAmount().getMinorUnits(),
            payment.getAmount().getCurrency().name(),
            payment.getFailureReason(),
            now
        );
    }
}
