package com.flagship.escrow_engine.payment.event;

import com.flagship.escrow_engine.payment.Payment;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A payment on a contract without escrow was captured and paid out directly.
 */
@Value
public class PaymentCompletedEvent implements PaymentEvent {
    UUID eventId;
    UUID paymentId;
    UUID contractId;
    UUID payerId;
    UUID recipientId;
    long amountMinor;
    long platformFeeMinor;
    String currency;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentCompleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentCompletedEvent fromPayment(Payment payment, Instant now) {
        return new PaymentCompletedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getContractId(),
            payment.getPayerId(),
            payment.getRecipientId(),
            payment.getAmount().getMinorUnits(),
            payment.getPlatformFee().getMinorUnits(),
            payment.getAmount().getCurrency().name(),
            now
        );
    }
}
