package com.flagship.escrow_engine.payment.event;

import com.flagship.escrow_engine.payment.Payment;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class PaymentRefundedEvent implements PaymentEvent {
    UUID eventId;
    UUID paymentId;
    UUID contractId;
    UUID payerId;
    long amountMinor;
    String currency;
    String refundId;
    String reason;
    UUID refundedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentRefunded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentRefundedEvent fromPayment(Payment payment, Instant now) {
        return new PaymentRefundedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getContractId(),
            payment.getPayerId(),
            payment.getAmount().getMinorUnits(),
            payment.getAmount().getCurrency().name(),
            payment.getRefundId(),
            payment.getRefundReason(),
            payment.getRefundedBy(),
            now
        );
    }
}
