package com.flagship.escrow_engine.payment.event;

import com.flagship.escrow_engine.payment.Payment;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A gateway order exists for the payment and awaits the payer's approval.
 */
@Value
public class PaymentOrderOpenedEvent implements PaymentEvent {
    UUID eventId;
    UUID paymentId;
    UUID contractId;
    String kind;
    long amountMinor;
    String currency;
    String gatewayOrderId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentOrderOpened";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentOrderOpenedEvent fromPayment(Payment payment, Instant now) {
        return new PaymentOrderOpenedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getContractId(),
            payment.getKind().name(),
            payment.getAmount().getMinorUnits(),
            payment.getAmount().getCurrency().name(),
            payment.getGatewayOrderId(),
            now
        );
    }
}
