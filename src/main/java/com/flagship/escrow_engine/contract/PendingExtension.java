package com.flagship.escrow_engine.contract;

import com.flagship.escrow_engine.money.Money;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An extension request waiting for the counterpart's answer.
 */
@Value
public class PendingExtension {
    int days;
    Money newPrice;
    UUID requestedBy;
    Instant requestedAt;

    public boolean changesPrice() {
        return newPrice != null;
    }
}
