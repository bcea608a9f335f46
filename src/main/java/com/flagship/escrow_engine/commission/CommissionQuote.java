package com.flagship.escrow_engine.commission;

import com.flagship.escrow_engine.money.CommissionRate;
import com.flagship.escrow_engine.money.Money;
import lombok.Value;

/**
 * Result of pricing a contract.
 *
 * consumedFreeCredit and remainingFreeCredits are reported, not applied:
 * the caller persists the decremented counter.
 */
@Value
public class CommissionQuote {
    Money basePrice;
    Money commission;
    CommissionRate effectiveRate;
    boolean consumedFreeCredit;
    int remainingFreeCredits;

    public Money getTotalPrice() {
        return basePrice.plus(commission);
    }
}
