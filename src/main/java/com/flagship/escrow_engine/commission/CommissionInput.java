package com.flagship.escrow_engine.commission;

import com.flagship.escrow_engine.money.CommissionRate;
import com.flagship.escrow_engine.money.Money;
import lombok.Builder;
import lombok.Value;

/**
 * Everything the calculator needs to price one contract for one payer.
 *
 * contractsThisMonth is the number of contracts the payer already opened
 * in the current calendar month, not counting the one being priced.
 */
@Value
@Builder
public class CommissionInput {
    MembershipTier tier;
    int freeContractsRemaining;
    CommissionRate currentCommissionRate;
    int contractsThisMonth;
    Money basePrice;
}
