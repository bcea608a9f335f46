package com.flagship.escrow_engine.commission;

import com.flagship.escrow_engine.exception.ValidationException;
import com.flagship.escrow_engine.money.CommissionRate;
import com.flagship.escrow_engine.money.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Computes the platform commission for a contract.
 *
 * Pure: no I/O, no clock, no persistence. The same input always yields
 * the same quote.
 *
 * Rules, in order:
 * 1. A free contract credit zeroes the commission and is consumed.
 * 2. Otherwise the effective rate is the lowest of the platform default,
 *    the tier rate (PRO / SUPER_PRO within the monthly quota, FAMILY always)
 *    and the payer's current rate.
 * 3. commission = basePrice x rate, rounded half-up to the minor unit.
 * 4. An optional minimum applies to positive commissions, capped at the base price.
 */
@Component
@Slf4j
public class CommissionCalculator {

    private final CommissionRate defaultRate;
    private final CommissionRate proRate;
    private final CommissionRate superProRate;
    private final CommissionRate familyRate;
    private final int tierMonthlyQuota;
    private final long minimumMinorUnits;

    public CommissionCalculator(CommissionProperties properties) {
        this.defaultRate = CommissionRate.of(properties.getDefaultRate());
        this.proRate = CommissionRate.of(properties.getProRate());
        this.superProRate = CommissionRate.of(properties.getSuperProRate());
        this.familyRate = CommissionRate.of(properties.getFamilyRate());
        this.tierMonthlyQuota = properties.getTierMonthlyQuota();
        this.minimumMinorUnits = properties.getMinimumMinorUnits();
    }

    public CommissionQuote calculate(CommissionInput input) {
        validate(input);
        Money basePrice = input.getBasePrice();

        if (input.getFreeContractsRemaining() > 0) {
            return new CommissionQuote(
                basePrice,
                Money.zero(basePrice.getCurrency()),
                CommissionRate.ZERO,
                true,
                input.getFreeContractsRemaining() - 1
            );
        }

        CommissionRate rate = effectiveRate(input);
        Money commission = commissionAt(basePrice, rate);

        log.debug("Commission computed: tier={}, rate={}, base={}, commission={}",
                input.getTier(), rate, basePrice, commission);

        return new CommissionQuote(basePrice, commission, rate, false, 0);
    }

    /**
     * Commission on a new base price at a rate already fixed on the contract, with the
     * same minimum as a fresh quote. A zero rate stays zero.
     */
    public Money commissionAt(Money basePrice, CommissionRate rate) {
        if (basePrice == null || rate == null) {
            throw new ValidationException("Base price and rate are required");
        }
        Money commission = basePrice.applyRate(rate);
        if (!rate.isZero() && commission.getMinorUnits() < minimumMinorUnits) {
            long floored = Math.min(minimumMinorUnits, basePrice.getMinorUnits());
            commission = Money.of(floored, basePrice.getCurrency());
        }
        return commission;
    }

    /**
     * The rate that would apply if no free credit were available.
     */
    public CommissionRate effectiveRate(CommissionInput input) {
        CommissionRate rate = defaultRate;

        CommissionRate tierRate = switch (input.getTier()) {
            case FREE -> null;
            case PRO -> input.getContractsThisMonth() < tierMonthlyQuota ? proRate : null;
            case SUPER_PRO -> input.getContractsThisMonth() < tierMonthlyQuota ? superProRate : null;
            case FAMILY -> familyRate;
        };
        if (tierRate != null) {
            rate = rate.min(tierRate);
        }
        if (input.getCurrentCommissionRate() != null) {
            rate = rate.min(input.getCurrentCommissionRate());
        }
        return rate;
    }

    private void validate(CommissionInput input) {
        if (input.getBasePrice() == null) {
            throw new ValidationException("Base price is required");
        }
        if (input.getTier() == null) {
            throw new ValidationException("Membership tier is required");
        }
        if (input.getFreeContractsRemaining() < 0) {
            throw new ValidationException("Free contract credits cannot be negative");
        }
        if (input.getContractsThisMonth() < 0) {
            throw new ValidationException("Monthly contract count cannot be negative");
        }
    }
}
