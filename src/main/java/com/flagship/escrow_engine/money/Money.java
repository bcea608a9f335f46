package com.flagship.escrow_engine.money;

import com.flagship.escrow_engine.exception.CurrencyMismatchException;
import com.flagship.escrow_engine.exception.InvalidAmountException;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * An exact, non-negative amount of money in minor units (e.g. cents).
 *
 * Key invariants:
 * - never negative (InvalidAmountException)
 * - values in different currencies are never combined (CurrencyMismatchException)
 * - no floating point anywhere; rate application rounds half-up to the minor unit
 */
@Value
public class Money implements Comparable<Money> {
    long minorUnits;
    CurrencyCode currency;

    private Money(long minorUnits, CurrencyCode currency) {
        if (currency == null) {
            throw new InvalidAmountException("Currency is required");
        }
        if (minorUnits < 0) {
            throw new InvalidAmountException("Amount cannot be negative: " + minorUnits);
        }
        this.minorUnits = minorUnits;
        this.currency = currency;
    }

    public static Money of(long minorUnits, CurrencyCode currency) {
        return new Money(minorUnits, currency);
    }

    public static Money zero(CurrencyCode currency) {
        return new Money(0, currency);
    }

    /**
     * Parses a decimal major-unit amount such as "105.50". More decimals than
     * the currency allows is an error, not a silent rounding.
     */
    public static Money ofMajor(BigDecimal majorUnits, CurrencyCode currency) {
        Objects.requireNonNull(majorUnits, "amount");
        if (majorUnits.signum() < 0) {
            throw new InvalidAmountException("Amount cannot be negative: " + majorUnits);
        }
        try {
            long minor = majorUnits.movePointRight(currency.getMinorDigits())
                .setScale(0, RoundingMode.UNNECESSARY)
                .longValueExact();
            return new Money(minor, currency);
        } catch (ArithmeticException e) {
            throw new InvalidAmountException(
                String.format("Amount %s has more precision than %s allows", majorUnits, currency));
        }
    }

    public Money plus(Money other) {
        requireSameCurrency(other);
        return new Money(Math.addExact(minorUnits, other.minorUnits), currency);
    }

    /**
     * @throws InvalidAmountException if the result would be negative
     */
    public Money minus(Money other) {
        requireSameCurrency(other);
        return new Money(minorUnits - other.minorUnits, currency);
    }

    /**
     * Applies a percentage, rounding half-up to the currency's minor unit.
     */
    public Money applyRate(CommissionRate rate) {
        long result = BigDecimal.valueOf(minorUnits)
            .multiply(rate.getPercent())
            .divide(BigDecimal.valueOf(100), 0, RoundingMode.HALF_UP)
            .longValueExact();
        return new Money(result, currency);
    }

    public boolean isZero() {
        return minorUnits == 0;
    }

    public boolean isGreaterThan(Money other) {
        return compareTo(other) > 0;
    }

    public BigDecimal toMajor() {
        return BigDecimal.valueOf(minorUnits, currency.getMinorDigits());
    }

    @Override
    public int compareTo(Money other) {
        requireSameCurrency(other);
        return Long.compare(minorUnits, other.minorUnits);
    }

    @Override
    public String toString() {
        return toMajor().toPlainString() + " " + currency;
    }

    private void requireSameCurrency(Money other) {
        if (other.currency != currency) {
            throw new CurrencyMismatchException(currency, other.currency);
        }
    }
}
