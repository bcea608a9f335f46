package com.flagship.escrow_engine.money;

import com.flagship.escrow_engine.exception.ValidationException;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A commission percentage with two decimal places, between 0.00 and 100.00.
 */
@Value
public class CommissionRate implements Comparable<CommissionRate> {

    public static final CommissionRate ZERO = new CommissionRate(BigDecimal.ZERO.setScale(2));

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    BigDecimal percent;

    private CommissionRate(BigDecimal percent) {
        this.percent = percent;
    }

    public static CommissionRate of(BigDecimal percent) {
        if (percent == null) {
            throw new ValidationException("Commission rate is required");
        }
        if (percent.signum() < 0 || percent.compareTo(HUNDRED) > 0) {
            throw new ValidationException("Commission rate must be between 0 and 100: " + percent);
        }
        try {
            return new CommissionRate(percent.setScale(2, RoundingMode.UNNECESSARY));
        } catch (ArithmeticException e) {
            throw new ValidationException("Commission rate allows two decimal places: " + percent);
        }
    }

    public static CommissionRate of(String percent) {
        return of(new BigDecimal(percent));
    }

    public CommissionRate min(CommissionRate other) {
        return compareTo(other) <= 0 ? this : other;
    }

    public boolean isZero() {
        return percent.signum() == 0;
    }

    @Override
    public int compareTo(CommissionRate other) {
        return percent.compareTo(other.percent);
    }

    @Override
    public String toString() {
        return percent.toPlainString() + "%";
    }
}
