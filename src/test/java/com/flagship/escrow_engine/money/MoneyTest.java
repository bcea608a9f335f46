package com.flagship.escrow_engine.money;

import com.flagship.escrow_engine.exception.CurrencyMismatchException;
import com.flagship.escrow_engine.exception.InvalidAmountException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class MoneyTest {

    @Test
    @DisplayName("Major units are converted to exact minor units")
    void testOfMajor_ConvertsToMinorUnits() {
        assertEquals(10550, Money.ofMajor(new BigDecimal("105.50"), CurrencyCode.USD).getMinorUnits());
        assertEquals(1200, Money.ofMajor(new BigDecimal("1200"), CurrencyCode.JPY).getMinorUnits());
    }

    @Test
    @DisplayName("More decimals than the currency allows is rejected, not rounded")
    void testOfMajor_RejectsExcessPrecision() {
        assertThrows(InvalidAmountException.class,
                () -> Money.ofMajor(new BigDecimal("10.005"), CurrencyCode.USD));
        assertThrows(InvalidAmountException.class,
                () -> Money.ofMajor(new BigDecimal("10.5"), CurrencyCode.JPY));
    }

    @Test
    @DisplayName("Negative amounts cannot be created or produced by subtraction")
    void testNegativeAmounts_Rejected() {
        assertThrows(InvalidAmountException.class, () -> Money.of(-1, CurrencyCode.USD));
        Money small = Money.of(100, CurrencyCode.USD);
        Money large = Money.of(200, CurrencyCode.USD);
        assertThrows(InvalidAmountException.class, () -> small.minus(large));
    }

    @Test
    @DisplayName("Different currencies are never combined")
    void testCurrencyMismatch_Rejected() {
        Money usd = Money.of(100, CurrencyCode.USD);
        Money eur = Money.of(100, CurrencyCode.EUR);
        assertThrows(CurrencyMismatchException.class, () -> usd.plus(eur));
        assertThrows(CurrencyMismatchException.class, () -> usd.compareTo(eur));
    }

    @Test
    @DisplayName("Rate application rounds half-up to the minor unit")
    void testApplyRate_RoundsHalfUp() {
        assertEquals(500, Money.of(10000, CurrencyCode.USD).applyRate(CommissionRate.of("5.00")).getMinorUnits());
        // 333 * 1.5% = 4.995 -> 5
        assertEquals(5, Money.of(333, CurrencyCode.USD).applyRate(CommissionRate.of("1.50")).getMinorUnits());
        // 329 * 1.5% = 4.935 -> 5
        assertEquals(5, Money.of(329, CurrencyCode.USD).applyRate(CommissionRate.of("1.50")).getMinorUnits());
        // 323 * 1.5% = 4.845 -> 5
        assertEquals(5, Money.of(323, CurrencyCode.USD).applyRate(CommissionRate.of("1.50")).getMinorUnits());
        // 300 * 1.5% = 4.5 -> 5, 299 * 1.5% = 4.485 -> 4
        assertEquals(5, Money.of(300, CurrencyCode.USD).applyRate(CommissionRate.of("1.50")).getMinorUnits());
        assertEquals(4, Money.of(299, CurrencyCode.USD).applyRate(CommissionRate.of("1.50")).getMinorUnits());
    }

    @Test
    @DisplayName("Commission rates outside 0..100 or with more than two decimals are rejected")
    void testCommissionRate_Bounds() {
        assertThrows(RuntimeException.class, () -> CommissionRate.of("-0.01"));
        assertThrows(RuntimeException.class, () -> CommissionRate.of("100.01"));
        assertThrows(RuntimeException.class, () -> CommissionRate.of("2.125"));
        assertEquals(CommissionRate.of("2.00"), CommissionRate.of("3.00").min(CommissionRate.of("2")));
    }

    @Test
    @DisplayName("toMajor and toString use the currency's minor digits")
    void testFormatting() {
        Money money = Money.of(10550, CurrencyCode.USD);
        assertEquals(new BigDecimal("105.50"), money.toMajor());
        assertEquals("105.50 USD", money.toString());
    }
}
