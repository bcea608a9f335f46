package com.flagship.escrow_engine.money;

/**
 * Currency code enum following ISO-4217 standard.
 *
 * Carries the number of minor-unit digits so amounts can be stored as
 * exact integers (cents, centavos) and rounded to the right precision.
 */
public enum CurrencyCode {
    ARS(2), // Argentine Peso
    USD(2), // US Dollar
    EUR(2), // Euro
    GBP(2), // British Pound
    BRL(2), // Brazilian Real
    JPY(0); // Japanese Yen

    private final int minorDigits;

    CurrencyCode(int minorDigits) {
        this.minorDigits = minorDigits;
    }

    public int getMinorDigits() {
        return minorDigits;
    }
}
