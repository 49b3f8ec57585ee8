package com.gnucash.matcher.sqlite;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Converts the rational {@code num/denom} pairs GnuCash stores for amounts into decimals. Power of
 * ten denominators, the usual case, convert exactly and keep their scale ({@code 25000/100} becomes
 * {@code 250.00}).
 */
public final class GncNumeric {

    private GncNumeric() {}

    public static BigDecimal toBigDecimal(long num, long denom) {
        if (denom <= 0) {
            throw new IllegalArgumentException("Invalid denominator: " + denom);
        }
        int scale = powerOfTen(denom);
        if (scale >= 0) {
            return BigDecimal.valueOf(num, scale);
        }
        return BigDecimal.valueOf(num).divide(BigDecimal.valueOf(denom), MathContext.DECIMAL64);
    }

    /** Returns {@code n} when {@code value == 10^n}, otherwise -1. */
    static int powerOfTen(long value) {
        int exponent = 0;
        long remaining = value;
        while (remaining > 1) {
            if (remaining % 10 != 0) {
                return -1;
            }
            remaining /= 10;
            exponent++;
        }
        return remaining == 1 ? exponent : -1;
    }
}
