package com.trading.fincalc.math;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Constants and small helpers for the fixed-point decimal type.
 *
 * <p>
 * The kernel's number type is {@link BigDecimal} under one {@link MathContext}.
 * Comparisons always go through {@code compareTo} so that {@code 1.0} and
 * {@code 1.00} are the same value.
 */
public final class Decimals {
    private Decimals() {
        // Utility class
    }

    /** 28 significant digits, banker's rounding. */
    public static final MathContext DEFAULT_CONTEXT = new MathContext(28, RoundingMode.HALF_EVEN);

    public static final BigDecimal ZERO = BigDecimal.ZERO;
    public static final BigDecimal ONE = BigDecimal.ONE;
    public static final BigDecimal TWO = BigDecimal.valueOf(2);
    public static final BigDecimal HALF = new BigDecimal("0.5");
    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public static final BigDecimal E = new BigDecimal("2.718281828459045235360287471");
    public static final BigDecimal PI = new BigDecimal("3.141592653589793238462643383");
    public static final BigDecimal TWO_PI = new BigDecimal("6.283185307179586476925286767");

    /** Returned by ln for a non-positive argument under the sentinel policy. */
    public static final BigDecimal LN_DOMAIN_SENTINEL = BigDecimal.valueOf(-999);

    public static BigDecimal of(String value) {
        return new BigDecimal(value);
    }

    public static BigDecimal of(long value) {
        return BigDecimal.valueOf(value);
    }

    public static BigDecimal[] vector(String... values) {
        BigDecimal[] out = new BigDecimal[values.length];
        for (int i = 0; i < values.length; i++)
            out[i] = new BigDecimal(values[i]);
        return out;
    }

    public static BigDecimal[][] matrix(String[]... rows) {
        BigDecimal[][] out = new BigDecimal[rows.length][];
        for (int i = 0; i < rows.length; i++)
            out[i] = vector(rows[i]);
        return out;
    }

    public static boolean isZero(BigDecimal v) {
        return v.signum() == 0;
    }

    public static boolean isOne(BigDecimal v) {
        return v.compareTo(ONE) == 0;
    }

    public static boolean lt(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) < 0;
    }

    public static boolean gt(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) > 0;
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static BigDecimal max(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    /** Restricts {@code v} to {@code [lo, hi]}. */
    public static BigDecimal clamp(BigDecimal v, BigDecimal lo, BigDecimal hi) {
        if (v.compareTo(lo) < 0)
            return lo;
        if (v.compareTo(hi) > 0)
            return hi;
        return v;
    }

    /** {@code |a - b| <= tol}. */
    public static boolean closeTo(BigDecimal a, BigDecimal b, BigDecimal tol) {
        return a.subtract(b).abs().compareTo(tol) <= 0;
    }

    /** Sum of the values, rounded to {@code mc}. */
    public static BigDecimal sum(BigDecimal[] values, MathContext mc) {
        BigDecimal s = ZERO;
        for (BigDecimal v : values)
            s = s.add(v, mc);
        return s;
    }

    /**
     * Decimal exponent of a non-zero value: {@code e} such that
     * {@code 10^e <= |v| < 10^(e+1)}.
     */
    public static int exponent(BigDecimal v) {
        return v.precision() - v.scale() - 1;
    }
}
