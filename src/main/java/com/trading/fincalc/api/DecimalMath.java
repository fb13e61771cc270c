package com.trading.fincalc.api;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Transcendental functions over the fixed-point decimal type.
 *
 * <p>
 * This is the single capability every calculator uses for sqrt, exp, ln and
 * friends. Implementations run fixed iteration budgets: the same argument
 * always yields the same digits, on any platform.
 *
 * <p>
 * Domain handling (sqrt of a negative, ln of a non-positive value, acosh below
 * one) follows the configured {@link com.trading.fincalc.config.DomainPolicy}.
 */
public interface DecimalMath {

    /** Context every operation rounds to. */
    MathContext mathContext();

    /**
     * Square root by Newton's method.
     *
     * @param x The radicand.
     * @return sqrt(x); 0 for x = 0.
     */
    BigDecimal sqrt(BigDecimal x);

    /** e^x by range-reduced Taylor series. Always positive. */
    BigDecimal exp(BigDecimal x);

    /**
     * Natural logarithm by Newton's method on exp.
     *
     * @param x The argument.
     * @return ln(x); exactly 0 for x = 1.
     */
    BigDecimal ln(BigDecimal x);

    /** Cosine by Taylor series after reduction modulo 2&pi;. */
    BigDecimal cos(BigDecimal x);

    /** (e^x - e^-x) / 2 */
    BigDecimal sinh(BigDecimal x);

    /** (e^x + e^-x) / 2 */
    BigDecimal cosh(BigDecimal x);

    /** ln(x + sqrt(x^2 - 1)) for x &ge; 1. */
    BigDecimal acosh(BigDecimal x);

    /**
     * base^fraction for a fraction in [0, 1] and a base near 1, by binomial
     * series. Used to discount a stub period.
     *
     * @param base     The base, expected in (0, 2).
     * @param fraction The exponent, expected in [0, 1].
     * @return base^fraction.
     */
    BigDecimal powFraction(BigDecimal base, BigDecimal fraction);

    /**
     * Principal n-th root of a positive value by Newton's method.
     *
     * @param a The radicand; must be positive.
     * @param n The degree, at least 1.
     * @return a^(1/n).
     */
    BigDecimal nthRoot(BigDecimal a, int n);
}
