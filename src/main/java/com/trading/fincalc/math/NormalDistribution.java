package com.trading.fincalc.math;

import static com.trading.fincalc.math.Decimals.HALF;
import static com.trading.fincalc.math.Decimals.ONE;
import static com.trading.fincalc.math.Decimals.TWO;

import java.math.BigDecimal;
import java.math.MathContext;

import com.trading.fincalc.api.DecimalMath;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Standard normal density, distribution and quantile functions.
 *
 * <p>
 * The distribution uses Abramowitz &amp; Stegun 26.2.17 (absolute error below
 * 7.5e-8); the quantile uses A&amp;S 26.2.23 (absolute error below 4.5e-4).
 * Both are rational approximations, so they cost a handful of exp/ln/sqrt
 * calls rather than an iterative inversion.
 */
public final class NormalDistribution {
    private static final Logger log = LogManager.getLogger(NormalDistribution.class);

    // A&S 26.2.17
    private static final BigDecimal P = new BigDecimal("0.2316419");
    private static final BigDecimal B1 = new BigDecimal("0.319381530");
    private static final BigDecimal B2 = new BigDecimal("-0.356563782");
    private static final BigDecimal B3 = new BigDecimal("1.781477937");
    private static final BigDecimal B4 = new BigDecimal("-1.821255978");
    private static final BigDecimal B5 = new BigDecimal("1.330274429");

    // A&S 26.2.23
    private static final BigDecimal C0 = new BigDecimal("2.515517");
    private static final BigDecimal C1 = new BigDecimal("0.802853");
    private static final BigDecimal C2 = new BigDecimal("0.010328");
    private static final BigDecimal D1 = new BigDecimal("1.432788");
    private static final BigDecimal D2 = new BigDecimal("0.189269");
    private static final BigDecimal D3 = new BigDecimal("0.001308");

    private static final BigDecimal MINUS_TWO = BigDecimal.valueOf(-2);
    // cdf is 0 or 1 to well beyond 28 digits past this.
    private static final BigDecimal CDF_TAIL_LIMIT = BigDecimal.valueOf(40);

    private final DecimalMath math;
    private final MathContext mc;
    private final BigDecimal clampLow;
    private final BigDecimal clampHigh;
    private final BigDecimal sqrtTwoPi;

    /**
     * @param math  Transcendental functions to build on.
     * @param clamp Probabilities are confined to (clamp, 1 - clamp) before
     *              inversion.
     */
    public NormalDistribution(DecimalMath math, BigDecimal clamp) {
        if (clamp.signum() <= 0 || clamp.compareTo(HALF) >= 0)
            throw new IllegalArgumentException("clamp must be in (0, 0.5), got " + clamp);
        this.math = math;
        this.mc = math.mathContext();
        this.clampLow = clamp;
        this.clampHigh = ONE.subtract(clamp);
        this.sqrtTwoPi = math.sqrt(Decimals.TWO_PI);
    }

    /** exp(-x^2 / 2) / sqrt(2&pi;) */
    public BigDecimal pdf(BigDecimal x) {
        BigDecimal exponent = x.multiply(x, mc).divide(TWO, mc).negate();
        return math.exp(exponent).divide(sqrtTwoPi, mc);
    }

    /** P(Z &le; x). Exactly 0 or 1 once |x| exceeds 40. */
    public BigDecimal cdf(BigDecimal x) {
        BigDecimal absX = x.abs();
        if (absX.compareTo(CDF_TAIL_LIMIT) > 0)
            return x.signum() < 0 ? Decimals.ZERO : ONE;
        BigDecimal t = ONE.divide(ONE.add(P.multiply(absX, mc), mc), mc);

        // Horner: t * (b1 + t * (b2 + t * (b3 + t * (b4 + t * b5))))
        BigDecimal poly = B5;
        poly = B4.add(t.multiply(poly, mc), mc);
        poly = B3.add(t.multiply(poly, mc), mc);
        poly = B2.add(t.multiply(poly, mc), mc);
        poly = B1.add(t.multiply(poly, mc), mc);
        poly = t.multiply(poly, mc);

        BigDecimal upper = ONE.subtract(pdf(absX).multiply(poly, mc), mc);
        return x.signum() < 0 ? ONE.subtract(upper, mc) : upper;
    }

    /**
     * Quantile: x such that cdf(x) &asymp; p.
     * <p>
     * Probabilities outside (clamp, 1 - clamp) are clamped, not rejected.
     */
    public BigDecimal inverseCdf(BigDecimal p) {
        BigDecimal clamped = Decimals.clamp(p, clampLow, clampHigh);
        if (clamped.compareTo(p) != 0 && log.isDebugEnabled()) {
            log.debug("inverseCdf clamped p={} to {}", p.toPlainString(), clamped.toPlainString());
        }

        // Work in the lower tail; the upper tail mirrors it.
        boolean upperTail = clamped.compareTo(HALF) > 0;
        BigDecimal tail = upperTail ? ONE.subtract(clamped, mc) : clamped;

        BigDecimal t = math.sqrt(MINUS_TWO.multiply(math.ln(tail), mc));
        BigDecimal t2 = t.multiply(t, mc);
        BigDecimal t3 = t2.multiply(t, mc);

        BigDecimal numerator = C0.add(C1.multiply(t, mc), mc).add(C2.multiply(t2, mc), mc);
        BigDecimal denominator = ONE.add(D1.multiply(t, mc), mc)
                .add(D2.multiply(t2, mc), mc)
                .add(D3.multiply(t3, mc), mc);

        BigDecimal deviate = t.subtract(numerator.divide(denominator, mc), mc);
        return upperTail ? deviate : deviate.negate();
    }
}
