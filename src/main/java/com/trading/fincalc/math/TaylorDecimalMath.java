package com.trading.fincalc.math;

import static com.trading.fincalc.math.Decimals.HALF;
import static com.trading.fincalc.math.Decimals.ONE;
import static com.trading.fincalc.math.Decimals.TWO;
import static com.trading.fincalc.math.Decimals.TWO_PI;
import static com.trading.fincalc.math.Decimals.ZERO;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;

import com.trading.fincalc.api.DecimalMath;
import com.trading.fincalc.config.DomainPolicy;
import com.trading.fincalc.config.KernelSettings;
import com.trading.fincalc.error.DomainException;
import com.trading.fincalc.error.OverflowException;
import com.trading.fincalc.util.RateLimitedLogger;

import lombok.extern.log4j.Log4j2;

/**
 * {@link DecimalMath} built from series expansions and Newton iterations.
 *
 * <h3>Algorithms</h3>
 * <ul>
 * <li><b>sqrt</b>: Newton {@code y = (y + x/y) / 2}, a fixed number of steps,
 * no early exit.</li>
 * <li><b>exp</b>: halve the argument until {@code |x| <= 2}, sum a fixed number
 * of Taylor terms, square back once per halving. Arguments below -1e9 return
 * {@link #EXP_UNDERFLOW}; above 1e9 they raise {@link OverflowException}.</li>
 * <li><b>ln</b>: Newton on {@code exp(y) = x}, i.e.
 * {@code y = y - 1 + x / exp(y)}, seeded by stripping whole powers of e.</li>
 * <li><b>cos</b>: reduce modulo 2&pi; when outside [-2&pi;, 2&pi;], then Taylor.</li>
 * <li><b>powFraction</b>: binomial series of {@code (1 + x)^f}.</li>
 * <li><b>nthRoot</b>: Newton {@code x = ((n-1) x + a / x^(n-1)) / n} with the
 * sqrt step budget.</li>
 * </ul>
 *
 * Immutable and stateless between calls, so one instance can be shared by any
 * number of threads.
 */
@Log4j2
public final class TaylorDecimalMath implements DecimalMath {
    private static final BigDecimal SQRT_SEED_LOW = new BigDecimal("0.01");
    private static final BigDecimal SQRT_SEED_HIGH = Decimals.HUNDRED;

    // |x| beyond this leaves the BigDecimal exponent range while squaring back.
    private static final BigDecimal EXP_ARGUMENT_LIMIT = new BigDecimal("1E9");
    /** Returned by exp below -EXP_ARGUMENT_LIMIT; smaller than exp(-1E9). */
    public static final BigDecimal EXP_UNDERFLOW = new BigDecimal(BigInteger.ONE, 500_000_000);

    private final MathContext mc;
    private final int sqrtIterations;
    private final int expTaylorTerms;
    private final int lnIterations;
    private final int cosTaylorTerms;
    private final int powFractionTerms;
    private final BigDecimal powFractionCutoff;
    private final DomainPolicy domainPolicy;
    private final BigDecimal inverseE;
    private final RateLimitedLogger domainWarnings;

    public TaylorDecimalMath() {
        this(new KernelSettings());
    }

    public TaylorDecimalMath(KernelSettings settings) {
        settings.validate();
        this.mc = settings.mathContext();
        this.sqrtIterations = settings.getSqrtIterations();
        this.expTaylorTerms = settings.getExpTaylorTerms();
        this.lnIterations = settings.getLnIterations();
        this.cosTaylorTerms = settings.getCosTaylorTerms();
        this.powFractionTerms = settings.getPowFractionTerms();
        this.powFractionCutoff = settings.getPowFractionCutoff();
        this.domainPolicy = settings.getDomainPolicy();
        this.inverseE = ONE.divide(Decimals.E, mc);
        this.domainWarnings = new RateLimitedLogger(log, settings.getWarnIntervalMillis());
    }

    @Override
    public MathContext mathContext() {
        return mc;
    }

    @Override
    public BigDecimal sqrt(BigDecimal x) {
        int sign = x.signum();
        if (sign == 0)
            return ZERO;
        if (sign < 0)
            return outsideDomain("sqrt", x, ZERO);
        if (Decimals.isOne(x))
            return ONE;

        BigDecimal y = sqrtSeed(x);
        for (int i = 0; i < sqrtIterations; i++) {
            y = y.add(x.divide(y, mc), mc).divide(TWO, mc);
        }
        return y;
    }

    /**
     * x/2 inside [0.01, 100]. Outside it, a power of ten with half the decimal
     * exponent, so the fixed budget also covers very large and very small
     * radicands.
     */
    private BigDecimal sqrtSeed(BigDecimal x) {
        if (x.compareTo(SQRT_SEED_LOW) >= 0 && x.compareTo(SQRT_SEED_HIGH) <= 0)
            return x.divide(TWO, mc);
        return ONE.scaleByPowerOfTen(Math.floorDiv(Decimals.exponent(x), 2));
    }

    @Override
    public BigDecimal exp(BigDecimal x) {
        if (x.signum() == 0)
            return ONE;
        if (x.compareTo(EXP_ARGUMENT_LIMIT.negate()) < 0)
            return EXP_UNDERFLOW;
        if (x.compareTo(EXP_ARGUMENT_LIMIT) > 0)
            throw new OverflowException("exp", x);

        // 1. Range reduction: exp(x) = exp(x/2)^2
        BigDecimal reduced = x;
        int halvings = 0;
        while (reduced.abs().compareTo(TWO) > 0) {
            reduced = reduced.divide(TWO, mc);
            halvings++;
        }

        // 2. Taylor series on the reduced argument
        BigDecimal sum = ONE;
        BigDecimal term = ONE;
        for (int n = 1; n <= expTaylorTerms; n++) {
            term = term.multiply(reduced, mc).divide(BigDecimal.valueOf(n), mc);
            sum = sum.add(term, mc);
        }

        // 3. Undo the reduction
        for (int i = 0; i < halvings; i++) {
            sum = sum.multiply(sum, mc);
        }
        return sum;
    }

    @Override
    public BigDecimal ln(BigDecimal x) {
        if (x.signum() <= 0)
            return outsideDomain("ln", x, Decimals.LN_DOMAIN_SENTINEL);
        if (Decimals.isOne(x))
            return ZERO;

        BigDecimal y = lnSeed(x);
        for (int i = 0; i < lnIterations; i++) {
            BigDecimal ey = exp(y);
            y = y.subtract(ONE, mc).add(x.divide(ey, mc), mc);
        }
        return y;
    }

    private BigDecimal lnSeed(BigDecimal x) {
        if (x.compareTo(HALF) > 0 && x.compareTo(TWO) < 0)
            return x.subtract(ONE, mc);

        BigDecimal residue = x;
        BigDecimal whole = ZERO;
        if (x.compareTo(ONE) > 0) {
            while (residue.compareTo(Decimals.E) > 0) {
                residue = residue.divide(Decimals.E, mc);
                whole = whole.add(ONE);
            }
        } else {
            while (residue.compareTo(inverseE) < 0) {
                residue = residue.multiply(Decimals.E, mc);
                whole = whole.subtract(ONE);
            }
        }
        return whole.add(residue.subtract(ONE, mc), mc);
    }

    @Override
    public BigDecimal cos(BigDecimal x) {
        BigDecimal xr = x;
        if (xr.abs().compareTo(TWO_PI) > 0) {
            BigDecimal periods = xr.divide(TWO_PI, mc).setScale(0, RoundingMode.FLOOR);
            xr = xr.subtract(periods.multiply(TWO_PI, mc), mc);
        }

        BigDecimal negSquare = xr.multiply(xr, mc).negate();
        BigDecimal sum = ONE;
        BigDecimal term = ONE;
        for (int n = 1; n <= cosTaylorTerms; n++) {
            long denominator = (2L * n - 1) * (2L * n);
            term = term.multiply(negSquare, mc).divide(BigDecimal.valueOf(denominator), mc);
            sum = sum.add(term, mc);
        }
        return sum;
    }

    @Override
    public BigDecimal sinh(BigDecimal x) {
        return exp(x).subtract(exp(x.negate()), mc).divide(TWO, mc);
    }

    @Override
    public BigDecimal cosh(BigDecimal x) {
        return exp(x).add(exp(x.negate()), mc).divide(TWO, mc);
    }

    @Override
    public BigDecimal acosh(BigDecimal x) {
        if (x.compareTo(ONE) < 0)
            return outsideDomain("acosh", x, ZERO);
        BigDecimal root = sqrt(x.multiply(x, mc).subtract(ONE, mc));
        return ln(x.add(root, mc));
    }

    @Override
    public BigDecimal powFraction(BigDecimal base, BigDecimal fraction) {
        if (fraction.signum() == 0)
            return ONE;
        if (Decimals.isOne(fraction))
            return base;
        if (Decimals.isOne(base))
            return ONE;

        // (1+x)^f = sum C(f,k) x^k, C(f,k) = C(f,k-1) * (f-k+1) / k
        BigDecimal x = base.subtract(ONE, mc);
        BigDecimal result = ONE;
        BigDecimal term = ONE;
        for (int k = 1; k <= powFractionTerms; k++) {
            BigDecimal kd = BigDecimal.valueOf(k);
            BigDecimal coefficient = fraction.subtract(kd, mc).add(ONE, mc);
            term = term.multiply(coefficient, mc).multiply(x, mc).divide(kd, mc);
            result = result.add(term, mc);
            if (term.abs().compareTo(powFractionCutoff) < 0)
                break;
        }
        return result;
    }

    @Override
    public BigDecimal nthRoot(BigDecimal a, int n) {
        if (n < 1)
            throw new IllegalArgumentException("nthRoot degree must be >= 1, got " + n);
        if (a.signum() <= 0)
            return outsideDomain("nthRoot", a, ZERO);
        if (n == 1 || Decimals.isOne(a))
            return a;

        BigDecimal degree = BigDecimal.valueOf(n);
        BigDecimal lower = BigDecimal.valueOf(n - 1L);
        BigDecimal x = a.compareTo(HALF) > 0 && a.compareTo(TWO) < 0
                ? ONE.add(a.subtract(ONE, mc).divide(degree, mc), mc)
                : exp(ln(a).divide(degree, mc));
        for (int i = 0; i < sqrtIterations; i++) {
            BigDecimal power = ONE;
            for (int k = 1; k < n; k++)
                power = power.multiply(x, mc);
            x = lower.multiply(x, mc).add(a.divide(power, mc), mc).divide(degree, mc);
        }
        return x;
    }

    private BigDecimal outsideDomain(String function, BigDecimal x, BigDecimal sentinel) {
        if (domainPolicy == DomainPolicy.FAIL)
            throw new DomainException(function, x);
        domainWarnings.warn(function + "(" + x.toPlainString() + ") is outside its domain, returning "
                + sentinel.toPlainString());
        return sentinel;
    }
}
