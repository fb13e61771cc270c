package com.trading.fincalc.solver;

import static com.trading.fincalc.math.Decimals.ONE;
import static com.trading.fincalc.math.Decimals.ZERO;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

import com.trading.fincalc.api.DecimalMath;
import com.trading.fincalc.error.ConvergenceException;
import com.trading.fincalc.math.Decimals;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Newton-Raphson solver for the rate that zeroes a cash-flow series' NPV.
 *
 * <pre>
 * NPV(r)  = sum CF_t / (1+r)^t
 * NPV'(r) = sum -t * CF_t / (1+r)^(t+1)
 * r      &lt;- r - NPV(r) / NPV'(r)
 * </pre>
 *
 * Whole periods of the discount factor are built by repeated multiplication,
 * {@code (1+r)^t = (1+r)^(t-1) * (1+r)}, so no power routine's approximation
 * error enters the valuation. Only the fractional part of a time offset (a stub
 * period) goes through {@link DecimalMath#powFraction}, and only while
 * {@code |r| < 0.5} where its binomial series is accurate; beyond that the stub
 * factor is {@code exp(frac * ln(1+r))}.
 *
 * <p>
 * The rate is clamped into the configured band after every step. The solver
 * fails with {@link ConvergenceException} when the iteration ceiling is hit or
 * the derivative is exactly zero.
 */
public final class CashFlowRootFinder {
    private static final Logger log = LogManager.getLogger(CashFlowRootFinder.class);
    private static final BigDecimal BINOMIAL_RADIUS = Decimals.HALF;

    private final DecimalMath math;
    private final MathContext mc;
    private final SolverConfig config;

    public CashFlowRootFinder(DecimalMath math, SolverConfig config) {
        this.math = math;
        this.mc = math.mathContext();
        this.config = config.copy().validate();
    }

    /** Copy of the guard rails in use; changing it does not affect this solver. */
    public SolverConfig config() {
        return config.copy();
    }

    /**
     * Solves for the rate.
     *
     * @param series Validated cash flows.
     * @param guess  Starting rate; clamped into the band first.
     * @return The rate at which |NPV| is below tolerance.
     * @throws ConvergenceException when no such rate was reached.
     */
    public BigDecimal solve(CashFlowSeries series, BigDecimal guess) {
        SolverState state = new SolverState(clamp(guess));

        for (int i = 0; i < config.getMaxIterations(); i++) {
            evaluate(series, state);
            BigDecimal rate = state.getRate();
            BigDecimal npv = state.getResidual();
            BigDecimal dnpv = state.getDerivative();

            if (npv.abs().compareTo(config.getTolerance()) < 0) {
                log.debug("{} converged to {} after {} iterations", config.getName(), rate, i);
                return rate;
            }
            if (dnpv.signum() == 0) {
                throw new ConvergenceException(config.getName(), i, npv, rate);
            }

            BigDecimal next = rate.subtract(npv.divide(dnpv, mc), mc);
            if (config.getStepTolerance() != null
                    && next.subtract(rate, mc).abs().compareTo(config.getStepTolerance()) < 0) {
                log.debug("{} step converged to {} after {} iterations", config.getName(), next, i + 1);
                return next;
            }
            state.step(clamp(next));
        }

        evaluate(series, state);
        throw new ConvergenceException(config.getName(), config.getMaxIterations(), state.getResidual(),
                state.getRate());
    }

    /** NPV of the series at {@code rate}. */
    public BigDecimal npv(CashFlowSeries series, BigDecimal rate) {
        SolverState state = new SolverState(rate);
        evaluate(series, state);
        return state.getResidual();
    }

    private void evaluate(CashFlowSeries series, SolverState state) {
        BigDecimal onePlusR = ONE.add(state.getRate(), mc);
        BigDecimal npv = ZERO;
        BigDecimal dnpv = ZERO;

        BigDecimal wholeFactor = ONE; // (1+r)^periods
        long periods = 0;
        BigDecimal lastFraction = null;
        BigDecimal fractionFactor = ONE;

        for (CashFlow cf : series.flows()) {
            BigDecimal t = cf.time();
            long whole = t.setScale(0, RoundingMode.FLOOR).longValueExact();
            while (periods < whole) {
                wholeFactor = wholeFactor.multiply(onePlusR, mc);
                periods++;
            }

            BigDecimal discount = wholeFactor;
            BigDecimal fraction = t.subtract(BigDecimal.valueOf(whole));
            if (fraction.signum() != 0) {
                if (lastFraction == null || lastFraction.compareTo(fraction) != 0) {
                    lastFraction = fraction;
                    fractionFactor = stubFactor(state.getRate(), onePlusR, fraction);
                }
                discount = wholeFactor.multiply(fractionFactor, mc);
            }

            npv = npv.add(cf.amount().divide(discount, mc), mc);
            if (t.signum() > 0) {
                BigDecimal slope = t.multiply(cf.amount(), mc).divide(discount.multiply(onePlusR, mc), mc);
                dnpv = dnpv.subtract(slope, mc);
            }
        }
        state.evaluated(npv, dnpv);
    }

    /** (1+r)^frac for 0 &lt; frac &lt; 1. */
    private BigDecimal stubFactor(BigDecimal rate, BigDecimal onePlusR, BigDecimal fraction) {
        if (rate.abs().compareTo(BINOMIAL_RADIUS) < 0)
            return math.powFraction(onePlusR, fraction);
        return math.exp(fraction.multiply(math.ln(onePlusR), mc));
    }

    private BigDecimal clamp(BigDecimal rate) {
        return Decimals.clamp(rate, config.getLowerBound(), config.getUpperBound());
    }
}
