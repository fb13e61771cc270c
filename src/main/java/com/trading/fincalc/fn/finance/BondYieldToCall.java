package com.trading.fincalc.fn.finance;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import com.trading.fincalc.DecimalKernel;
import com.trading.fincalc.error.ConvergenceException;
import com.trading.fincalc.fn.AbstractCalculator;
import com.trading.fincalc.solver.CashFlowRootFinder;
import com.trading.fincalc.solver.CashFlowSeries;
import com.trading.fincalc.solver.SolverConfig;

/**
 * Yield to call of a callable fixed-coupon bond.
 * <p>
 * The dirty price is paid at settlement; the first coupon arrives after the
 * remaining fraction {@code f} of the current period, later coupons every
 * period after that, and the call price with the last coupon:
 *
 * <pre>
 * dirty = sum_k C / (1+y/m)^(f+k-1) + CallPx / (1+y/m)^(f+n-1)
 * </pre>
 *
 * The periodic yield is solved with the {@link SolverConfig#bondYield()} guard
 * rails (band divided by the frequency) and annualized by multiplying with the
 * frequency. When the solver fails the nominal coupon rate is reported instead.
 */
public final class BondYieldToCall extends AbstractCalculator<BondYieldToCall.Input, BondYieldToCall.Output> {
    private static final Set<Integer> FREQUENCIES = Set.of(1, 2, 4, 12);
    private static final BigDecimal ANNUAL_GUESS = new BigDecimal("0.05");

    /**
     * @param dirtyPrice          Price paid including accrued interest.
     * @param faceValue           Par amount coupons accrue on.
     * @param couponRate          Annual coupon rate, e.g. 0.05.
     * @param frequency           Coupons per year: 1, 2, 4 or 12.
     * @param periodsToCall       Coupon dates up to and including the call date.
     * @param firstPeriodFraction Share of the current period still to run, in
     *                            (0, 1].
     * @param callPrice           Redemption amount on the call date.
     */
    public record Input(BigDecimal dirtyPrice, BigDecimal faceValue, BigDecimal couponRate, int frequency,
            int periodsToCall, BigDecimal firstPeriodFraction, BigDecimal callPrice) {
    }

    /**
     * @param yieldToCall   Annualized yield, or the coupon rate when not converged.
     * @param periodicYield Yield per coupon period.
     * @param converged     False when the coupon-rate fallback was used.
     */
    public record Output(BigDecimal yieldToCall, BigDecimal periodicYield, boolean converged) {
    }

    private final SolverConfig solverConfig;

    public BondYieldToCall(DecimalKernel kernel) {
        this(kernel, SolverConfig.bondYield());
    }

    /**
     * @param annualConfig Guard rails expressed in annual terms.
     */
    public BondYieldToCall(DecimalKernel kernel, SolverConfig annualConfig) {
        super(kernel);
        this.solverConfig = annualConfig.validate();
    }

    @Override
    protected String methodology() {
        return "Yield to call (Newton-Raphson on periodic yield)";
    }

    @Override
    protected void validate(Input in) {
        require(in.dirtyPrice() != null && in.dirtyPrice().signum() > 0, "dirtyPrice must be positive");
        require(in.faceValue() != null && in.faceValue().signum() > 0, "faceValue must be positive");
        require(in.couponRate() != null && in.couponRate().signum() >= 0, "couponRate must be >= 0");
        require(FREQUENCIES.contains(in.frequency()),
                "frequency must be one of " + FREQUENCIES + ", got " + in.frequency());
        require(in.periodsToCall() >= 1, "No coupon periods between settlement and call date");
        require(in.firstPeriodFraction() != null && in.firstPeriodFraction().signum() > 0
                && in.firstPeriodFraction().compareTo(BigDecimal.ONE) <= 0,
                "firstPeriodFraction must be in (0, 1], got " + in.firstPeriodFraction());
        require(in.callPrice() != null && in.callPrice().signum() > 0, "callPrice must be positive");
    }

    @Override
    protected Output calculate(Input in, List<String> warnings) {
        BigDecimal freq = BigDecimal.valueOf(in.frequency());
        BigDecimal coupon = in.faceValue().multiply(in.couponRate(), mc).divide(freq, mc);

        // 1. Cash flows in periods from settlement
        CashFlowSeries.Builder flows = CashFlowSeries.builder().add(0, in.dirtyPrice().negate());
        for (int k = 1; k <= in.periodsToCall(); k++) {
            BigDecimal t = in.firstPeriodFraction().add(BigDecimal.valueOf(k - 1));
            BigDecimal amount = k == in.periodsToCall() ? coupon.add(in.callPrice(), mc) : coupon;
            flows.add(t, amount);
        }

        // 2. Solve on the periodic rate
        CashFlowRootFinder solver = kernel.rootFinder(solverConfig
                .withLowerBound(solverConfig.getLowerBound().divide(freq, mc))
                .withUpperBound(solverConfig.getUpperBound().divide(freq, mc)));
        try {
            BigDecimal periodic = solver.solve(flows.build(), ANNUAL_GUESS.divide(freq, mc));
            return new Output(periodic.multiply(freq, mc), periodic, true);
        } catch (ConvergenceException e) {
            warnings.add("YTC: " + e.getMessage() + "; using coupon rate");
            return new Output(in.couponRate(), in.couponRate().divide(freq, mc), false);
        }
    }
}
