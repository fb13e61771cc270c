package com.trading.fincalc.fn.finance;

import java.math.BigDecimal;
import java.util.List;

import com.trading.fincalc.DecimalKernel;
import com.trading.fincalc.error.ConvergenceException;
import com.trading.fincalc.fn.AbstractCalculator;
import com.trading.fincalc.solver.CashFlowRootFinder;
import com.trading.fincalc.solver.CashFlowSeries;
import com.trading.fincalc.solver.SolverConfig;

/**
 * Lender's yield on a private-credit tranche, to maturity and optionally to a
 * call date.
 * <p>
 * Cash flows, annual:
 * <ul>
 * <li>t=0: {@code -(P * (1 - OID) - P * fee)}</li>
 * <li>t=1..N: {@code P * coupon}</li>
 * <li>t=N: also {@code P}, or {@code P * (1 + premium)} when called</li>
 * </ul>
 * The coupon rate seeds the solver and is the fallback when it fails.
 */
public final class TrancheYield extends AbstractCalculator<TrancheYield.Input, TrancheYield.Output> {

    /**
     * @param callYear       Year the tranche is assumed called, or null.
     * @param callPremiumPct Premium over par paid on call; ignored without a
     *                       call year.
     */
    public record Input(BigDecimal principal, BigDecimal couponRate, BigDecimal oidPct, BigDecimal upfrontFeePct,
            int maturityYears, Integer callYear, BigDecimal callPremiumPct) {
    }

    /**
     * @param netFunding      Amount the lender actually funds at close.
     * @param yieldToMaturity Annual yield held to maturity.
     * @param yieldToCall     Annual yield if called, null without a call year.
     */
    public record Output(BigDecimal netFunding, BigDecimal yieldToMaturity, BigDecimal yieldToCall) {
    }

    private final CashFlowRootFinder solver;

    public TrancheYield(DecimalKernel kernel) {
        this(kernel, SolverConfig.privateCredit());
    }

    public TrancheYield(DecimalKernel kernel, SolverConfig config) {
        super(kernel);
        this.solver = kernel.rootFinder(config);
    }

    @Override
    protected String methodology() {
        return "Tranche yield (Newton-Raphson IRR on lender cash flows)";
    }

    @Override
    protected void validate(Input in) {
        require(in.principal() != null && in.principal().signum() > 0, "principal must be positive");
        require(in.couponRate() != null && in.couponRate().signum() >= 0, "couponRate must be >= 0");
        requireFraction("oidPct", in.oidPct());
        requireFraction("upfrontFeePct", in.upfrontFeePct());
        require(in.oidPct().add(in.upfrontFeePct()).compareTo(BigDecimal.ONE) < 0,
                "oidPct + upfrontFeePct must be < 1 so the lender funds a positive amount");
        require(in.maturityYears() >= 1, "maturityYears must be >= 1, got " + in.maturityYears());
        if (in.callYear() != null) {
            require(in.callYear() >= 1 && in.callYear() <= in.maturityYears(),
                    "callYear must be in [1, maturityYears], got " + in.callYear());
            require(in.callPremiumPct() != null && in.callPremiumPct().signum() >= 0,
                    "callPremiumPct must be >= 0");
        }
    }

    @Override
    protected Output calculate(Input in, List<String> warnings) {
        BigDecimal p = in.principal();
        BigDecimal netFunding = p.multiply(BigDecimal.ONE.subtract(in.oidPct()), mc)
                .subtract(p.multiply(in.upfrontFeePct(), mc), mc);

        BigDecimal ytm = solve(netFunding, in, in.maturityYears(), p, "YTM", warnings);

        BigDecimal ytc = null;
        if (in.callYear() != null) {
            BigDecimal redemption = p.multiply(BigDecimal.ONE.add(in.callPremiumPct()), mc);
            ytc = solve(netFunding, in, in.callYear(), redemption, "Yield to call", warnings);
        }
        return new Output(netFunding, ytm, ytc);
    }

    private BigDecimal solve(BigDecimal netFunding, Input in, int years, BigDecimal redemption, String label,
            List<String> warnings) {
        BigDecimal coupon = in.principal().multiply(in.couponRate(), mc);
        BigDecimal[] amounts = new BigDecimal[years + 1];
        amounts[0] = netFunding.negate();
        for (int t = 1; t <= years; t++)
            amounts[t] = t == years ? coupon.add(redemption, mc) : coupon;

        try {
            return solver.solve(CashFlowSeries.periodic(amounts), in.couponRate());
        } catch (ConvergenceException e) {
            warnings.add(label + ": Newton-Raphson did not converge; using coupon rate");
            return in.couponRate();
        }
    }

    private static void requireFraction(String field, BigDecimal value) {
        require(value != null && value.signum() >= 0 && value.compareTo(BigDecimal.ONE) < 0,
                field + " must be in [0, 1), got " + value);
    }
}
