package com.trading.fincalc.fn.finance;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import com.trading.fincalc.DecimalKernel;
import com.trading.fincalc.error.ConvergenceException;
import com.trading.fincalc.fn.AbstractCalculator;
import com.trading.fincalc.solver.CashFlowRootFinder;
import com.trading.fincalc.solver.CashFlowSeries;
import com.trading.fincalc.solver.SolverConfig;

/**
 * Unlevered and levered IRR of a held property, plus the equity multiple.
 *
 * <pre>
 * unlevered: -price, NOI_1, ..., NOI_N + exit
 * levered:   -equity, NOI_1 - DS, ..., NOI_N - DS + exit - loan balance
 * </pre>
 *
 * When the solver fails the last iterate is reported with a warning.
 */
public final class PropertyReturns extends AbstractCalculator<PropertyReturns.Input, PropertyReturns.Output> {
    private static final BigDecimal GUESS = new BigDecimal("0.10");
    private static final BigDecimal MIN_DSCR = new BigDecimal("1.20");

    /**
     * @param leverage Financing terms, or null for an all-equity purchase.
     */
    public record Input(BigDecimal purchasePrice, List<BigDecimal> netOperatingIncome, BigDecimal exitValue,
            Leverage leverage) {
    }

    /**
     * @param equity            Equity cheque at purchase.
     * @param annualDebtService Interest plus amortization per year.
     * @param loanBalanceAtExit Outstanding principal repaid from sale proceeds.
     */
    public record Leverage(BigDecimal equity, BigDecimal annualDebtService, BigDecimal loanBalanceAtExit) {
    }

    /**
     * @param leveredIrr     Null without leverage.
     * @param equityMultiple Total distributions over the equity invested.
     */
    public record Output(BigDecimal unleveredIrr, BigDecimal leveredIrr, BigDecimal equityMultiple) {
    }

    private final CashFlowRootFinder solver;

    public PropertyReturns(DecimalKernel kernel) {
        this(kernel, SolverConfig.realEstate());
    }

    public PropertyReturns(DecimalKernel kernel, SolverConfig config) {
        super(kernel);
        this.solver = kernel.rootFinder(config);
    }

    @Override
    protected String methodology() {
        return "Property IRR (Newton-Raphson on annual cash flows)";
    }

    @Override
    protected void validate(Input in) {
        require(in.purchasePrice() != null && in.purchasePrice().signum() > 0, "purchasePrice must be positive");
        require(in.netOperatingIncome() != null && !in.netOperatingIncome().isEmpty(),
                "At least one year of NOI required");
        for (BigDecimal noi : in.netOperatingIncome())
            require(noi != null, "NOI entries must not be null");
        require(in.exitValue() != null && in.exitValue().signum() >= 0, "exitValue must be >= 0");
        Leverage lev = in.leverage();
        if (lev != null) {
            require(lev.equity() != null && lev.equity().signum() > 0, "equity must be positive");
            require(lev.annualDebtService() != null && lev.annualDebtService().signum() >= 0,
                    "annualDebtService must be >= 0");
            require(lev.loanBalanceAtExit() != null && lev.loanBalanceAtExit().signum() >= 0,
                    "loanBalanceAtExit must be >= 0");
        }
    }

    @Override
    protected Output calculate(Input in, List<String> warnings) {
        List<BigDecimal> noi = in.netOperatingIncome();
        int n = noi.size();

        // 1. Unlevered
        List<BigDecimal> unlevered = new ArrayList<>(n + 1);
        unlevered.add(in.purchasePrice().negate());
        for (int i = 0; i < n; i++)
            unlevered.add(i == n - 1 ? noi.get(i).add(in.exitValue(), mc) : noi.get(i));
        BigDecimal irr = solve(unlevered, "IRR", warnings);

        Leverage lev = in.leverage();
        if (lev == null) {
            return new Output(irr, null, multiple(unlevered, in.purchasePrice()));
        }

        // 2. Levered
        List<BigDecimal> levered = new ArrayList<>(n + 1);
        levered.add(lev.equity().negate());
        for (int i = 0; i < n; i++) {
            BigDecimal cf = noi.get(i).subtract(lev.annualDebtService(), mc);
            if (i == n - 1)
                cf = cf.add(in.exitValue(), mc).subtract(lev.loanBalanceAtExit(), mc);
            levered.add(cf);
        }
        BigDecimal leveredIrr = solve(levered, "Levered IRR", warnings);

        if (lev.annualDebtService().signum() > 0) {
            BigDecimal dscr = noi.get(0).divide(lev.annualDebtService(), mc);
            if (dscr.signum() > 0 && dscr.compareTo(MIN_DSCR) < 0) {
                warnings.add("DSCR of " + dscr.setScale(2, RoundingMode.HALF_UP).toPlainString()
                        + "x is below 1.20x, lender covenant risk");
            }
        }
        return new Output(irr, leveredIrr, multiple(levered, lev.equity()));
    }

    private BigDecimal solve(List<BigDecimal> amounts, String label, List<String> warnings) {
        try {
            return solver.solve(CashFlowSeries.periodic(amounts), GUESS);
        } catch (ConvergenceException e) {
            warnings.add(label + ": " + e.getMessage() + "; using last iterate");
            return e.getLastRate();
        }
    }

    /** Sum of the distributions after t=0, over the initial outlay. */
    private BigDecimal multiple(List<BigDecimal> flows, BigDecimal outlay) {
        BigDecimal total = BigDecimal.ZERO;
        for (int i = 1; i < flows.size(); i++)
            total = total.add(flows.get(i), mc);
        return total.divide(outlay, mc);
    }
}
