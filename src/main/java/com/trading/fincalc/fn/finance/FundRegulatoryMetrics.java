package com.trading.fincalc.fn.finance;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import com.trading.fincalc.DecimalKernel;
import com.trading.fincalc.api.DecimalMath;
import com.trading.fincalc.fn.AbstractCalculator;
import com.trading.fincalc.math.Decimals;

/**
 * Numeric part of the SEC Form PF and CFTC CPO-PQR filings for a private fund
 * adviser.
 * <p>
 * Regulatory AUM is the sum of gross assets. The Form PF filing type follows
 * the adviser's reported AUM and the per-type large-adviser thresholds
 * (hedge funds $1.5bn, private equity $2bn, liquidity funds $1bn). Each fund
 * gets a geometric annualized return, a peak-to-trough drawdown and a Sharpe
 * ratio at a zero risk-free rate, all from its monthly returns. Counterparty
 * concentration is a Herfindahl index on a 0 to 10,000 scale.
 */
public final class FundRegulatoryMetrics
        extends AbstractCalculator<FundRegulatoryMetrics.Input, FundRegulatoryMetrics.Output> {
    private static final BigDecimal SMALL_ADVISER_AUM = new BigDecimal("150000000");
    private static final BigDecimal LARGE_HEDGE_FUND_AUM = new BigDecimal("1500000000");
    private static final BigDecimal LARGE_PE_AUM = new BigDecimal("2000000000");
    private static final BigDecimal LARGE_LIQUIDITY_AUM = new BigDecimal("1000000000");
    private static final BigDecimal LARGE_CPO_AUM = new BigDecimal("1500000000");
    private static final BigDecimal LARGE_POOL = new BigDecimal("500000000");
    private static final BigDecimal LEVERAGE_LIMIT = Decimals.TWO;
    private static final BigDecimal HHI_LIMIT = new BigDecimal("2500");
    private static final BigDecimal AUM_MISMATCH = new BigDecimal("0.1");
    private static final BigDecimal TWELVE = BigDecimal.valueOf(12);

    public enum FilingType {
        LARGE,
        SMALL,
        EXEMPT
    }

    public enum FilingFrequency {
        QUARTERLY,
        ANNUAL,
        EXEMPT
    }

    /**
     * @param grossAssets    Sum of absolute long and short positions.
     * @param monthlyReturns Monthly returns as fractions, oldest first.
     */
    public record Fund(String name, BigDecimal nav, BigDecimal grossAssets, boolean hedgeFund,
            boolean privateEquityFund, boolean liquidityFund, BigDecimal totalBorrowings,
            BigDecimal securedBorrowings, List<BigDecimal> monthlyReturns) {
    }

    public record Counterparty(String name, BigDecimal exposure) {
    }

    /**
     * @param reportedRegulatoryAum AUM the adviser reports; drives the filing
     *                              thresholds.
     * @param commodityPool         Whether the adviser operates a commodity pool.
     */
    public record Input(String adviserName, boolean secRegistered, boolean nfaRegistered, boolean commodityPool,
            BigDecimal reportedRegulatoryAum, List<Fund> funds, List<Counterparty> counterparties) {
    }

    public record FundPerformance(String fundName, BigDecimal annualizedReturn, BigDecimal maxDrawdown,
            BigDecimal sharpeRatio, int monthCount, BigDecimal borrowingRatio) {
    }

    /**
     * @param filingDeadlineDays Days after the reporting date: 60 for large
     *                           filers, 120 for small, 0 when exempt.
     * @param counterpartyHhi    Herfindahl index of counterparty exposure shares
     *                           in percent, 0 to 10,000.
     */
    public record Output(FilingType formPfType, List<String> formPfSections, FilingFrequency filingFrequency,
            int filingDeadlineDays, FilingType cpoPqrType, BigDecimal regulatoryAum, BigDecimal hedgeFundAum,
            BigDecimal privateEquityAum, BigDecimal liquidityFundAum, BigDecimal totalNav,
            BigDecimal totalBorrowingRatio, BigDecimal securedBorrowingRatio, BigDecimal unsecuredBorrowingRatio,
            BigDecimal counterpartyHhi, List<FundPerformance> performances) {
    }

    private final DecimalMath math;

    public FundRegulatoryMetrics(DecimalKernel kernel) {
        super(kernel);
        this.math = kernel.math();
    }

    @Override
    protected String methodology() {
        return "SEC Form PF / CFTC CPO-PQR thresholds, geometric returns, HHI";
    }

    @Override
    protected void validate(Input in) {
        require(in.adviserName() != null && !in.adviserName().isEmpty(), "adviserName is required");
        require(in.reportedRegulatoryAum() != null && in.reportedRegulatoryAum().signum() >= 0,
                "reportedRegulatoryAum must be >= 0");
        require(in.funds() != null, "funds is required");
        for (int i = 0; i < in.funds().size(); i++) {
            Fund f = in.funds().get(i);
            requireNonNegative("funds[" + i + "].nav", f.nav());
            requireNonNegative("funds[" + i + "].grossAssets", f.grossAssets());
            requireNonNegative("funds[" + i + "].totalBorrowings", f.totalBorrowings());
            requireNonNegative("funds[" + i + "].securedBorrowings", f.securedBorrowings());
        }
        if (in.counterparties() != null) {
            for (int i = 0; i < in.counterparties().size(); i++)
                requireNonNegative("counterparties[" + i + "].exposure", in.counterparties().get(i).exposure());
        }
    }

    @Override
    protected Output calculate(Input in, List<String> warnings) {
        List<Fund> funds = in.funds();
        BigDecimal reported = in.reportedRegulatoryAum();

        // 1. AUM by fund type
        BigDecimal aum = BigDecimal.ZERO;
        BigDecimal hedge = BigDecimal.ZERO;
        BigDecimal pe = BigDecimal.ZERO;
        BigDecimal liquidity = BigDecimal.ZERO;
        boolean largePool = false;
        for (Fund f : funds) {
            aum = aum.add(f.grossAssets(), mc);
            if (f.hedgeFund())
                hedge = hedge.add(f.grossAssets(), mc);
            if (f.privateEquityFund())
                pe = pe.add(f.grossAssets(), mc);
            if (f.liquidityFund())
                liquidity = liquidity.add(f.grossAssets(), mc);
            largePool |= f.grossAssets().compareTo(LARGE_POOL) > 0;
            if (f.securedBorrowings().compareTo(f.totalBorrowings()) > 0)
                warnings.add("Fund '" + f.name() + "' reports secured borrowings above total borrowings");
        }
        if (aum.signum() > 0 && aum.subtract(reported, mc).abs().compareTo(reported.multiply(AUM_MISMATCH, mc)) > 0)
            warnings.add("Calculated regulatory AUM (" + aum.toPlainString() + ") differs from reported ("
                    + reported.toPlainString() + ") by >10%");

        // 2. Filing requirements
        FilingType formPf = formPfType(in.secRegistered(), reported, hedge, pe, liquidity);
        List<String> sections = new ArrayList<>();
        if (formPf != FilingType.EXEMPT) {
            sections.add("Section 1 - Basic Information");
            if (hedge.compareTo(LARGE_HEDGE_FUND_AUM) >= 0)
                sections.add("Section 2 - Large Hedge Fund Adviser");
            if (liquidity.compareTo(LARGE_LIQUIDITY_AUM) >= 0)
                sections.add("Section 3 - Large Liquidity Fund Adviser");
            if (pe.compareTo(LARGE_PE_AUM) >= 0)
                sections.add("Section 4 - Large Private Equity Adviser");
        }
        FilingFrequency frequency = switch (formPf) {
            case LARGE -> FilingFrequency.QUARTERLY;
            case SMALL -> FilingFrequency.ANNUAL;
            case EXEMPT -> FilingFrequency.EXEMPT;
        };
        int deadlineDays = switch (formPf) {
            case LARGE -> 60;
            case SMALL -> 120;
            case EXEMPT -> 0;
        };
        FilingType cpoPqr;
        if (!in.nfaRegistered() || !in.commodityPool())
            cpoPqr = FilingType.EXEMPT;
        else if (reported.compareTo(LARGE_CPO_AUM) > 0 || largePool)
            cpoPqr = FilingType.LARGE;
        else
            cpoPqr = FilingType.SMALL;

        // 3. Borrowings against NAV
        BigDecimal nav = BigDecimal.ZERO;
        BigDecimal borrowings = BigDecimal.ZERO;
        BigDecimal secured = BigDecimal.ZERO;
        for (Fund f : funds) {
            nav = nav.add(f.nav(), mc);
            borrowings = borrowings.add(f.totalBorrowings(), mc);
            secured = secured.add(f.securedBorrowings(), mc);
        }
        BigDecimal totalRatio = ratio(borrowings, nav);
        if (totalRatio.compareTo(LEVERAGE_LIMIT) > 0)
            warnings.add("Total borrowing ratio (" + totalRatio.toPlainString() + ") exceeds 2x NAV, high leverage");

        // 4. Counterparty concentration
        BigDecimal hhi = counterpartyHhi(in.counterparties());
        if (hhi.compareTo(HHI_LIMIT) > 0)
            warnings.add("Counterparty HHI (" + hhi.toPlainString() + ") indicates high concentration (>2500)");

        // 5. Per-fund performance
        List<FundPerformance> performances = new ArrayList<>(funds.size());
        for (Fund f : funds) {
            List<BigDecimal> returns = f.monthlyReturns() == null ? List.of() : f.monthlyReturns();
            performances.add(new FundPerformance(f.name(), annualizedReturn(returns), maxDrawdown(returns),
                    sharpeRatio(returns), returns.size(), ratio(f.totalBorrowings(), f.nav())));
        }

        return new Output(formPf, List.copyOf(sections), frequency, deadlineDays, cpoPqr, aum, hedge, pe, liquidity,
                nav, totalRatio, ratio(secured, nav), ratio(borrowings.subtract(secured, mc), nav), hhi,
                List.copyOf(performances));
    }

    private static FilingType formPfType(boolean secRegistered, BigDecimal reported, BigDecimal hedge,
            BigDecimal pe, BigDecimal liquidity) {
        if (!secRegistered || reported.compareTo(SMALL_ADVISER_AUM) < 0)
            return FilingType.EXEMPT;
        if (hedge.compareTo(LARGE_HEDGE_FUND_AUM) >= 0 || pe.compareTo(LARGE_PE_AUM) >= 0
                || liquidity.compareTo(LARGE_LIQUIDITY_AUM) >= 0)
            return FilingType.LARGE;
        return FilingType.SMALL;
    }

    private BigDecimal counterpartyHhi(List<Counterparty> counterparties) {
        if (counterparties == null)
            return BigDecimal.ZERO;
        BigDecimal total = BigDecimal.ZERO;
        for (Counterparty c : counterparties)
            total = total.add(c.exposure(), mc);
        if (total.signum() == 0)
            return BigDecimal.ZERO;
        BigDecimal hhi = BigDecimal.ZERO;
        for (Counterparty c : counterparties) {
            BigDecimal share = c.exposure().multiply(Decimals.HUNDRED, mc).divide(total, mc);
            hhi = hhi.add(share.multiply(share, mc), mc);
        }
        return hhi;
    }

    /** {@code exp(12/n * ln(prod(1 + r))) - 1}; 0 when the fund has lost everything. */
    BigDecimal annualizedReturn(List<BigDecimal> returns) {
        if (returns.isEmpty())
            return BigDecimal.ZERO;
        BigDecimal cumulative = BigDecimal.ONE;
        for (BigDecimal r : returns)
            cumulative = cumulative.multiply(BigDecimal.ONE.add(r, mc), mc);
        if (cumulative.signum() <= 0)
            return BigDecimal.ZERO;
        BigDecimal factor = TWELVE.divide(BigDecimal.valueOf(returns.size()), mc);
        return math.exp(factor.multiply(math.ln(cumulative), mc)).subtract(BigDecimal.ONE, mc);
    }

    BigDecimal maxDrawdown(List<BigDecimal> returns) {
        BigDecimal peak = BigDecimal.ONE;
        BigDecimal cumulative = BigDecimal.ONE;
        BigDecimal worst = BigDecimal.ZERO;
        for (BigDecimal r : returns) {
            cumulative = cumulative.multiply(BigDecimal.ONE.add(r, mc), mc);
            peak = peak.max(cumulative);
            if (peak.signum() > 0)
                worst = worst.max(peak.subtract(cumulative, mc).divide(peak, mc));
        }
        return worst;
    }

    /** Annualized mean over annualized sample deviation; 0 below two months or with no dispersion. */
    BigDecimal sharpeRatio(List<BigDecimal> returns) {
        int n = returns.size();
        if (n < 2)
            return BigDecimal.ZERO;
        BigDecimal mean = BigDecimal.ZERO;
        for (BigDecimal r : returns)
            mean = mean.add(r, mc);
        mean = mean.divide(BigDecimal.valueOf(n), mc);
        BigDecimal variance = BigDecimal.ZERO;
        for (BigDecimal r : returns) {
            BigDecimal d = r.subtract(mean, mc);
            variance = variance.add(d.multiply(d, mc), mc);
        }
        variance = variance.divide(BigDecimal.valueOf(n - 1L), mc);
        BigDecimal sd = math.sqrt(variance);
        if (sd.signum() == 0)
            return BigDecimal.ZERO;
        return mean.multiply(TWELVE, mc).divide(sd.multiply(math.sqrt(TWELVE), mc), mc);
    }

    private BigDecimal ratio(BigDecimal numerator, BigDecimal nav) {
        return nav.signum() > 0 ? numerator.divide(nav, mc) : BigDecimal.ZERO;
    }

    private static void requireNonNegative(String field, BigDecimal value) {
        require(value != null && value.signum() >= 0, field + " must be >= 0");
    }
}
