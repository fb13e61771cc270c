package com.trading.fincalc.fn.finance;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.List;

import com.trading.fincalc.DecimalKernel;
import com.trading.fincalc.api.DecimalMath;
import com.trading.fincalc.fn.AbstractCalculator;
import com.trading.fincalc.math.Decimals;

/**
 * Transfer-pricing benchmark of an intercompany transaction.
 * <p>
 * The tested party's operating margin is compared against the interquartile
 * range of the comparables' net margins (percentiles by linear interpolation
 * between order statistics). Outside the range, the recommended adjustment
 * moves the margin to the median. The arm's length price follows the chosen
 * OECD method, and the tax impact is the price gap at the given statutory rate.
 */
public final class ArmsLengthRange extends AbstractCalculator<ArmsLengthRange.Input, ArmsLengthRange.Output> {
    private static final int MIN_COMPARABLES = 5;
    private static final int HIGH_CONFIDENCE_COMPARABLES = 10;
    private static final BigDecimal HIGH_CONFIDENCE_DISPERSION = new BigDecimal("0.05");
    private static final BigDecimal P25 = BigDecimal.valueOf(25);
    private static final BigDecimal P50 = BigDecimal.valueOf(50);
    private static final BigDecimal P75 = BigDecimal.valueOf(75);

    public enum PricingMethod {
        CUP("Comparable Uncontrolled Price: controlled price against uncontrolled comparables"),
        RPM("Resale Price Method: resale price less the comparables' gross margin"),
        CPLM("Cost Plus Method: costs plus the comparables' markup"),
        TNMM("Transactional Net Margin Method: net margin against the comparables' PLI"),
        PROFIT_SPLIT("Profit Split Method: residual allocation after routine returns");

        private final String description;

        PricingMethod(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    public enum Direction {
        INCREASE,
        DECREASE,
        NONE
    }

    public enum Confidence {
        HIGH,
        MEDIUM,
        LOW
    }

    public record TestedParty(String name, BigDecimal operatingRevenue, BigDecimal operatingCosts,
            BigDecimal operatingProfit, BigDecimal assets) {
    }

    public record ComparableCompany(String name, BigDecimal netMargin) {
    }

    /**
     * @param statutoryTaxRate Tax rate of the tested party's jurisdiction, used
     *                         for the tax impact estimate.
     */
    public record Input(String transactionName, PricingMethod method, TestedParty testedParty,
            List<ComparableCompany> comparables, BigDecimal transactionValue, BigDecimal statutoryTaxRate) {
    }

    /** Profit level indicators of the tested party. */
    public record Indicators(BigDecimal operatingMargin, BigDecimal grossMargin, BigDecimal berryRatio,
            BigDecimal returnOnAssets) {
    }

    public record Range(int count, BigDecimal p25, BigDecimal median, BigDecimal p75, BigDecimal mean,
            BigDecimal stdDev) {
    }

    /**
     * @param adjustment   Median less the tested margin when outside the range,
     *                     otherwise 0.
     * @param deviationPct Transaction value against the arm's length price, in
     *                     percent.
     */
    public record Output(Indicators indicators, Range range, boolean withinRange, BigDecimal adjustment,
            Direction direction, Confidence confidence, String methodDescription, BigDecimal armsLengthPrice,
            BigDecimal deviationPct, BigDecimal taxImpact) {
    }

    private final DecimalMath math;

    public ArmsLengthRange(DecimalKernel kernel) {
        super(kernel);
        this.math = kernel.math();
    }

    @Override
    protected String methodology() {
        return "OECD arm's length range (interquartile benchmark)";
    }

    @Override
    protected void validate(Input in) {
        require(in.method() != null, "method is required");
        require(in.testedParty() != null, "testedParty is required");
        require(in.comparables() != null && !in.comparables().isEmpty(), "At least one comparable is required");
        requireNonNegative("transactionValue", in.transactionValue());
        requireNonNegative("testedParty.operatingRevenue", in.testedParty().operatingRevenue());
        requireNonNegative("testedParty.operatingCosts", in.testedParty().operatingCosts());
        requireNonNegative("testedParty.assets", in.testedParty().assets());
        require(in.testedParty().operatingProfit() != null, "testedParty.operatingProfit is required");
        require(in.statutoryTaxRate() != null && in.statutoryTaxRate().signum() >= 0
                && in.statutoryTaxRate().compareTo(BigDecimal.ONE) <= 0, "statutoryTaxRate must be in [0, 1]");
        for (int i = 0; i < in.comparables().size(); i++)
            require(in.comparables().get(i).netMargin() != null, "comparables[" + i + "].netMargin is required");
    }

    @Override
    protected Output calculate(Input in, List<String> warnings) {
        TestedParty tp = in.testedParty();
        Indicators indicators = indicators(tp);
        Range range = range(in.comparables());
        if (range.count() < MIN_COMPARABLES)
            warnings.add("Only " + range.count() + " comparables, a robust interquartile range needs 5 to 10");

        BigDecimal margin = indicators.operatingMargin();
        boolean within = margin.compareTo(range.p25()) >= 0 && margin.compareTo(range.p75()) <= 0;
        BigDecimal adjustment = within ? BigDecimal.ZERO : range.median().subtract(margin, mc);
        Direction direction = switch (adjustment.signum()) {
            case 1 -> Direction.INCREASE;
            case -1 -> Direction.DECREASE;
            default -> Direction.NONE;
        };
        if (!within) {
            warnings.add("Tested party margin (" + margin.toPlainString() + ") is outside the interquartile range ["
                    + range.p25().toPlainString() + ", " + range.p75().toPlainString() + "], adjust to the median ("
                    + range.median().toPlainString() + ")");
        }

        Confidence confidence;
        if (range.count() >= HIGH_CONFIDENCE_COMPARABLES && range.stdDev().compareTo(HIGH_CONFIDENCE_DISPERSION) < 0)
            confidence = Confidence.HIGH;
        else if (range.count() >= MIN_COMPARABLES)
            confidence = Confidence.MEDIUM;
        else
            confidence = Confidence.LOW;

        BigDecimal price = armsLengthPrice(in.method(), tp, range.median(), in.transactionValue());
        BigDecimal gap = in.transactionValue().subtract(price, mc);
        BigDecimal deviation = price.signum() > 0
                ? gap.divide(price, mc).multiply(Decimals.HUNDRED, mc)
                : BigDecimal.ZERO;

        return new Output(indicators, range, within, adjustment, direction, confidence,
                in.method().description(), price, deviation, gap.abs().multiply(in.statutoryTaxRate(), mc));
    }

    private Indicators indicators(TestedParty tp) {
        BigDecimal revenue = tp.operatingRevenue();
        BigDecimal grossProfit = revenue.subtract(tp.operatingCosts(), mc).add(tp.operatingProfit(), mc);
        return new Indicators(ratio(tp.operatingProfit(), revenue), ratio(grossProfit, revenue),
                ratio(grossProfit, tp.operatingCosts()), ratio(tp.operatingProfit(), tp.assets()));
    }

    private Range range(List<ComparableCompany> comparables) {
        int n = comparables.size();
        BigDecimal[] margins = new BigDecimal[n];
        for (int i = 0; i < n; i++)
            margins[i] = comparables.get(i).netMargin();
        Arrays.sort(margins);

        BigDecimal mean = Decimals.sum(margins, mc).divide(BigDecimal.valueOf(n), mc);
        BigDecimal variance = BigDecimal.ZERO;
        if (n > 1) {
            for (BigDecimal m : margins) {
                BigDecimal d = m.subtract(mean, mc);
                variance = variance.add(d.multiply(d, mc), mc);
            }
            variance = variance.divide(BigDecimal.valueOf(n - 1L), mc);
        }
        return new Range(n, percentile(margins, P25), percentile(margins, P50), percentile(margins, P75), mean,
                math.sqrt(variance));
    }

    /** Linear interpolation at rank {@code p/100 * (n - 1)} of sorted values. */
    private BigDecimal percentile(BigDecimal[] sorted, BigDecimal p) {
        int n = sorted.length;
        if (n == 1)
            return sorted[0];
        BigDecimal rank = p.divide(Decimals.HUNDRED, mc).multiply(BigDecimal.valueOf(n - 1L), mc);
        int lower = Math.min(rank.setScale(0, RoundingMode.FLOOR).intValueExact(), n - 1);
        int upper = Math.min(lower + 1, n - 1);
        BigDecimal fraction = rank.subtract(BigDecimal.valueOf(lower), mc);
        return sorted[lower].add(fraction.multiply(sorted[upper].subtract(sorted[lower], mc), mc), mc);
    }

    private BigDecimal armsLengthPrice(PricingMethod method, TestedParty tp, BigDecimal median,
            BigDecimal transactionValue) {
        BigDecimal revenue = tp.operatingRevenue();
        return switch (method) {
            case CUP -> revenue.signum() > 0
                    ? transactionValue.multiply(BigDecimal.ONE.add(median, mc), mc)
                            .divide(BigDecimal.ONE.add(tp.operatingProfit().divide(revenue, mc), mc), mc)
                    : transactionValue;
            case RPM -> transactionValue.multiply(BigDecimal.ONE.subtract(median, mc), mc);
            case CPLM, PROFIT_SPLIT -> tp.operatingCosts().multiply(BigDecimal.ONE.add(median, mc), mc);
            case TNMM -> revenue.signum() > 0
                    ? tp.operatingCosts().add(revenue.multiply(median, mc), mc)
                    : transactionValue;
        };
    }

    private BigDecimal ratio(BigDecimal numerator, BigDecimal denominator) {
        return denominator.signum() > 0 ? numerator.divide(denominator, mc) : BigDecimal.ZERO;
    }

    private static void requireNonNegative(String field, BigDecimal value) {
        require(value != null && value.signum() >= 0, field + " must be >= 0");
    }
}
