package com.trading.fincalc.fn.finance;

import com.trading.fincalc.DecimalKernel;
import com.trading.fincalc.fn.CalculationResult;
import com.trading.fincalc.math.Decimals;
import org.junit.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class ArmsLengthRangeTest {

    private static final BigDecimal TAX_RATE = new BigDecimal("0.21");

    private final ArmsLengthRange calculator = new ArmsLengthRange(DecimalKernel.standard());

    private static List<ArmsLengthRange.ComparableCompany> comparables(String... margins) {
        List<ArmsLengthRange.ComparableCompany> list = new ArrayList<>();
        for (int i = 0; i < margins.length; i++)
            list.add(new ArmsLengthRange.ComparableCompany("Comp " + i, new BigDecimal(margins[i])));
        return list;
    }

    private static ArmsLengthRange.TestedParty distributor(String profit) {
        return new ArmsLengthRange.TestedParty("Distributor", new BigDecimal("100000000"), new BigDecimal("94000000"),
                new BigDecimal(profit), new BigDecimal("50000000"));
    }

    private CalculationResult<ArmsLengthRange.Output> run(ArmsLengthRange.PricingMethod method, String profit,
            List<ArmsLengthRange.ComparableCompany> comparables) {
        return calculator.apply(new ArmsLengthRange.Input("Goods", method, distributor(profit), comparables,
                new BigDecimal("80000000"), TAX_RATE));
    }

    @Test
    public void testMarginWithinRange() {
        CalculationResult<ArmsLengthRange.Output> result = run(ArmsLengthRange.PricingMethod.TNMM, "6000000",
                comparables("0.04", "0.06", "0.08", "0.05", "0.07", "0.09", "0.03"));
        ArmsLengthRange.Output out = result.value();

        assertEquals(0, out.indicators().operatingMargin().compareTo(new BigDecimal("0.06")));
        assertEquals(0, out.indicators().grossMargin().compareTo(new BigDecimal("0.12")));
        assertEquals(0, out.indicators().returnOnAssets().compareTo(new BigDecimal("0.12")));
        assertTrue(Decimals.closeTo(new BigDecimal("0.1276595744680851063829787"), out.indicators().berryRatio(),
                new BigDecimal("0.0000000000000000000001")));

        ArmsLengthRange.Range range = out.range();
        assertEquals(7, range.count());
        assertEquals(0, range.p25().compareTo(new BigDecimal("0.045")));
        assertEquals(0, range.median().compareTo(new BigDecimal("0.06")));
        assertEquals(0, range.p75().compareTo(new BigDecimal("0.075")));
        assertEquals(0, range.mean().compareTo(new BigDecimal("0.06")));
        // Sample variance 0.0028 / 6
        assertTrue(Decimals.closeTo(new BigDecimal("0.02160246899469286"), range.stdDev(),
                new BigDecimal("0.0000000000001")));

        assertTrue(out.withinRange());
        assertEquals(0, out.adjustment().signum());
        assertEquals(ArmsLengthRange.Direction.NONE, out.direction());
        assertEquals(ArmsLengthRange.Confidence.MEDIUM, out.confidence());

        // TNMM: costs plus revenue at the median margin
        assertEquals(0, out.armsLengthPrice().compareTo(new BigDecimal("100000000")));
        assertEquals(0, out.deviationPct().compareTo(new BigDecimal("-20")));
        assertEquals(0, out.taxImpact().compareTo(new BigDecimal("4200000")));
        assertFalse(result.hasWarnings());
    }

    @Test
    public void testMarginBelowRangeNeedsIncrease() {
        CalculationResult<ArmsLengthRange.Output> result = run(ArmsLengthRange.PricingMethod.CPLM, "1000000",
                comparables("0.04", "0.06", "0.08", "0.05", "0.07", "0.09", "0.03"));
        ArmsLengthRange.Output out = result.value();

        assertFalse(out.withinRange());
        assertEquals(0, out.adjustment().compareTo(new BigDecimal("0.05")));
        assertEquals(ArmsLengthRange.Direction.INCREASE, out.direction());
        assertEquals(0, out.armsLengthPrice().compareTo(new BigDecimal("99640000")));
        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).contains("outside the interquartile range"));
    }

    @Test
    public void testMethodsAndConfidence() {
        ArmsLengthRange.Output rpm = run(ArmsLengthRange.PricingMethod.RPM, "6000000",
                comparables("0.04", "0.06", "0.08", "0.05", "0.07", "0.09", "0.03")).value();
        assertEquals(0, rpm.armsLengthPrice().compareTo(new BigDecimal("75200000")));
        assertTrue(rpm.methodDescription().startsWith("Resale Price Method"));

        // Ten tightly clustered comparables
        ArmsLengthRange.Output tight = run(ArmsLengthRange.PricingMethod.PROFIT_SPLIT, "6000000",
                comparables("0.055", "0.056", "0.057", "0.058", "0.059", "0.060", "0.061", "0.062", "0.063",
                        "0.064")).value();
        assertEquals(ArmsLengthRange.Confidence.HIGH, tight.confidence());

        CalculationResult<ArmsLengthRange.Output> few = run(ArmsLengthRange.PricingMethod.CUP, "6000000",
                comparables("0.05", "0.06", "0.07"));
        assertEquals(ArmsLengthRange.Confidence.LOW, few.value().confidence());
        assertTrue(few.warnings().get(0).startsWith("Only 3 comparables"));
        // CUP scales the price by (1 + median) / (1 + tested margin), both 6%
        assertEquals(0, few.value().armsLengthPrice().compareTo(new BigDecimal("80000000")));

        ArmsLengthRange.Output single = run(ArmsLengthRange.PricingMethod.TNMM, "6000000", comparables("0.05"))
                .value();
        assertEquals(0, single.range().stdDev().signum());
        assertEquals(0, single.range().p75().compareTo(new BigDecimal("0.05")));
    }

    @Test
    public void testInvalidInput() {
        try {
            run(ArmsLengthRange.PricingMethod.TNMM, "6000000", List.of());
            fail("Should require comparables");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("comparable"));
        }

        try {
            calculator.apply(new ArmsLengthRange.Input("Goods", ArmsLengthRange.PricingMethod.TNMM,
                    distributor("6000000"), comparables("0.05"), new BigDecimal("-1"), TAX_RATE));
            fail("Should reject a negative transaction value");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("transactionValue"));
        }
    }
}
