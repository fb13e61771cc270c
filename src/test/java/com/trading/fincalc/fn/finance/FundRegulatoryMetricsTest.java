package com.trading.fincalc.fn.finance;

import com.trading.fincalc.DecimalKernel;
import com.trading.fincalc.fn.CalculationResult;
import com.trading.fincalc.math.Decimals;
import org.junit.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class FundRegulatoryMetricsTest {

    private final FundRegulatoryMetrics calculator = new FundRegulatoryMetrics(DecimalKernel.standard());

    private static List<BigDecimal> returns(String... values) {
        return List.of(Decimals.vector(values));
    }

    private static FundRegulatoryMetrics.Fund hedgeFund(String name, String nav, String gross, String borrowings,
            String secured, List<BigDecimal> monthly) {
        return new FundRegulatoryMetrics.Fund(name, new BigDecimal(nav), new BigDecimal(gross), true, false, false,
                new BigDecimal(borrowings), new BigDecimal(secured), monthly);
    }

    @Test
    public void testLargeHedgeFundAdviser() {
        FundRegulatoryMetrics.Fund alpha = hedgeFund("Alpha HF", "800000000", "1600000000", "400000000",
                "300000000", returns("0.10", "-0.20", "0.05"));
        FundRegulatoryMetrics.Fund beta = new FundRegulatoryMetrics.Fund("Beta PE", new BigDecimal("500000000"),
                new BigDecimal("500000000"), false, true, false, BigDecimal.ZERO, BigDecimal.ZERO, List.of());
        List<FundRegulatoryMetrics.Counterparty> counterparties = List.of(
                new FundRegulatoryMetrics.Counterparty("Bank A", new BigDecimal("50")),
                new FundRegulatoryMetrics.Counterparty("Bank B", new BigDecimal("30")),
                new FundRegulatoryMetrics.Counterparty("Bank C", new BigDecimal("20")));

        CalculationResult<FundRegulatoryMetrics.Output> result = calculator.apply(new FundRegulatoryMetrics.Input(
                "Test Advisers", true, true, false, new BigDecimal("2100000000"), List.of(alpha, beta),
                counterparties));
        FundRegulatoryMetrics.Output out = result.value();

        assertEquals(FundRegulatoryMetrics.FilingType.LARGE, out.formPfType());
        assertEquals(List.of("Section 1 - Basic Information", "Section 2 - Large Hedge Fund Adviser"),
                out.formPfSections());
        assertEquals(FundRegulatoryMetrics.FilingFrequency.QUARTERLY, out.filingFrequency());
        assertEquals(60, out.filingDeadlineDays());
        assertEquals(FundRegulatoryMetrics.FilingType.EXEMPT, out.cpoPqrType());

        assertEquals(0, out.regulatoryAum().compareTo(new BigDecimal("2100000000")));
        assertEquals(0, out.hedgeFundAum().compareTo(new BigDecimal("1600000000")));
        assertEquals(0, out.privateEquityAum().compareTo(new BigDecimal("500000000")));
        assertEquals(0, out.totalNav().compareTo(new BigDecimal("1300000000")));
        BigDecimal tolerance = new BigDecimal("0.0000000001");
        assertTrue(Decimals.closeTo(new BigDecimal("0.3076923077"), out.totalBorrowingRatio(), tolerance));
        assertTrue(Decimals.closeTo(new BigDecimal("0.0769230769"), out.unsecuredBorrowingRatio(), tolerance));

        // Shares of 50, 30 and 20 percent
        assertEquals(0, out.counterpartyHhi().compareTo(new BigDecimal("3800")));
        assertEquals(Collections.singletonList("Counterparty HHI (3800) indicates high concentration (>2500)"),
                result.warnings());

        FundRegulatoryMetrics.FundPerformance alphaPerf = out.performances().get(0);
        // Peak 1.10, trough 0.88
        assertEquals(0, alphaPerf.maxDrawdown().compareTo(new BigDecimal("0.2")));
        assertEquals(3, alphaPerf.monthCount());
        assertEquals(0, alphaPerf.borrowingRatio().compareTo(new BigDecimal("0.5")));

        FundRegulatoryMetrics.FundPerformance betaPerf = out.performances().get(1);
        assertEquals(0, betaPerf.annualizedReturn().signum());
        assertEquals(0, betaPerf.sharpeRatio().signum());
        assertEquals(0, betaPerf.monthCount());
    }

    @Test
    public void testPerformanceStatistics() {
        // Twelve months of 1% compound to 1.01^12 - 1
        String[] monthly = new String[12];
        Arrays.fill(monthly, "0.01");
        assertTrue(Decimals.closeTo(new BigDecimal("0.126825030131969720661201"),
                calculator.annualizedReturn(returns(monthly)), new BigDecimal("0.000000000000000001")));

        // Mean 2%, sample deviation sqrt(0.0002): Sharpe = 0.24 / sqrt(0.0024) = sqrt(24)
        assertTrue(Decimals.closeTo(new BigDecimal("4.898979485566356196394568"),
                calculator.sharpeRatio(returns("0.01", "0.03")), new BigDecimal("0.000000000001")));
        assertEquals(0, calculator.sharpeRatio(returns("0.02", "0.02")).signum());

        // A total loss has no annualized return
        assertEquals(0, calculator.annualizedReturn(returns("0.5", "-1")).signum());
        assertEquals(0, calculator.maxDrawdown(returns("0.5", "-1")).compareTo(BigDecimal.ONE));
    }

    @Test
    public void testSmallAndExemptFilers() {
        FundRegulatoryMetrics.Fund pool = hedgeFund("Pool", "100", "300000000", "250", "50", List.of());
        CalculationResult<FundRegulatoryMetrics.Output> small = calculator.apply(new FundRegulatoryMetrics.Input(
                "Small Advisers", true, true, true, new BigDecimal("300000000"), List.of(pool), null));

        assertEquals(FundRegulatoryMetrics.FilingType.SMALL, small.value().formPfType());
        assertEquals(List.of("Section 1 - Basic Information"), small.value().formPfSections());
        assertEquals(FundRegulatoryMetrics.FilingFrequency.ANNUAL, small.value().filingFrequency());
        assertEquals(120, small.value().filingDeadlineDays());
        assertEquals(FundRegulatoryMetrics.FilingType.SMALL, small.value().cpoPqrType());
        assertEquals(0, small.value().counterpartyHhi().signum());
        assertTrue(small.warnings().get(0).contains("exceeds 2x NAV"));

        FundRegulatoryMetrics.Output exempt = calculator.apply(new FundRegulatoryMetrics.Input("Unregistered", false,
                false, false, new BigDecimal("300000000"), List.of(pool), null)).value();
        assertEquals(FundRegulatoryMetrics.FilingType.EXEMPT, exempt.formPfType());
        assertTrue(exempt.formPfSections().isEmpty());
        assertEquals(FundRegulatoryMetrics.FilingFrequency.EXEMPT, exempt.filingFrequency());
        assertEquals(0, exempt.filingDeadlineDays());
    }

    @Test
    public void testInvalidInput() {
        try {
            calculator.apply(new FundRegulatoryMetrics.Input("Advisers", true, false, false, BigDecimal.TEN,
                    List.of(hedgeFund("Bad", "-1", "10", "0", "0", List.of())), null));
            fail("Should reject a negative NAV");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("funds[0].nav"));
        }

        try {
            calculator.apply(new FundRegulatoryMetrics.Input("", true, false, false, BigDecimal.TEN, List.of(),
                    null));
            fail("Should reject an empty adviser name");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("adviserName"));
        }
    }
}
