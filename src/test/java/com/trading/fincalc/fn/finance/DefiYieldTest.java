package com.trading.fincalc.fn.finance;

import com.trading.fincalc.DecimalKernel;
import com.trading.fincalc.fn.CalculationResult;
import com.trading.fincalc.math.Decimals;
import org.junit.Test;

import java.math.BigDecimal;

import static org.junit.Assert.*;

public class DefiYieldTest {

    private final DefiYield calculator = new DefiYield(DecimalKernel.standard());

    private CalculationResult<DefiYield.Output> run(DefiYield.Position position) {
        return calculator.apply(new DefiYield.Input("TestProtocol", position));
    }

    @Test
    public void testYieldFarmCompoundsMonthly() {
        CalculationResult<DefiYield.Output> result = run(new DefiYield.YieldFarm(new BigDecimal("0.12"), null, 12,
                null, new BigDecimal("10000"), 365));
        DefiYield.Output out = result.value();

        // 1.01^12 - 1
        BigDecimal expected = new BigDecimal("0.126825030131969720661201");
        assertEquals("YieldFarm", out.analysisType());
        assertTrue(Decimals.closeTo(expected, out.effectiveApy(), new BigDecimal("0.00000000000000000001")));
        assertEquals(0, out.netApy().compareTo(out.effectiveApy()));
        assertTrue(Decimals.closeTo(new BigDecimal("1268.25030131969720661201"), out.totalReturn(),
                new BigDecimal("0.0000000001")));
        assertNull(out.impermanentLossPct());
        assertFalse(result.hasWarnings());
    }

    @Test
    public void testYieldFarmGasDrag() {
        // 200 * 12 / 10,000 = 24% of gas a year against a 12.68% APY
        CalculationResult<DefiYield.Output> result = run(new DefiYield.YieldFarm(new BigDecimal("0.10"),
                new BigDecimal("0.02"), 12, new BigDecimal("200"), new BigDecimal("10000"), 180));
        DefiYield.Output out = result.value();

        assertTrue(out.netApy().signum() < 0);
        assertTrue(out.totalReturn().signum() < 0);
        assertTrue(result.warnings().contains("Gas costs exceed yield, position is net negative"));
    }

    @Test
    public void testImpermanentLossAgainstFees() {
        // Token A quadruples against B: price ratio 4, IL = 2 * 2 / 5 - 1
        CalculationResult<DefiYield.Output> result = run(new DefiYield.ImpermanentLoss(new BigDecimal("100"),
                BigDecimal.ONE, new BigDecimal("400"), BigDecimal.ONE, new BigDecimal("10000"),
                new BigDecimal("0.30"), null));
        DefiYield.Output out = result.value();

        assertEquals(0, out.impermanentLossPct().compareTo(new BigDecimal("-0.2")));
        assertEquals(0, out.impermanentLossAmount().compareTo(new BigDecimal("2000")));
        assertEquals(0, out.poolFeeIncome().compareTo(new BigDecimal("3000")));
        assertEquals(0, out.totalReturn().compareTo(new BigDecimal("1000")));
        assertEquals(0, out.effectiveApy().compareTo(new BigDecimal("0.1")));
        assertEquals(DefiYield.FEES_EXCEED_IL, out.ilVersusFees());
        assertTrue(result.warnings().contains("Impermanent loss is significant: -20.00%"));
    }

    @Test
    public void testStaking() {
        CalculationResult<DefiYield.Output> result = run(new DefiYield.Staking(new BigDecimal("1000"),
                new BigDecimal("0.10"), new BigDecimal("0.10"), new BigDecimal("0.01"), new BigDecimal("0.05"), 21,
                false));
        DefiYield.Output out = result.value();

        assertEquals(0, out.stakingNetYield().compareTo(new BigDecimal("0.09")));
        assertEquals(0, out.effectiveApy().compareTo(new BigDecimal("0.09")));
        assertEquals(0, out.riskAdjustedApy().compareTo(new BigDecimal("0.0895")));
        assertEquals(0, out.stakingExpectedAnnualReward().compareTo(new BigDecimal("90")));
        assertEquals(0, out.totalReturn().compareTo(new BigDecimal("89.5")));
        assertFalse(result.hasWarnings());

        CalculationResult<DefiYield.Output> risky = run(new DefiYield.Staking(new BigDecimal("1000"),
                new BigDecimal("0.10"), BigDecimal.ZERO, new BigDecimal("0.06"), BigDecimal.ONE, 30, true));
        // Daily compounding beats the simple rate
        assertTrue(risky.value().effectiveApy().compareTo(new BigDecimal("0.10")) > 0);
        assertEquals(2, risky.warnings().size());
    }

    @Test
    public void testLiquidityPool() {
        CalculationResult<DefiYield.Output> result = run(new DefiYield.LiquidityPool(new BigDecimal("1000000"),
                new BigDecimal("10000"), new BigDecimal("500000"), new BigDecimal("0.003"), new BigDecimal("3")));
        DefiYield.Output out = result.value();

        assertEquals(0, out.poolShare().compareTo(new BigDecimal("0.01")));
        assertEquals(0, out.poolFeeIncome().compareTo(new BigDecimal("5475")));
        assertEquals(0, out.impermanentLossPct().compareTo(new BigDecimal("-0.2")));
        assertEquals(0, out.effectiveApy().compareTo(new BigDecimal("0.3475")));
        assertEquals(0, out.totalReturn().compareTo(new BigDecimal("3475")));
        assertEquals(DefiYield.FEES_EXCEED_IL, out.ilVersusFees());
        assertFalse(result.hasWarnings());

        CalculationResult<DefiYield.Output> wiped = run(new DefiYield.LiquidityPool(new BigDecimal("1000000"),
                new BigDecimal("10000"), BigDecimal.ZERO, new BigDecimal("0.003"), new BigDecimal("-1")));
        assertEquals(0, wiped.value().impermanentLossPct().signum());
        assertTrue(wiped.warnings().contains("Price ratio non-positive after change, IL undefined"));
    }

    @Test
    public void testInvalidInput() {
        try {
            run(new DefiYield.Staking(new BigDecimal("1000"), new BigDecimal("0.10"), new BigDecimal("1.5"),
                    BigDecimal.ZERO, BigDecimal.ZERO, 0, false));
            fail("Should reject a commission above 1");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("validatorCommission"));
        }

        try {
            run(new DefiYield.YieldFarm(new BigDecimal("0.10"), null, 0, null, new BigDecimal("100"), 30));
            fail("Should reject zero compounding frequency");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("compoundingFrequency"));
        }

        try {
            run(new DefiYield.Position() {
            });
            fail("Should reject an unknown position");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("Unsupported position"));
        }
    }
}
