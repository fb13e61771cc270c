package com.trading.fincalc.fn.finance;

import com.trading.fincalc.DecimalKernel;
import com.trading.fincalc.fn.CalculationResult;
import com.trading.fincalc.math.Decimals;
import org.junit.Test;

import java.math.BigDecimal;

import static org.junit.Assert.*;

public class TrancheYieldTest {

    private static final BigDecimal PRINCIPAL = new BigDecimal("1000000");
    private static final BigDecimal COUPON = new BigDecimal("0.09");

    private final TrancheYield calculator = new TrancheYield(DecimalKernel.standard());

    @Test
    public void testParTrancheYieldsCoupon() {
        CalculationResult<TrancheYield.Output> result = calculator.apply(new TrancheYield.Input(
                PRINCIPAL, COUPON, BigDecimal.ZERO, BigDecimal.ZERO, 5, null, null));

        TrancheYield.Output out = result.value();
        assertEquals(0, out.netFunding().compareTo(PRINCIPAL));
        assertTrue("ytm " + out.yieldToMaturity(),
                Decimals.closeTo(COUPON, out.yieldToMaturity(), new BigDecimal("0.000000001")));
        assertNull(out.yieldToCall());
        assertFalse(result.hasWarnings());
        assertTrue(result.methodology().contains("Tranche yield"));
    }

    @Test
    public void testDiscountAndFeesLiftYield() {
        TrancheYield.Output out = calculator.apply(new TrancheYield.Input(PRINCIPAL, COUPON,
                new BigDecimal("0.02"), new BigDecimal("0.01"), 5, 2, new BigDecimal("0.02"))).value();

        // Lender funds 1,000,000 * 0.98 - 1,000,000 * 0.01
        assertEquals(0, out.netFunding().compareTo(new BigDecimal("970000")));
        assertTrue(out.yieldToMaturity().compareTo(COUPON) > 0);
        // The discount and the premium are earned over two years instead of five
        assertNotNull(out.yieldToCall());
        assertTrue(out.yieldToCall().compareTo(out.yieldToMaturity()) > 0);
    }

    @Test
    public void testInvalidInput() {
        try {
            calculator.apply(new TrancheYield.Input(PRINCIPAL, COUPON, BigDecimal.ZERO, BigDecimal.ZERO, 5, 7,
                    BigDecimal.ZERO));
            fail("Should reject a call year after maturity");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("callYear"));
        }

        try {
            calculator.apply(new TrancheYield.Input(PRINCIPAL, COUPON, BigDecimal.ONE, BigDecimal.ZERO, 5, null,
                    null));
            fail("Should reject an OID of 100%");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("oidPct"));
        }

        try {
            calculator.apply(new TrancheYield.Input(PRINCIPAL, COUPON, new BigDecimal("0.6"), new BigDecimal("0.4"),
                    5, null, null));
            fail("Should reject OID and fees that consume the whole principal");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("oidPct + upfrontFeePct"));
        }

        try {
            calculator.apply(null);
            fail("Should reject null input");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("input is required"));
        }
    }
}
