package com.trading.fincalc.fn.finance;

import com.trading.fincalc.DecimalKernel;
import com.trading.fincalc.error.SingularMatrixException;
import com.trading.fincalc.fn.CalculationResult;
import com.trading.fincalc.math.Decimals;
import org.junit.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.trading.fincalc.math.Decimals.matrix;
import static com.trading.fincalc.math.Decimals.vector;
import static org.junit.Assert.*;

public class BlackLittermanOptimizerTest {

    private static final List<String> ASSETS = List.of("Equity", "Credit");
    private static final BigDecimal[][] SIGMA = matrix(
            new String[] { "0.04", "0.006" },
            new String[] { "0.006", "0.09" });
    private static final BigDecimal[] MARKET = vector("0.6", "0.4");
    private static final BigDecimal LAMBDA = new BigDecimal("2.5");
    private static final BigDecimal TAU = new BigDecimal("0.05");
    private static final BigDecimal RF = new BigDecimal("0.02");

    private final BlackLittermanOptimizer optimizer = new BlackLittermanOptimizer(DecimalKernel.standard());

    private static BigDecimal sum(BigDecimal[] values) {
        return Decimals.sum(values, Decimals.DEFAULT_CONTEXT);
    }

    private static BigDecimal[] weights(BlackLittermanOptimizer.Output out) {
        return out.weights().stream().map(BlackLittermanOptimizer.AssetWeight::weight).toArray(BigDecimal[]::new);
    }

    @Test
    public void testNoViewsKeepsPrior() {
        BlackLittermanOptimizer.Output out = optimizer.apply(new BlackLittermanOptimizer.Input(ASSETS, MARKET, SIGMA,
                RF, LAMBDA, TAU, List.of())).value();

        // pi = 2.5 * S * w = [0.066, 0.099]
        assertEquals(0, out.impliedReturns()[0].compareTo(new BigDecimal("0.066")));
        assertEquals(0, out.impliedReturns()[1].compareTo(new BigDecimal("0.099")));
        for (int i = 0; i < 2; i++) {
            assertEquals(0, out.posteriorReturns()[i].compareTo(out.impliedReturns()[i]));
            assertTrue(Decimals.closeTo(MARKET[i], out.weights().get(i).weight(), new BigDecimal("0.0000000001")));
        }
        assertEquals(0, out.posteriorCovariance()[0][0].compareTo(new BigDecimal("0.002")));
        assertTrue(out.viewContributions().isEmpty());
        assertTrue(out.trackingError().compareTo(new BigDecimal("0.000001")) < 0);
    }

    @Test
    public void testBullishViewTiltsTowardAsset() {
        BlackLittermanOptimizer.View view = BlackLittermanOptimizer.View.absolute(1, new BigDecimal("0.20"),
                new BigDecimal("0.8"));
        CalculationResult<BlackLittermanOptimizer.Output> result = optimizer.apply(new BlackLittermanOptimizer.Input(
                ASSETS, MARKET, SIGMA, RF, LAMBDA, TAU, List.of(view)));
        BlackLittermanOptimizer.Output out = result.value();

        assertTrue(Decimals.closeTo(BigDecimal.ONE, sum(weights(out)), new BigDecimal("0.000000000001")));
        assertTrue("posterior " + out.posteriorReturns()[1],
                out.posteriorReturns()[1].compareTo(out.impliedReturns()[1]) > 0);
        assertTrue("weight " + out.weights().get(1).weight(), out.weights().get(1).weight().compareTo(MARKET[1]) > 0);
        assertTrue(out.weights().get(1).tilt().signum() > 0);

        assertEquals(1, out.viewContributions().size());
        BlackLittermanOptimizer.ViewContribution contribution = out.viewContributions().get(0);
        assertTrue(contribution.impact().signum() > 0);
        assertTrue(contribution.description().startsWith("Credit absolute return"));
        assertTrue(contribution.omega().signum() > 0);

        assertTrue(out.portfolioRisk().signum() > 0);
        assertTrue(out.trackingError().signum() > 0);
        assertTrue(out.informationRatio().signum() > 0);
    }

    @Test
    public void testRelativeViewAtFullConfidence() {
        BlackLittermanOptimizer.View view = BlackLittermanOptimizer.View.relative(0, 1, new BigDecimal("0.05"),
                BigDecimal.ONE);
        BlackLittermanOptimizer.Output out = optimizer.apply(new BlackLittermanOptimizer.Input(ASSETS, MARKET, SIGMA,
                RF, LAMBDA, TAU, List.of(view))).value();

        // Omega is floored, so the posterior spread honours the view
        assertEquals(0, out.viewContributions().get(0).omega().compareTo(new BigDecimal("0.0000000001")));
        BigDecimal spread = out.posteriorReturns()[0].subtract(out.posteriorReturns()[1]);
        assertTrue("spread " + spread, Decimals.closeTo(new BigDecimal("0.05"), spread, new BigDecimal("0.0001")));
        assertTrue(Decimals.closeTo(BigDecimal.ONE, sum(weights(out)), new BigDecimal("0.000000000001")));
    }

    @Test
    public void testInvalidInput() {
        BigDecimal[][] asymmetric = matrix(
                new String[] { "0.04", "0.006" },
                new String[] { "0.007", "0.09" });
        try {
            optimizer.apply(new BlackLittermanOptimizer.Input(ASSETS, MARKET, asymmetric, RF, LAMBDA, TAU, List.of()));
            fail("Should reject an asymmetric covariance matrix");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("symmetric"));
        }

        try {
            optimizer.apply(new BlackLittermanOptimizer.Input(ASSETS, MARKET, SIGMA, RF, LAMBDA, TAU,
                    List.of(BlackLittermanOptimizer.View.absolute(2, BigDecimal.ONE, Decimals.HALF))));
            fail("Should reject an out of range asset index");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("out of range"));
        }

        try {
            optimizer.apply(new BlackLittermanOptimizer.Input(ASSETS, MARKET, SIGMA, RF, LAMBDA, TAU,
                    List.of(BlackLittermanOptimizer.View.absolute(0, BigDecimal.ONE, BigDecimal.ZERO))));
            fail("Should reject zero confidence");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("confidence"));
        }

        try {
            optimizer.apply(new BlackLittermanOptimizer.Input(ASSETS, MARKET, SIGMA, RF, LAMBDA, TAU,
                    List.of(BlackLittermanOptimizer.View.relative(1, 1, BigDecimal.ONE, Decimals.HALF))));
            fail("Should reject a relative view on one asset");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("two different assets"));
        }

        try {
            optimizer.apply(new BlackLittermanOptimizer.Input(ASSETS, MARKET, SIGMA, RF, BigDecimal.ZERO, TAU,
                    List.of()));
            fail("Should reject zero risk aversion");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("riskAversion"));
        }
    }

    @Test
    public void testSingularCovarianceIsRethrown() {
        BigDecimal[][] singular = matrix(
                new String[] { "0.04", "0.04" },
                new String[] { "0.04", "0.04" });
        try {
            optimizer.apply(new BlackLittermanOptimizer.Input(ASSETS, MARKET, singular, RF, LAMBDA, TAU, List.of()));
            fail("Should throw SingularMatrixException");
        } catch (SingularMatrixException e) {
            assertEquals(1, e.getColumn());
        }
    }
}
