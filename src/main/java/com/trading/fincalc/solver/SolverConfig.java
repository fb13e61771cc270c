package com.trading.fincalc.solver;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.With;

/**
 * Guard rails for one family of cash-flow solves.
 *
 * <p>
 * The presets reproduce the guard rails each product historically used; pick
 * one and adjust with the {@code with*} methods.
 */
@Data
@With
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SolverConfig {
    /** Label carried into convergence failures. */
    private String name = "irr";
    private int maxIterations = 50;
    /** Converged once |NPV| falls below this. */
    private BigDecimal tolerance = new BigDecimal("0.0000001");
    /** When set, also converged once the Newton step falls below this. */
    private BigDecimal stepTolerance;
    private BigDecimal lowerBound = new BigDecimal("-0.99");
    private BigDecimal upperBound = BigDecimal.TEN;

    /** Generic IRR: 50 iterations, rate band [-0.99, 10]. */
    public static SolverConfig irr() {
        return new SolverConfig();
    }

    /** Periodic bond yield: 50 iterations, annual band [-0.5, 1.0]. */
    public static SolverConfig bondYield() {
        return new SolverConfig().withName("bond_yield")
                .withLowerBound(new BigDecimal("-0.50"))
                .withUpperBound(BigDecimal.ONE);
    }

    /** Private-credit tranche yields: 50 iterations, band [-0.99, 10]. */
    public static SolverConfig privateCredit() {
        return new SolverConfig().withName("tranche_yield");
    }

    /** Property IRR: 30 iterations, band [-0.99, 10], step tolerance 1e-7. */
    public static SolverConfig realEstate() {
        return new SolverConfig().withName("property_irr")
                .withMaxIterations(30)
                .withStepTolerance(new BigDecimal("0.0000001"));
    }

    public SolverConfig copy() {
        return new SolverConfig(name, maxIterations, tolerance, stepTolerance, lowerBound, upperBound);
    }

    /**
     * @return this, for chaining
     * @throws IllegalArgumentException when the band or budgets are unusable
     */
    public SolverConfig validate() {
        if (maxIterations <= 0)
            throw new IllegalArgumentException("maxIterations must be > 0, got " + maxIterations);
        if (tolerance == null || tolerance.signum() <= 0)
            throw new IllegalArgumentException("tolerance must be > 0, got " + tolerance);
        if (stepTolerance != null && stepTolerance.signum() <= 0)
            throw new IllegalArgumentException("stepTolerance must be > 0, got " + stepTolerance);
        if (lowerBound == null || upperBound == null)
            throw new IllegalArgumentException("rate bounds are required");
        // 1 + r must stay positive for every admissible rate.
        if (lowerBound.compareTo(BigDecimal.ONE.negate()) <= 0)
            throw new IllegalArgumentException("lowerBound must be > -1, got " + lowerBound);
        if (lowerBound.compareTo(upperBound) >= 0)
            throw new IllegalArgumentException("lowerBound must be < upperBound");
        return this;
    }
}
