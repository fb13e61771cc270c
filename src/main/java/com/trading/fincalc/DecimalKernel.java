package com.trading.fincalc;

import com.trading.fincalc.api.DecimalMath;
import com.trading.fincalc.config.KernelSettings;
import com.trading.fincalc.config.KernelSettingsLoader;
import com.trading.fincalc.linalg.LinearAlgebra;
import com.trading.fincalc.math.NormalDistribution;
import com.trading.fincalc.math.TaylorDecimalMath;
import com.trading.fincalc.solver.CashFlowRootFinder;
import com.trading.fincalc.solver.SolverConfig;

/**
 * fincalc: deterministic decimal kernel for financial calculators.
 *
 * <h2>Philosophy</h2>
 * <p>
 * Every number is a {@link java.math.BigDecimal} rounded to one
 * {@link java.math.MathContext}, and every iterative routine runs a fixed
 * budget. Given the same inputs and settings the kernel produces the same
 * digits on any machine, which is what makes a calculator's output auditable.
 *
 * <h3>Components</h3>
 * <ul>
 * <li><b>{@link DecimalMath}</b>: sqrt, exp, ln, cos and the hyperbolic
 * functions, powFraction.</li>
 * <li><b>{@link NormalDistribution}</b>: standard normal pdf, cdf, inverse
 * cdf.</li>
 * <li><b>{@link CashFlowRootFinder}</b>: Newton-Raphson IRR / yield solver.</li>
 * <li><b>{@link LinearAlgebra}</b>: dense matrix operations and Gauss-Jordan
 * inverse.</li>
 * </ul>
 *
 * Instances are immutable and may be shared by any number of threads.
 */
public final class DecimalKernel {
    private final KernelSettings settings;
    private final DecimalMath math;
    private final NormalDistribution normal;
    private final LinearAlgebra linearAlgebra;

    private DecimalKernel(KernelSettings settings) {
        this.settings = settings.copy().validate();
        this.math = new TaylorDecimalMath(this.settings);
        this.normal = new NormalDistribution(math, this.settings.getInverseCdfClamp());
        this.linearAlgebra = new LinearAlgebra(this.settings.mathContext(),
                this.settings.getSingularPivotThreshold());
    }

    /** Kernel with default settings: 28 digits, HALF_EVEN, sentinel domain policy. */
    public static DecimalKernel standard() {
        return new DecimalKernel(new KernelSettings());
    }

    /** Kernel configured from {@code fincalc-kernel.json} on the classpath. */
    public static DecimalKernel load() {
        return new DecimalKernel(KernelSettingsLoader.load());
    }

    public static DecimalKernel of(KernelSettings settings) {
        return new DecimalKernel(settings);
    }

    /** Copy of the settings this kernel was built from. */
    public KernelSettings settings() {
        return settings.copy();
    }

    public DecimalMath math() {
        return math;
    }

    public NormalDistribution normal() {
        return normal;
    }

    public LinearAlgebra linearAlgebra() {
        return linearAlgebra;
    }

    /**
     * New solver sharing this kernel's math.
     *
     * @param config Guard rails, usually one of the {@link SolverConfig}
     *               presets.
     */
    public CashFlowRootFinder rootFinder(SolverConfig config) {
        return new CashFlowRootFinder(math, config);
    }
}
