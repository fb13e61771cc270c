package com.trading.fincalc.fn.finance;

import java.math.BigDecimal;
import java.util.List;

import com.trading.fincalc.DecimalKernel;
import com.trading.fincalc.api.DecimalMath;
import com.trading.fincalc.fn.AbstractCalculator;
import com.trading.fincalc.math.Decimals;

/**
 * Almgren-Chriss optimal liquidation schedule.
 * <p>
 * Formula:
 *
 * <pre>
 * lambda   = urgency * 1e-6
 * kt^2     = lambda * sigma^2 / (eta * (tau/T)^2),  T = N * tau
 * kappa    = acosh(1 + kt^2 / 2)
 * n_j      = Q * sinh(kappa (N - j)) / sinh(kappa N)
 * x_j      = max(n_(j-1) - n_j, 0)
 * </pre>
 *
 * A zero {@code sinh(kappa N)} degenerates to the linear (TWAP) schedule. The
 * intraday volume profile is the supplied one when its length matches,
 * otherwise the default {@code v_j = 1 + 0.5 cos(pi (2j+1) / 2N)}
 * normalized to sum to one.
 */
public final class ExecutionTrajectory
        extends AbstractCalculator<ExecutionTrajectory.Input, ExecutionTrajectory.Output> {
    private static final BigDecimal URGENCY_SCALE = new BigDecimal("0.000001");

    /**
     * @param sliceDuration   Length of one slice (tau), in the unit of sigma.
     * @param temporaryImpact Linear temporary impact coefficient (eta).
     * @param urgency         Risk aversion before scaling; 0 means TWAP.
     * @param volumeProfile   Optional per-slice volume shares.
     */
    public record Input(BigDecimal totalQuantity, int slices, BigDecimal sliceDuration, BigDecimal volatility,
            BigDecimal temporaryImpact, BigDecimal urgency, List<BigDecimal> volumeProfile) {
    }

    /**
     * @param holdings        n_0..n_N, shares still to trade before each slice.
     * @param sliceQuantities x_1..x_N.
     */
    public record Output(BigDecimal kappa, BigDecimal[] holdings, BigDecimal[] sliceQuantities,
            BigDecimal[] volumeProfile) {
    }

    private final DecimalMath math;

    public ExecutionTrajectory(DecimalKernel kernel) {
        super(kernel);
        this.math = kernel.math();
    }

    @Override
    protected String methodology() {
        return "Almgren-Chriss optimal execution trajectory";
    }

    @Override
    protected void validate(Input in) {
        require(in.totalQuantity() != null && in.totalQuantity().signum() > 0, "totalQuantity must be positive");
        require(in.slices() >= 1, "slices must be >= 1, got " + in.slices());
        require(in.sliceDuration() != null && in.sliceDuration().signum() > 0, "sliceDuration must be positive");
        require(in.volatility() != null && in.volatility().signum() >= 0, "volatility must be >= 0");
        require(in.temporaryImpact() != null && in.temporaryImpact().signum() >= 0,
                "temporaryImpact must be >= 0");
        require(in.urgency() != null && in.urgency().signum() >= 0, "urgency must be >= 0");
    }

    @Override
    protected Output calculate(Input in, List<String> warnings) {
        int n = in.slices();
        BigDecimal bigN = BigDecimal.valueOf(n);
        BigDecimal q = in.totalQuantity();

        // 1. kappa
        BigDecimal lambda = in.urgency().multiply(URGENCY_SCALE, mc);
        BigDecimal tauOverT = in.sliceDuration().divide(in.sliceDuration().multiply(bigN, mc), mc);
        BigDecimal kappaTildeSq = BigDecimal.ZERO;
        if (in.temporaryImpact().signum() > 0) {
            BigDecimal sigmaSq = in.volatility().multiply(in.volatility(), mc);
            kappaTildeSq = lambda.multiply(sigmaSq, mc)
                    .divide(in.temporaryImpact().multiply(tauOverT, mc).multiply(tauOverT, mc), mc);
        }
        BigDecimal kappa = math.acosh(BigDecimal.ONE.add(kappaTildeSq.divide(Decimals.TWO, mc), mc));

        // 2. Holdings
        BigDecimal sinhKn = math.sinh(kappa.multiply(bigN, mc));
        BigDecimal[] holdings = new BigDecimal[n + 1];
        for (int j = 0; j <= n; j++) {
            BigDecimal remaining = BigDecimal.valueOf(n - j);
            if (sinhKn.signum() == 0) {
                holdings[j] = q.multiply(remaining, mc).divide(bigN, mc);
            } else {
                holdings[j] = q.multiply(math.sinh(kappa.multiply(remaining, mc)), mc).divide(sinhKn, mc);
            }
        }

        // 3. Slices
        BigDecimal[] slices = new BigDecimal[n];
        for (int j = 1; j <= n; j++)
            slices[j - 1] = Decimals.max(holdings[j - 1].subtract(holdings[j], mc), BigDecimal.ZERO);

        List<BigDecimal> supplied = in.volumeProfile();
        BigDecimal[] profile = supplied != null && supplied.size() == n
                ? supplied.toArray(new BigDecimal[0])
                : volumeProfile(n);
        if (supplied != null && supplied.size() != n)
            warnings.add("Volume profile has " + supplied.size() + " entries for " + n + " slices; using default");

        return new Output(kappa, holdings, slices, profile);
    }

    /** Default volume curve over {@code n} slices, heaviest first, summing to one. */
    public BigDecimal[] volumeProfile(int n) {
        BigDecimal[] profile = new BigDecimal[n];
        BigDecimal twoN = BigDecimal.valueOf(2L * n);
        BigDecimal sum = BigDecimal.ZERO;
        for (int j = 0; j < n; j++) {
            BigDecimal arg = Decimals.PI.multiply(BigDecimal.valueOf(2L * j + 1), mc).divide(twoN, mc);
            profile[j] = BigDecimal.ONE.add(Decimals.HALF.multiply(math.cos(arg), mc), mc);
            sum = sum.add(profile[j], mc);
        }
        for (int j = 0; j < n; j++)
            profile[j] = profile[j].divide(sum, mc);
        return profile;
    }
}
