package com.trading.fincalc.fn.finance;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import com.trading.fincalc.DecimalKernel;
import com.trading.fincalc.fn.AbstractCalculator;
import com.trading.fincalc.linalg.LinearAlgebra;

/**
 * Black-Litterman posterior returns and mean-variance weights.
 *
 * <h3>Steps</h3>
 * <ol>
 * <li>Implied equilibrium returns {@code pi = lambda * S * w_mkt}.</li>
 * <li>Pick matrix P and view vector Q; view uncertainty
 * {@code Omega_ii = (1/c_i - 1) * (P tS P')_ii}, floored at 1e-10.</li>
 * <li>{@code A = (tS)^-1 + P' Omega^-1 P}, {@code b = (tS)^-1 pi + P' Omega^-1 Q},
 * posterior {@code mu = A^-1 b}, posterior covariance {@code A^-1}.</li>
 * <li>{@code w* = (lambda S)^-1 mu}, normalized to sum to one.</li>
 * <li>Return, risk, Sharpe, tracking error and information ratio against the
 * market portfolio.</li>
 * </ol>
 * Without views the posterior is the prior.
 */
public final class BlackLittermanOptimizer
        extends AbstractCalculator<BlackLittermanOptimizer.Input, BlackLittermanOptimizer.Output> {
    private static final BigDecimal SYMMETRY_TOLERANCE = new BigDecimal("0.0000001");
    private static final BigDecimal OMEGA_FLOOR = new BigDecimal("0.0000000001");
    private static final BigDecimal CONCENTRATION_LIMIT = new BigDecimal("0.50");
    private static final BigDecimal TILT_LIMIT = new BigDecimal("0.20");
    private static final BigDecimal TRACKING_ERROR_LIMIT = new BigDecimal("0.10");

    /**
     * An investor view. Absolute when {@code shortIndex} is null, otherwise
     * "long outperforms short by expectedReturn".
     *
     * @param confidence In (0, 1]; 1 means no uncertainty.
     */
    public record View(int longIndex, Integer shortIndex, BigDecimal expectedReturn, BigDecimal confidence) {
        public static View absolute(int asset, BigDecimal expectedReturn, BigDecimal confidence) {
            return new View(asset, null, expectedReturn, confidence);
        }

        public static View relative(int longAsset, int shortAsset, BigDecimal expectedReturn,
                BigDecimal confidence) {
            return new View(longAsset, shortAsset, expectedReturn, confidence);
        }

        public boolean isRelative() {
            return shortIndex != null;
        }
    }

    /**
     * @param covariance   N x N, symmetric.
     * @param riskAversion Market lambda, typically 2.5.
     * @param tau          Uncertainty scale of the prior, typically 0.05.
     */
    public record Input(List<String> assetNames, BigDecimal[] marketWeights, BigDecimal[][] covariance,
            BigDecimal riskFreeRate, BigDecimal riskAversion, BigDecimal tau, List<View> views) {
    }

    public record AssetWeight(String name, BigDecimal weight, BigDecimal marketWeight, BigDecimal tilt) {
    }

    /**
     * @param impact Change of the viewed return (or spread) from prior to
     *               posterior.
     */
    public record ViewContribution(String description, BigDecimal impact, BigDecimal omega) {
    }

    public record Output(BigDecimal[] impliedReturns, BigDecimal[] posteriorReturns,
            BigDecimal[][] posteriorCovariance, List<AssetWeight> weights, BigDecimal portfolioReturn,
            BigDecimal portfolioRisk, BigDecimal sharpeRatio, List<ViewContribution> viewContributions,
            BigDecimal trackingError, BigDecimal informationRatio) {
    }

    private final LinearAlgebra la;

    public BlackLittermanOptimizer(DecimalKernel kernel) {
        super(kernel);
        this.la = kernel.linearAlgebra();
    }

    @Override
    protected String methodology() {
        return "Black-Litterman Portfolio Optimization";
    }

    @Override
    protected void validate(Input in) {
        require(in.assetNames() != null && !in.assetNames().isEmpty(), "At least one asset required");
        int n = in.assetNames().size();
        require(in.marketWeights() != null && in.marketWeights().length == n,
                "Expected " + n + " market weights");
        require(in.covariance() != null && in.covariance().length == n,
                "Expected " + n + "x" + n + " covariance matrix");
        for (int i = 0; i < n; i++)
            require(in.covariance()[i].length == n,
                    "Covariance row " + i + " has " + in.covariance()[i].length + " columns, expected " + n);
        require(LinearAlgebra.isSymmetric(in.covariance(), SYMMETRY_TOLERANCE), "Covariance matrix is not symmetric");
        require(in.riskFreeRate() != null, "riskFreeRate is required");
        require(in.riskAversion() != null && in.riskAversion().signum() > 0, "riskAversion must be positive");
        require(in.tau() != null && in.tau().signum() > 0, "tau must be positive");
        require(in.views() != null, "views must not be null");
        for (int i = 0; i < in.views().size(); i++) {
            View v = in.views().get(i);
            require(v.expectedReturn() != null, "views[" + i + "]: expectedReturn is required");
            require(v.confidence() != null && v.confidence().signum() > 0
                    && v.confidence().compareTo(BigDecimal.ONE) <= 0,
                    "views[" + i + "]: confidence must be in (0, 1], got " + v.confidence());
            require(v.longIndex() >= 0 && v.longIndex() < n,
                    "views[" + i + "]: asset index " + v.longIndex() + " out of range (n=" + n + ")");
            if (v.isRelative()) {
                require(v.shortIndex() >= 0 && v.shortIndex() < n,
                        "views[" + i + "]: asset index " + v.shortIndex() + " out of range (n=" + n + ")");
                require(v.shortIndex() != v.longIndex(),
                        "views[" + i + "]: relative view must reference two different assets");
            }
        }
    }

    @Override
    protected Output calculate(Input in, List<String> warnings) {
        int n = in.assetNames().size();
        BigDecimal[][] sigma = in.covariance();
        BigDecimal[] wMkt = in.marketWeights();
        BigDecimal lambda = in.riskAversion();

        // 1. Equilibrium
        BigDecimal[] pi = la.scale(la.multiply(sigma, wMkt), lambda);
        BigDecimal[][] tauSigma = la.scale(sigma, in.tau());

        // 2. Posterior
        BigDecimal[] mu;
        BigDecimal[][] posteriorCov;
        BigDecimal[] omega;
        if (in.views().isEmpty()) {
            mu = pi;
            posteriorCov = tauSigma;
            omega = new BigDecimal[0];
        } else {
            BigDecimal[][] p = pickMatrix(in.views(), n);
            BigDecimal[] q = viewReturns(in.views());
            omega = omega(la.multiplyTransposeRight(la.multiply(p, tauSigma), p), in.views());

            BigDecimal[][] tauSigmaInv = la.inverse(tauSigma);
            BigDecimal[][] omegaInv = la.inverseDiagonal(diagonal(omega));
            BigDecimal[][] ptOmegaInv = la.multiply(la.transpose(p), omegaInv);

            BigDecimal[][] a = la.add(tauSigmaInv, la.multiply(ptOmegaInv, p));
            BigDecimal[] b = la.add(la.multiply(tauSigmaInv, pi), la.multiply(ptOmegaInv, q));
            posteriorCov = la.inverse(a);
            mu = la.multiply(posteriorCov, b);
        }

        // 3. Weights
        BigDecimal[] raw = la.multiply(la.inverse(la.scale(sigma, lambda)), mu);
        BigDecimal rawSum = BigDecimal.ZERO;
        for (BigDecimal w : raw)
            rawSum = rawSum.add(w, mc);
        BigDecimal[] w = new BigDecimal[n];
        for (int i = 0; i < n; i++)
            w[i] = rawSum.signum() == 0 ? BigDecimal.ONE.divide(BigDecimal.valueOf(n), mc) : raw[i].divide(rawSum, mc);

        // 4. Metrics
        BigDecimal portReturn = la.dot(w, mu);
        BigDecimal portRisk = kernel.math().sqrt(la.quadraticForm(w, sigma));
        BigDecimal sharpe = portRisk.signum() == 0 ? BigDecimal.ZERO
                : portReturn.subtract(in.riskFreeRate(), mc).divide(portRisk, mc);

        BigDecimal[] active = la.subtract(w, wMkt);
        BigDecimal trackingError = kernel.math().sqrt(la.quadraticForm(active, sigma));
        BigDecimal benchmarkReturn = la.dot(wMkt, mu);
        BigDecimal infoRatio = trackingError.signum() == 0 ? BigDecimal.ZERO
                : portReturn.subtract(benchmarkReturn, mc).divide(trackingError, mc);

        List<AssetWeight> weights = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            String name = in.assetNames().get(i);
            BigDecimal tilt = w[i].subtract(wMkt[i], mc);
            weights.add(new AssetWeight(name, w[i], wMkt[i], tilt));
            if (w[i].compareTo(CONCENTRATION_LIMIT) > 0)
                warnings.add("Concentrated position: " + name + " has weight " + fmt(w[i]));
            if (tilt.abs().compareTo(TILT_LIMIT) > 0)
                warnings.add("Large tilt from market: " + name + " tilt = " + fmt(tilt));
        }
        if (trackingError.compareTo(TRACKING_ERROR_LIMIT) > 0)
            warnings.add("High tracking error vs. market: " + fmt(trackingError));

        return new Output(pi, mu, posteriorCov, List.copyOf(weights), portReturn, portRisk, sharpe,
                contributions(in, omega, pi, mu), trackingError, infoRatio);
    }

    private static BigDecimal[][] pickMatrix(List<View> views, int n) {
        BigDecimal[][] p = new BigDecimal[views.size()][n];
        for (int k = 0; k < views.size(); k++) {
            View v = views.get(k);
            for (int j = 0; j < n; j++)
                p[k][j] = BigDecimal.ZERO;
            p[k][v.longIndex()] = BigDecimal.ONE;
            if (v.isRelative())
                p[k][v.shortIndex()] = BigDecimal.ONE.negate();
        }
        return p;
    }

    private static BigDecimal[] viewReturns(List<View> views) {
        BigDecimal[] q = new BigDecimal[views.size()];
        for (int k = 0; k < views.size(); k++)
            q[k] = views.get(k).expectedReturn();
        return q;
    }

    /** Low confidence means large uncertainty; full confidence gets the floor. */
    private BigDecimal[] omega(BigDecimal[][] pTauSigmaPt, List<View> views) {
        BigDecimal[] omega = new BigDecimal[views.size()];
        for (int k = 0; k < views.size(); k++) {
            BigDecimal scale = BigDecimal.ONE.divide(views.get(k).confidence(), mc).subtract(BigDecimal.ONE, mc);
            BigDecimal value = scale.multiply(pTauSigmaPt[k][k], mc);
            if (value.signum() < 0)
                throw new IllegalArgumentException("Omega[" + k + "," + k + "] = " + value
                        + " is negative; check covariance/confidence");
            omega[k] = value.signum() == 0 ? OMEGA_FLOOR : value;
        }
        return omega;
    }

    private static BigDecimal[][] diagonal(BigDecimal[] d) {
        BigDecimal[][] m = LinearAlgebra.identity(d.length);
        for (int i = 0; i < d.length; i++)
            m[i][i] = d[i];
        return m;
    }

    private List<ViewContribution> contributions(Input in, BigDecimal[] omega, BigDecimal[] pi, BigDecimal[] mu) {
        List<ViewContribution> out = new ArrayList<>(in.views().size());
        List<String> names = in.assetNames();
        for (int k = 0; k < in.views().size(); k++) {
            View v = in.views().get(k);
            int l = v.longIndex();
            BigDecimal impact = mu[l].subtract(pi[l], mc);
            String description;
            if (v.isRelative()) {
                int s = v.shortIndex();
                impact = impact.subtract(mu[s].subtract(pi[s], mc), mc);
                description = names.get(l) + " outperforms " + names.get(s) + " by " + fmt(v.expectedReturn());
            } else {
                description = names.get(l) + " absolute return = " + fmt(v.expectedReturn());
            }
            out.add(new ViewContribution(description, impact, omega[k]));
        }
        return List.copyOf(out);
    }

    private static String fmt(BigDecimal v) {
        return v.setScale(4, RoundingMode.HALF_UP).toPlainString();
    }
}
