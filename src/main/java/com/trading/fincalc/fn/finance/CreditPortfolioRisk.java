package com.trading.fincalc.fn.finance;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.trading.fincalc.DecimalKernel;
import com.trading.fincalc.api.DecimalMath;
import com.trading.fincalc.fn.AbstractCalculator;
import com.trading.fincalc.math.Decimals;
import com.trading.fincalc.math.NormalDistribution;

/**
 * Portfolio credit risk under the Vasicek single-factor model.
 * <p>
 * Per exposure {@code EL = PD * LGD * EAD} and standalone
 * {@code UL = EAD * LGD * sqrt(PD (1 - PD))}. Portfolio UL combines the
 * standalone figures with one uniform correlation. Credit VaR sums
 * {@code EAD * LGD * PD_cond} with
 *
 * <pre>
 * PD_cond = N((N^-1(PD) + sqrt(rho) * N^-1(conf)) / sqrt(1 - rho))
 * </pre>
 *
 * and economic capital is VaR less EL.
 */
public final class CreditPortfolioRisk
        extends AbstractCalculator<CreditPortfolioRisk.Input, CreditPortfolioRisk.Output> {
    private static final BigDecimal HHI_LIMIT = new BigDecimal("0.25");
    private static final BigDecimal SINGLE_NAME_LIMIT = new BigDecimal("0.10");

    /**
     * @param exposure             Exposure at default.
     * @param probabilityOfDefault Annual PD in [0, 1].
     * @param lossGivenDefault     LGD in [0, 1].
     */
    public record Exposure(String name, BigDecimal exposure, BigDecimal probabilityOfDefault,
            BigDecimal lossGivenDefault, String sector) {
    }

    /**
     * @param correlation     Uniform asset correlation in [0, 1).
     * @param confidenceLevel VaR confidence in (0.5, 1), e.g. 0.99.
     */
    public record Input(List<Exposure> exposures, BigDecimal correlation, BigDecimal confidenceLevel) {
    }

    public record ExposureRisk(String name, BigDecimal expectedLoss, BigDecimal unexpectedLoss,
            BigDecimal marginalRisk, BigDecimal riskContribution, BigDecimal weight) {
    }

    /**
     * @param diversificationBenefit {@code 1 - UL_portfolio / sum UL_i}.
     * @param hhiName                Herfindahl index of exposure weights.
     */
    public record Output(BigDecimal totalExposure, BigDecimal expectedLoss, BigDecimal unexpectedLoss,
            BigDecimal creditVar, BigDecimal economicCapital, BigDecimal diversificationBenefit,
            BigDecimal hhiName, BigDecimal hhiSector, BigDecimal effectiveNumberOfNames, BigDecimal portfolioPd,
            BigDecimal portfolioLgd, List<ExposureRisk> exposureRisks) {
    }

    private final DecimalMath math;
    private final NormalDistribution normal;

    public CreditPortfolioRisk(DecimalKernel kernel) {
        super(kernel);
        this.math = kernel.math();
        this.normal = kernel.normal();
    }

    @Override
    protected String methodology() {
        return "Vasicek single-factor / Gaussian copula";
    }

    @Override
    protected void validate(Input in) {
        require(in.exposures() != null && !in.exposures().isEmpty(), "At least one exposure is required");
        require(in.correlation() != null && in.correlation().signum() >= 0
                && in.correlation().compareTo(BigDecimal.ONE) < 0, "correlation must be in [0, 1)");
        require(in.confidenceLevel() != null && in.confidenceLevel().compareTo(Decimals.HALF) > 0
                && in.confidenceLevel().compareTo(BigDecimal.ONE) < 0, "confidenceLevel must be in (0.5, 1)");
        for (int i = 0; i < in.exposures().size(); i++) {
            Exposure e = in.exposures().get(i);
            require(e.exposure() != null && e.exposure().signum() > 0,
                    "exposures[" + i + "].exposure must be positive");
            requireUnit("exposures[" + i + "].probabilityOfDefault", e.probabilityOfDefault());
            requireUnit("exposures[" + i + "].lossGivenDefault", e.lossGivenDefault());
        }
    }

    @Override
    protected Output calculate(Input in, List<String> warnings) {
        List<Exposure> exposures = in.exposures();
        int n = exposures.size();
        BigDecimal rho = in.correlation();

        BigDecimal total = BigDecimal.ZERO;
        for (Exposure e : exposures)
            total = total.add(e.exposure(), mc);

        // 1. Standalone EL and UL
        BigDecimal[] el = new BigDecimal[n];
        BigDecimal[] ul = new BigDecimal[n];
        BigDecimal[] weight = new BigDecimal[n];
        BigDecimal portfolioEl = BigDecimal.ZERO;
        BigDecimal sumUl = BigDecimal.ZERO;
        for (int i = 0; i < n; i++) {
            Exposure e = exposures.get(i);
            BigDecimal pd = e.probabilityOfDefault();
            BigDecimal lossAmount = e.exposure().multiply(e.lossGivenDefault(), mc);
            el[i] = lossAmount.multiply(pd, mc);
            ul[i] = lossAmount.multiply(math.sqrt(pd.multiply(BigDecimal.ONE.subtract(pd), mc)), mc);
            weight[i] = e.exposure().divide(total, mc);
            portfolioEl = portfolioEl.add(el[i], mc);
            sumUl = sumUl.add(ul[i], mc);
            if (weight[i].compareTo(SINGLE_NAME_LIMIT) > 0 && n > 1) {
                warnings.add("Exposure '" + e.name() + "' is "
                        + weight[i].multiply(Decimals.HUNDRED).setScale(1, RoundingMode.HALF_UP).toPlainString()
                        + "% of total portfolio (>10%)");
            }
        }

        // 2. Portfolio UL with uniform correlation
        BigDecimal ulSq = BigDecimal.ZERO;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                BigDecimal corr = i == j ? BigDecimal.ONE : rho;
                ulSq = ulSq.add(corr.multiply(ul[i], mc).multiply(ul[j], mc), mc);
            }
        }
        BigDecimal portfolioUl = math.sqrt(ulSq);
        BigDecimal diversification = sumUl.signum() > 0
                ? BigDecimal.ONE.subtract(portfolioUl.divide(sumUl, mc), mc)
                : BigDecimal.ZERO;

        // 3. Vasicek credit VaR
        BigDecimal sqrtRho = math.sqrt(rho);
        BigDecimal sqrtOneMinusRho = math.sqrt(BigDecimal.ONE.subtract(rho, mc));
        BigDecimal zConf = normal.inverseCdf(in.confidenceLevel());
        BigDecimal creditVar = BigDecimal.ZERO;
        for (Exposure e : exposures) {
            BigDecimal pdCond = conditionalPd(e.probabilityOfDefault(), rho, sqrtRho, sqrtOneMinusRho, zConf);
            creditVar = creditVar.add(e.exposure().multiply(e.lossGivenDefault(), mc).multiply(pdCond, mc), mc);
        }

        // 4. Risk attribution
        List<ExposureRisk> risks = new ArrayList<>(n);
        BigDecimal oneMinusRho = BigDecimal.ONE.subtract(rho, mc);
        for (int i = 0; i < n; i++) {
            BigDecimal marginal = BigDecimal.ZERO;
            if (portfolioUl.signum() > 0) {
                marginal = rho.multiply(ul[i], mc).multiply(portfolioUl, mc)
                        .add(oneMinusRho.multiply(ul[i], mc).multiply(ul[i], mc), mc)
                        .divide(portfolioUl, mc);
            }
            risks.add(new ExposureRisk(exposures.get(i).name(), el[i], ul[i], marginal,
                    weight[i].multiply(marginal, mc), weight[i]));
        }

        // 5. Concentration
        BigDecimal hhiName = BigDecimal.ZERO;
        BigDecimal portfolioPd = BigDecimal.ZERO;
        BigDecimal portfolioLgd = BigDecimal.ZERO;
        Map<String, BigDecimal> sectors = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            Exposure e = exposures.get(i);
            hhiName = hhiName.add(weight[i].multiply(weight[i], mc), mc);
            portfolioPd = portfolioPd.add(e.probabilityOfDefault().multiply(weight[i], mc), mc);
            portfolioLgd = portfolioLgd.add(e.lossGivenDefault().multiply(weight[i], mc), mc);
            String sector = e.sector() == null ? "" : e.sector();
            sectors.merge(sector, weight[i], (a, b) -> a.add(b, mc));
        }
        BigDecimal hhiSector = BigDecimal.ZERO;
        for (BigDecimal w : sectors.values())
            hhiSector = hhiSector.add(w.multiply(w, mc), mc);
        if (hhiName.compareTo(HHI_LIMIT) > 0)
            warnings.add("Portfolio is highly concentrated (HHI > 0.25)");

        return new Output(total, portfolioEl, portfolioUl, creditVar, creditVar.subtract(portfolioEl, mc),
                diversification, hhiName, hhiSector, BigDecimal.ONE.divide(hhiName, mc), portfolioPd, portfolioLgd,
                List.copyOf(risks));
    }

    private BigDecimal conditionalPd(BigDecimal pd, BigDecimal rho, BigDecimal sqrtRho, BigDecimal sqrtOneMinusRho,
            BigDecimal zConf) {
        if (rho.signum() == 0 || pd.signum() == 0 || Decimals.isOne(pd))
            return pd;
        BigDecimal arg = normal.inverseCdf(pd).add(sqrtRho.multiply(zConf, mc), mc).divide(sqrtOneMinusRho, mc);
        return normal.cdf(arg);
    }

    private static void requireUnit(String field, BigDecimal value) {
        require(value != null && value.signum() >= 0 && value.compareTo(BigDecimal.ONE) <= 0,
                field + " must be in [0, 1], got " + value);
    }
}
