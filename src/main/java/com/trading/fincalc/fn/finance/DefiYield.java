package com.trading.fincalc.fn.finance;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import com.trading.fincalc.DecimalKernel;
import com.trading.fincalc.api.DecimalMath;
import com.trading.fincalc.fn.AbstractCalculator;
import com.trading.fincalc.math.Decimals;

/**
 * Yield analysis for four kinds of on-chain position.
 * <ul>
 * <li>{@link YieldFarm}: APY from APR compounded {@code n} times a year, less
 * annualized gas.</li>
 * <li>{@link ImpermanentLoss}: loss of a 50/50 constant-product LP against
 * holding, {@code IL = 2 sqrt(r) / (1 + r) - 1}, set against fee income.</li>
 * <li>{@link Staking}: reward net of commission, optionally compounded daily,
 * less expected slashing.</li>
 * <li>{@link LiquidityPool}: fee APY from the pool share of daily volume plus
 * the impermanent loss of a given price move.</li>
 * </ul>
 * Fields of {@link Output} that do not apply to the position are null.
 */
public final class DefiYield extends AbstractCalculator<DefiYield.Input, DefiYield.Output> {
    private static final BigDecimal DAYS_PER_YEAR = BigDecimal.valueOf(365);
    private static final BigDecimal APR_SANITY_LIMIT = BigDecimal.TEN;
    private static final BigDecimal SIGNIFICANT_IL = new BigDecimal("0.10");
    private static final BigDecimal HIGH_SLASHING = new BigDecimal("0.05");
    private static final int LONG_UNBONDING_DAYS = 28;

    static final String FEES_EXCEED_IL = "Fees exceed IL";
    static final String IL_EXCEEDS_FEES = "IL exceeds fees";

    /** One of the position records below. */
    public interface Position {
    }

    /**
     * @param rewardApr          Token incentive APR, may be null.
     * @param gasCostPerCompound Cost of one harvest-and-restake, may be null.
     */
    public record YieldFarm(BigDecimal baseApr, BigDecimal rewardApr, int compoundingFrequency,
            BigDecimal gasCostPerCompound, BigDecimal principal, int holdingPeriodDays) implements Position {
    }

    /**
     * @param poolFeeApr        Fee APR earned by the LP, may be null.
     * @param holdingPeriodDays Days held; null means a full year.
     */
    public record ImpermanentLoss(BigDecimal initialPriceA, BigDecimal initialPriceB, BigDecimal finalPriceA,
            BigDecimal finalPriceB, BigDecimal initialDepositValue, BigDecimal poolFeeApr,
            Integer holdingPeriodDays) implements Position {
    }

    public record Staking(BigDecimal stakedAmount, BigDecimal annualRewardRate, BigDecimal validatorCommission,
            BigDecimal slashingProbability, BigDecimal slashingPenalty, int unbondingPeriodDays,
            boolean compounding) implements Position {
    }

    /**
     * @param poolFeeRate    Fee per unit of volume, e.g. 0.003.
     * @param priceChangePct Relative move of one token against the other,
     *                       e.g. -0.5 for a halving.
     */
    public record LiquidityPool(BigDecimal poolTvl, BigDecimal userDeposit, BigDecimal dailyVolume,
            BigDecimal poolFeeRate, BigDecimal priceChangePct) implements Position {
    }

    public record Input(String protocolName, Position position) {
    }

    /**
     * @param analysisType   Simple name of the position record.
     * @param effectiveApy   Headline APY of the position.
     * @param totalReturn    Money return over the holding period (a year for
     *                       staking and pools).
     * @param ilVersusFees   "Fees exceed IL" or "IL exceeds fees".
     * @param poolFeeIncome  Fee income over the holding period.
     */
    public record Output(String analysisType, BigDecimal effectiveApy, BigDecimal netApy, BigDecimal totalReturn,
            BigDecimal impermanentLossPct, BigDecimal impermanentLossAmount, String ilVersusFees,
            BigDecimal stakingNetYield, BigDecimal stakingExpectedAnnualReward, BigDecimal poolShare,
            BigDecimal poolFeeIncome, BigDecimal riskAdjustedApy) {
    }

    private final DecimalMath math;

    public DefiYield(DecimalKernel kernel) {
        super(kernel);
        this.math = kernel.math();
    }

    @Override
    protected String methodology() {
        return "DeFi yield analysis (iterative compounding, constant-product impermanent loss)";
    }

    @Override
    protected void validate(Input in) {
        require(in.position() != null, "position is required");
        if (in.position() instanceof YieldFarm f) {
            require(f.compoundingFrequency() > 0, "compoundingFrequency must be > 0");
            requirePositive("principal", f.principal());
            require(f.baseApr() != null && f.baseApr().signum() >= 0, "baseApr must be >= 0");
            require(f.holdingPeriodDays() >= 0, "holdingPeriodDays must be >= 0");
        } else if (in.position() instanceof ImpermanentLoss il) {
            requirePositive("initialPriceA", il.initialPriceA());
            requirePositive("initialPriceB", il.initialPriceB());
            requirePositive("finalPriceA", il.finalPriceA());
            requirePositive("finalPriceB", il.finalPriceB());
            requirePositive("initialDepositValue", il.initialDepositValue());
            require(il.holdingPeriodDays() == null || il.holdingPeriodDays() >= 0,
                    "holdingPeriodDays must be >= 0");
        } else if (in.position() instanceof Staking s) {
            requirePositive("stakedAmount", s.stakedAmount());
            require(s.annualRewardRate() != null && s.annualRewardRate().signum() >= 0,
                    "annualRewardRate must be >= 0");
            requireUnit("validatorCommission", s.validatorCommission());
            requireUnit("slashingProbability", s.slashingProbability());
            requireUnit("slashingPenalty", s.slashingPenalty());
        } else if (in.position() instanceof LiquidityPool p) {
            requirePositive("poolTvl", p.poolTvl());
            requirePositive("userDeposit", p.userDeposit());
            require(p.dailyVolume() != null && p.dailyVolume().signum() >= 0, "dailyVolume must be >= 0");
            requireUnit("poolFeeRate", p.poolFeeRate());
            require(p.priceChangePct() != null, "priceChangePct is required");
        } else {
            throw new IllegalArgumentException("Unsupported position " + in.position().getClass().getSimpleName());
        }
    }

    @Override
    protected Output calculate(Input in, List<String> warnings) {
        Position position = in.position();
        if (position instanceof YieldFarm f)
            return yieldFarm(f, warnings);
        if (position instanceof ImpermanentLoss il)
            return impermanentLoss(il, warnings);
        if (position instanceof Staking s)
            return staking(s, warnings);
        return liquidityPool((LiquidityPool) position, warnings);
    }

    private Output yieldFarm(YieldFarm f, List<String> warnings) {
        BigDecimal totalApr = f.baseApr().add(f.rewardApr() == null ? BigDecimal.ZERO : f.rewardApr(), mc);
        if (totalApr.compareTo(APR_SANITY_LIMIT) > 0)
            warnings.add("APR exceeds 1000%, verify this is correct");

        int n = f.compoundingFrequency();
        BigDecimal apy = compound(totalApr.divide(BigDecimal.valueOf(n), mc), n).subtract(BigDecimal.ONE, mc);

        BigDecimal gasDrag = BigDecimal.ZERO;
        if (f.gasCostPerCompound() != null)
            gasDrag = f.gasCostPerCompound().multiply(BigDecimal.valueOf(n), mc).divide(f.principal(), mc);
        BigDecimal netApy = apy.subtract(gasDrag, mc);
        if (netApy.signum() < 0)
            warnings.add("Gas costs exceed yield, position is net negative");

        BigDecimal holding = BigDecimal.valueOf(f.holdingPeriodDays()).divide(DAYS_PER_YEAR, mc);
        BigDecimal totalReturn = f.principal().multiply(netApy, mc).multiply(holding, mc);
        return new Output("YieldFarm", apy, netApy, totalReturn, null, null, null, null, null, null, null, null);
    }

    private Output impermanentLoss(ImpermanentLoss il, List<String> warnings) {
        BigDecimal ratioA = il.finalPriceA().divide(il.initialPriceA(), mc);
        BigDecimal ratioB = il.finalPriceB().divide(il.initialPriceB(), mc);
        BigDecimal lossPct = lossPct(ratioA.divide(ratioB, mc));
        BigDecimal deposit = il.initialDepositValue();
        BigDecimal lossAmount = deposit.multiply(lossPct.abs(), mc);

        int days = il.holdingPeriodDays() == null ? 365 : il.holdingPeriodDays();
        BigDecimal holding = BigDecimal.valueOf(days).divide(DAYS_PER_YEAR, mc);
        BigDecimal feeIncome = il.poolFeeApr() == null
                ? BigDecimal.ZERO
                : deposit.multiply(il.poolFeeApr(), mc).multiply(holding, mc);
        String verdict = null;
        if (feeIncome.signum() > 0)
            verdict = feeIncome.compareTo(lossAmount) >= 0 ? FEES_EXCEED_IL : IL_EXCEEDS_FEES;

        BigDecimal netGain = feeIncome.subtract(lossAmount, mc);
        BigDecimal apy = holding.signum() > 0 ? netGain.divide(deposit, mc).divide(holding, mc) : BigDecimal.ZERO;
        if (lossPct.abs().compareTo(SIGNIFICANT_IL) > 0) {
            warnings.add("Impermanent loss is significant: "
                    + lossPct.multiply(Decimals.HUNDRED).setScale(2, RoundingMode.HALF_EVEN).toPlainString() + "%");
        }
        return new Output("ImpermanentLoss", apy, null, netGain, lossPct, lossAmount, verdict, null, null, null,
                feeIncome, null);
    }

    private Output staking(Staking s, List<String> warnings) {
        BigDecimal netYield = s.annualRewardRate().multiply(BigDecimal.ONE.subtract(s.validatorCommission(), mc), mc);
        BigDecimal apy = s.compounding()
                ? compound(netYield.divide(DAYS_PER_YEAR, mc), 365).subtract(BigDecimal.ONE, mc)
                : netYield;
        BigDecimal riskAdjusted = apy.subtract(s.slashingProbability().multiply(s.slashingPenalty(), mc), mc);

        if (riskAdjusted.signum() < 0)
            warnings.add("Risk-adjusted yield is negative, slashing risk exceeds rewards");
        if (s.slashingProbability().compareTo(HIGH_SLASHING) > 0)
            warnings.add("Slashing probability exceeds 5%, high-risk validator");
        if (s.unbondingPeriodDays() > LONG_UNBONDING_DAYS)
            warnings.add("Unbonding period is " + s.unbondingPeriodDays()
                    + " days, capital locked for extended period");

        return new Output("Staking", apy, null, s.stakedAmount().multiply(riskAdjusted, mc), null, null, null,
                netYield, s.stakedAmount().multiply(apy, mc), null, null, riskAdjusted);
    }

    private Output liquidityPool(LiquidityPool p, List<String> warnings) {
        if (p.userDeposit().compareTo(p.poolTvl()) > 0)
            warnings.add("User deposit exceeds pool TVL, check inputs");

        BigDecimal share = p.userDeposit().divide(p.poolTvl(), mc);
        BigDecimal annualFees = p.dailyVolume().multiply(p.poolFeeRate(), mc).multiply(share, mc)
                .multiply(DAYS_PER_YEAR, mc);
        BigDecimal feeApy = annualFees.divide(p.userDeposit(), mc);

        BigDecimal priceRatio = BigDecimal.ONE.add(p.priceChangePct(), mc);
        BigDecimal lossPct = BigDecimal.ZERO;
        if (priceRatio.signum() > 0) {
            lossPct = lossPct(priceRatio);
        } else {
            warnings.add("Price ratio non-positive after change, IL undefined");
        }
        BigDecimal lossAmount = p.userDeposit().multiply(lossPct.abs(), mc);
        String verdict = annualFees.compareTo(lossAmount) >= 0 ? FEES_EXCEED_IL : IL_EXCEEDS_FEES;

        // lossPct <= 0
        BigDecimal apy = feeApy.add(lossPct, mc);
        if (apy.signum() < 0)
            warnings.add("Net APY is negative, impermanent loss exceeds fee income");

        return new Output("LiquidityPool", apy, null, annualFees.subtract(lossAmount, mc), lossPct, lossAmount,
                verdict, null, null, share, annualFees, null);
    }

    /** {@code 2 sqrt(r) / (1 + r) - 1}, never positive. */
    private BigDecimal lossPct(BigDecimal priceRatio) {
        return Decimals.TWO.multiply(math.sqrt(priceRatio), mc)
                .divide(BigDecimal.ONE.add(priceRatio, mc), mc)
                .subtract(BigDecimal.ONE, mc);
    }

    /** (1 + rate)^n by repeated multiplication. */
    private BigDecimal compound(BigDecimal rate, int n) {
        BigDecimal factor = BigDecimal.ONE.add(rate, mc);
        BigDecimal result = BigDecimal.ONE;
        for (int i = 0; i < n; i++)
            result = result.multiply(factor, mc);
        return result;
    }

    private static void requirePositive(String field, BigDecimal value) {
        require(value != null && value.signum() > 0, field + " must be positive");
    }

    private static void requireUnit(String field, BigDecimal value) {
        require(value != null && value.signum() >= 0 && value.compareTo(BigDecimal.ONE) <= 0,
                field + " must be in [0, 1], got " + value);
    }
}
