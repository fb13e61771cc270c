package com.trading.fincalc.config;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/**
 * Numerical budgets and thresholds of the decimal kernel.
 *
 * <p>
 * Every iteration count here is a fixed budget, not a ceiling for an adaptive
 * loop: the same settings always produce the same digits. Bound from
 * {@code fincalc-kernel.json} by {@link KernelSettingsLoader}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class KernelSettings {
    private int precision = 28;
    private RoundingMode roundingMode = RoundingMode.HALF_EVEN;

    private int sqrtIterations = 20;
    private int expTaylorTerms = 40;
    private int lnIterations = 40;
    private int cosTaylorTerms = 20;
    private int powFractionTerms = 15;
    private BigDecimal powFractionCutoff = new BigDecimal("0.00000000001");

    private BigDecimal singularPivotThreshold = new BigDecimal("0.0000000001");
    private BigDecimal inverseCdfClamp = new BigDecimal("0.0000001");

    private DomainPolicy domainPolicy = DomainPolicy.SENTINEL;

    /** Interval between two throttled warnings from the same component. */
    private long warnIntervalMillis = 1000;

    @JsonIgnore
    public MathContext mathContext() {
        return new MathContext(precision, roundingMode);
    }

    /** Independent copy, so later setter calls on either side are not shared. */
    public KernelSettings copy() {
        KernelSettings c = new KernelSettings();
        c.precision = precision;
        c.roundingMode = roundingMode;
        c.sqrtIterations = sqrtIterations;
        c.expTaylorTerms = expTaylorTerms;
        c.lnIterations = lnIterations;
        c.cosTaylorTerms = cosTaylorTerms;
        c.powFractionTerms = powFractionTerms;
        c.powFractionCutoff = powFractionCutoff;
        c.singularPivotThreshold = singularPivotThreshold;
        c.inverseCdfClamp = inverseCdfClamp;
        c.domainPolicy = domainPolicy;
        c.warnIntervalMillis = warnIntervalMillis;
        return c;
    }

    /**
     * Rejects budgets that would break the kernel's guarantees.
     *
     * @return this, for chaining
     * @throws IllegalArgumentException on the first invalid field
     */
    public KernelSettings validate() {
        if (precision < 16)
            throw new IllegalArgumentException("precision must be >= 16, got " + precision);
        if (roundingMode == null || roundingMode == RoundingMode.UNNECESSARY)
            throw new IllegalArgumentException("roundingMode must be a rounding mode, got " + roundingMode);
        requirePositive("sqrtIterations", sqrtIterations);
        requirePositive("expTaylorTerms", expTaylorTerms);
        requirePositive("lnIterations", lnIterations);
        requirePositive("cosTaylorTerms", cosTaylorTerms);
        requirePositive("powFractionTerms", powFractionTerms);
        requirePositive("powFractionCutoff", powFractionCutoff);
        requirePositive("singularPivotThreshold", singularPivotThreshold);
        requirePositive("inverseCdfClamp", inverseCdfClamp);
        if (inverseCdfClamp.compareTo(new BigDecimal("0.5")) >= 0)
            throw new IllegalArgumentException("inverseCdfClamp must be < 0.5, got " + inverseCdfClamp);
        if (domainPolicy == null)
            throw new IllegalArgumentException("domainPolicy is required");
        if (warnIntervalMillis < 0)
            throw new IllegalArgumentException("warnIntervalMillis must be >= 0");
        return this;
    }

    private static void requirePositive(String field, int value) {
        if (value <= 0)
            throw new IllegalArgumentException(field + " must be > 0, got " + value);
    }

    private static void requirePositive(String field, BigDecimal value) {
        if (value == null || value.signum() <= 0)
            throw new IllegalArgumentException(field + " must be > 0, got " + value);
    }
}
