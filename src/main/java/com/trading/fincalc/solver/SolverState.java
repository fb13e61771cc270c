package com.trading.fincalc.solver;

import java.math.BigDecimal;

import lombok.Getter;

/**
 * Working state of a single Newton-Raphson solve. Created per call, never
 * shared.
 */
@Getter
public final class SolverState {
    private BigDecimal rate;
    private int iteration;
    private BigDecimal residual;
    private BigDecimal derivative;

    SolverState(BigDecimal initialRate) {
        this.rate = initialRate;
    }

    void evaluated(BigDecimal npv, BigDecimal dnpv) {
        this.residual = npv;
        this.derivative = dnpv;
    }

    void step(BigDecimal nextRate) {
        this.rate = nextRate;
        this.iteration++;
    }

    @Override
    public String toString() {
        return "SolverState[rate=" + rate + ", iteration=" + iteration + ", residual=" + residual
                + ", derivative=" + derivative + "]";
    }
}
