package com.trading.fincalc.error;

import java.math.BigDecimal;

import lombok.Getter;

/**
 * A Newton-type iteration exhausted its ceiling, or its derivative vanished,
 * before meeting tolerance.
 *
 * <p>
 * Non-fatal. The last iterate is kept so callers can fall back to it.
 */
@Getter
public class ConvergenceException extends KernelException {
    private final String function;
    private final int iterations;
    private final BigDecimal lastResidual;
    private final BigDecimal lastRate;

    public ConvergenceException(String function, int iterations, BigDecimal lastResidual, BigDecimal lastRate) {
        super(function + " did not converge after " + iterations + " iterations (residual="
                + (lastResidual == null ? "n/a" : lastResidual.toPlainString()) + ")");
        this.function = function;
        this.iterations = iterations;
        this.lastResidual = lastResidual;
        this.lastRate = lastRate;
    }
}
