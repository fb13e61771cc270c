package com.trading.fincalc.error;

import java.math.BigDecimal;

import lombok.Getter;

/**
 * Result too large to represent, e.g. exp of a huge positive argument.
 */
@Getter
public class OverflowException extends KernelException {
    private final String function;
    private final BigDecimal argument;

    public OverflowException(String function, BigDecimal argument) {
        super(function + " overflows for argument " + argument);
        this.function = function;
        this.argument = argument;
    }
}
