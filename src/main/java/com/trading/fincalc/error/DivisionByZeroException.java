package com.trading.fincalc.error;

import lombok.Getter;

/**
 * A computation required dividing by an exact zero.
 */
@Getter
public class DivisionByZeroException extends KernelException {
    private final String context;

    public DivisionByZeroException(String context) {
        super("Division by zero: " + context);
        this.context = context;
    }
}
