package com.trading.fincalc.error;

/**
 * Operands of a linear-algebra operation are not conformable.
 */
public class DimensionMismatchException extends KernelException {

    public DimensionMismatchException(String message) {
        super(message);
    }
}
