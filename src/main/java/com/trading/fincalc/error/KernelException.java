package com.trading.fincalc.error;

/**
 * Base type for every typed failure raised by the decimal kernel.
 *
 * <p>
 * Kernel failures are outcome values, not aborts: callers catch the concrete
 * subtype and either substitute a default, surface a warning, or propagate.
 */
public abstract class KernelException extends RuntimeException {

    protected KernelException(String message) {
        super(message);
    }

    protected KernelException(String message, Throwable cause) {
        super(message, cause);
    }
}
