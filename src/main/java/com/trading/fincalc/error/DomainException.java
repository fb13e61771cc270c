package com.trading.fincalc.error;

import java.math.BigDecimal;

import lombok.Getter;

/**
 * Argument outside a function's real domain (sqrt of a negative, ln of a
 * non-positive value, acosh below one).
 *
 * <p>
 * Only raised under {@link com.trading.fincalc.config.DomainPolicy#FAIL}.
 */
@Getter
public class DomainException extends KernelException {
    private final String function;
    private final BigDecimal argument;

    public DomainException(String function, BigDecimal argument) {
        super(function + " is undefined for argument " + argument.toPlainString());
        this.function = function;
        this.argument = argument;
    }
}
