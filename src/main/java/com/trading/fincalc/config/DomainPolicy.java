package com.trading.fincalc.config;

/**
 * What a transcendental function does with an argument outside its domain.
 */
public enum DomainPolicy {
    /** Return the legacy guard value (sqrt: 0, ln: -999, acosh: 0) and log a throttled warning. */
    SENTINEL,
    /** Throw {@link com.trading.fincalc.error.DomainException}. */
    FAIL
}
