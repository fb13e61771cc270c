package com.trading.fincalc.solver;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One amount at a time offset measured in solver periods.
 *
 * @param time   Offset from the valuation point, in periods. May be fractional.
 * @param amount Signed amount; outflows are negative.
 */
public record CashFlow(BigDecimal time, BigDecimal amount) {

    public CashFlow {
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(amount, "amount");
        if (time.signum() < 0)
            throw new IllegalArgumentException("Cash flow time must be >= 0, got " + time);
    }
}
