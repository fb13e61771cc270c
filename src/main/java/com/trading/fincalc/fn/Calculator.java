package com.trading.fincalc.fn;

/**
 * Functional interface for a calculation over a typed input.
 *
 * <p>
 * Called directly on the caller's thread, or optionally handed to a
 * {@link com.trading.fincalc.wiring.CalculationLane}. Implementations are
 * stateless between calls.
 *
 * @param <I> The input type.
 * @param <O> The output value type.
 */
@FunctionalInterface
public interface Calculator<I, O> {
    /**
     * Runs the calculation.
     *
     * @param input The input.
     * @return The value together with methodology and warnings.
     */
    CalculationResult<O> apply(I input);
}
