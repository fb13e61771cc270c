package com.trading.fincalc.fn;

import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;

import com.trading.fincalc.DecimalKernel;
import com.trading.fincalc.error.KernelException;
import com.trading.fincalc.util.RateLimitedLogger;

import lombok.extern.log4j.Log4j2;

/**
 * Base class for calculators. Handles input checks, timing and error logging.
 * <p>
 * Kernel failures the subclass does not handle itself are logged through a
 * rate limiter and rethrown; invalid input surfaces as
 * {@link IllegalArgumentException} without logging.
 */
@Log4j2
public abstract class AbstractCalculator<I, O> implements Calculator<I, O> {
    private final RateLimitedLogger limiter;
    protected final DecimalKernel kernel;
    protected final MathContext mc;

    protected AbstractCalculator(DecimalKernel kernel) {
        this.kernel = kernel;
        this.mc = kernel.math().mathContext();
        this.limiter = new RateLimitedLogger(log, kernel.settings().getWarnIntervalMillis());
    }

    @Override
    public final CalculationResult<O> apply(I input) {
        if (input == null) {
            throw new IllegalArgumentException(getClass().getSimpleName() + ": input is required");
        }
        validate(input);

        long start = System.nanoTime();
        List<String> warnings = new ArrayList<>();
        O value;
        try {
            value = calculate(input, warnings);
        } catch (KernelException e) {
            limiter.error("Error evaluating " + getClass().getSimpleName(), e);
            throw e;
        }
        long elapsedMicros = (System.nanoTime() - start) / 1_000;
        return new CalculationResult<>(methodology(), value, warnings, elapsedMicros);
    }

    /**
     * Rejects unusable input.
     *
     * @throws IllegalArgumentException on the first violation
     */
    protected void validate(I input) {
    }

    protected abstract String methodology();

    /**
     * Subclasses implement the actual logic here.
     *
     * @param input    Validated input.
     * @param warnings Collector for non-fatal issues.
     */
    protected abstract O calculate(I input, List<String> warnings);

    protected static void require(boolean condition, String message) {
        if (!condition)
            throw new IllegalArgumentException(message);
    }
}
