package com.trading.fincalc.wiring;

import java.util.concurrent.CompletableFuture;

import com.trading.fincalc.fn.CalculationResult;
import com.trading.fincalc.fn.Calculator;

/**
 * A mutable request slot in the {@link CalculationLane} ring buffer.
 *
 * Pattern: Flyweight / Mutable Event
 *
 * Instances are pre-allocated when the ring buffer is built and reused for
 * every request; the consumer clears the slot once the future is completed so
 * it does not keep inputs or results reachable.
 */
public final class CalculationEvent {
    private Calculator<Object, Object> calculator;
    private Object input;
    private CompletableFuture<CalculationResult<Object>> future;
    private long sequenceId;

    /**
     * Configures the event for one calculation.
     *
     * @param calculator The calculator to run on the consumer thread.
     * @param input      Its input.
     * @param future     Completed with the result or the failure.
     * @param seqId      Producer-side correlation id.
     */
    @SuppressWarnings("unchecked")
    public <I, O> void set(Calculator<I, O> calculator, I input, CompletableFuture<CalculationResult<O>> future,
            long seqId) {
        this.calculator = (Calculator<Object, Object>) (Calculator<?, ?>) calculator;
        this.input = input;
        this.future = (CompletableFuture<CalculationResult<Object>>) (CompletableFuture<?>) future;
        this.sequenceId = seqId;
    }

    public Calculator<Object, Object> calculator() {
        return calculator;
    }

    public Object input() {
        return input;
    }

    public CompletableFuture<CalculationResult<Object>> future() {
        return future;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public boolean isEmpty() {
        return calculator == null;
    }

    public void clear() {
        calculator = null;
        input = null;
        future = null;
        sequenceId = 0;
    }
}
