package com.trading.fincalc.wiring;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

import com.lmax.disruptor.EventHandler;
import com.trading.fincalc.fn.CalculationResult;
import com.trading.fincalc.util.RateLimitedLogger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Disruptor EventHandler that runs calculations and completes their futures.
 *
 * Runs on the lane's single consumer thread. A failing calculation completes
 * its future exceptionally; it never propagates to the Disruptor, so the
 * consumer keeps draining the ring buffer.
 */
public final class CalculationPublisher implements EventHandler<CalculationEvent> {
    private static final Logger log = LogManager.getLogger(CalculationPublisher.class);

    private final RateLimitedLogger limiter;
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public CalculationPublisher(long warnIntervalMillis) {
        this.limiter = new RateLimitedLogger(log, warnIntervalMillis);
    }

    /**
     * Process a single event from the ring buffer.
     *
     * @param event      The event carried by the ring buffer.
     * @param sequence   The sequence ID of the event.
     * @param endOfBatch Flag indicating if this is the last event in the current
     *                   batch.
     */
    @Override
    public void onEvent(CalculationEvent event, long sequence, boolean endOfBatch) {
        if (event.isEmpty()) {
            log.error("Received empty calculation event at sequence {}", sequence);
            return;
        }
        CompletableFuture<CalculationResult<Object>> future = event.future();
        try {
            CalculationResult<Object> result = event.calculator().apply(event.input());
            completed.incrementAndGet();
            future.complete(result);
        } catch (Throwable t) {
            // Do not rethrow, to keep consumer thread alive.
            failed.incrementAndGet();
            limiter.warn("Calculation " + event.sequenceId() + " failed: " + t);
            future.completeExceptionally(t);
        } finally {
            event.clear();
        }
    }

    public long completedCount() {
        return completed.get();
    }

    public long failedCount() {
        return failed.get();
    }
}
