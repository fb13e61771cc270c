package com.trading.fincalc.wiring;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.trading.fincalc.fn.CalculationResult;
import com.trading.fincalc.fn.Calculator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs calculators one at a time behind an LMAX Disruptor ring buffer.
 *
 * <p>
 * Optional: calculators and the kernel are synchronous and can be called
 * directly from any thread. The lane is for callers that want to hand work
 * off. Any number of producer threads may {@link #submit} work; a single
 * daemon consumer thread evaluates it in sequence order through
 * {@link CalculationPublisher}. Results arrive through the returned future.
 */
public final class CalculationLane implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(CalculationLane.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Disruptor<CalculationEvent> disruptor;
    private final RingBuffer<CalculationEvent> ringBuffer;
    private final CalculationPublisher publisher;
    private final AtomicLong submitted = new AtomicLong();
    private volatile boolean closed;

    /**
     * @param ringBufferSize     Slots in the ring buffer, a power of two.
     * @param warnIntervalMillis Throttle for failure logging.
     */
    public CalculationLane(int ringBufferSize, long warnIntervalMillis) {
        if (ringBufferSize < 1 || Integer.bitCount(ringBufferSize) != 1)
            throw new IllegalArgumentException("ringBufferSize must be a power of 2, got " + ringBufferSize);

        this.publisher = new CalculationPublisher(warnIntervalMillis);
        this.disruptor = new Disruptor<>(
                CalculationEvent::new,
                ringBufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(publisher);
        this.ringBuffer = disruptor.start();
        log.info("Calculation lane started (ring buffer size {})", ringBufferSize);
    }

    public CalculationLane() {
        this(1024, 1000);
    }

    /**
     * Queues a calculation. Blocks while the ring buffer is full.
     *
     * @return Completed with the result, or exceptionally with the
     *         calculator's failure.
     * @throws IllegalStateException once the lane is closed.
     */
    public <I, O> CompletableFuture<CalculationResult<O>> submit(Calculator<I, O> calculator, I input) {
        if (closed)
            throw new IllegalStateException("Calculation lane is closed");
        CompletableFuture<CalculationResult<O>> future = new CompletableFuture<>();
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).set(calculator, input, future, submitted.incrementAndGet());
        } finally {
            ringBuffer.publish(sequence);
        }
        return future;
    }

    public long submittedCount() {
        return submitted.get();
    }

    public long completedCount() {
        return publisher.completedCount();
    }

    public long failedCount() {
        return publisher.failedCount();
    }

    /** Drains queued work, then stops the consumer thread. */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        try {
            disruptor.shutdown(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.error("Calculation lane did not drain within {}s, halting", SHUTDOWN_TIMEOUT_SECONDS, e);
            disruptor.halt();
        }
        log.info("Calculation lane closed: {} submitted, {} completed, {} failed",
                submitted.get(), completedCount(), failedCount());
    }
}
