package com.trading.fincalc.util;

import org.apache.logging.log4j.Logger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Throttles log output from code that may fail or degrade on every call.
 * <p>
 * A sentinel fallback inside a solver loop, or a calculator failing for a whole
 * batch, would otherwise flood the log. At most one message per interval is
 * written; suppressed messages are counted and reported with the next one.
 */
public class RateLimitedLogger {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime;
    private final AtomicLong suppressed = new AtomicLong();

    public RateLimitedLogger(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
        // First message is always written.
        this.lastLogTime = new AtomicLong(System.nanoTime() - this.minIntervalNanos - 1);
    }

    public void warn(String message) {
        if (acquire()) {
            logger.warn("{}{}", message, suffix());
        }
    }

    public void error(String message, Throwable t) {
        if (acquire()) {
            logger.error(message + suffix(), t);
        }
    }

    /** Messages dropped since the last one written. */
    public long suppressedCount() {
        return suppressed.get();
    }

    private boolean acquire() {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        // Only one thread wins the slot for an interval.
        if (now - last > minIntervalNanos && lastLogTime.compareAndSet(last, now)) {
            return true;
        }
        suppressed.incrementAndGet();
        return false;
    }

    private String suffix() {
        long dropped = suppressed.getAndSet(0);
        return dropped == 0 ? " (throttled)" : " (throttled, " + dropped + " suppressed)";
    }
}
