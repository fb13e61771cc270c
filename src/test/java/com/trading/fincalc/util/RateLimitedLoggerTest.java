package com.trading.fincalc.util;

import org.apache.logging.log4j.LogManager;
import org.junit.Test;

import static org.junit.Assert.*;

public class RateLimitedLoggerTest {

    @Test
    public void testSuppressesWithinInterval() {
        RateLimitedLogger limiter = new RateLimitedLogger(LogManager.getLogger(RateLimitedLoggerTest.class), 60_000);

        limiter.warn("first");
        assertEquals(0, limiter.suppressedCount());

        limiter.warn("second");
        limiter.error("third", new RuntimeException("boom"));
        assertEquals(2, limiter.suppressedCount());
    }

    @Test
    public void testLogsAgainAfterInterval() throws Exception {
        RateLimitedLogger limiter = new RateLimitedLogger(LogManager.getLogger(RateLimitedLoggerTest.class), 250);

        limiter.warn("first");
        limiter.warn("second");
        assertEquals(1, limiter.suppressedCount());

        Thread.sleep(400);
        limiter.warn("third");
        // The written message reports and resets the suppressed count
        assertEquals(0, limiter.suppressedCount());
    }
}
