package com.plant.flowsheet.util;

import org.apache.logging.log4j.Logger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of error logging.
 * A failing component in a long simulation would otherwise log once per
 * step; messages inside the interval are counted and reported with the next
 * one that gets through.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(Long.MIN_VALUE);
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /** @return true if the message was logged, false if it was throttled. */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if ((last == Long.MIN_VALUE || now - last > minIntervalNanos) && lastLogTime.compareAndSet(last, now)) {
            long skipped = suppressed.getAndSet(0);
            if (skipped > 0)
                logger.error("{} ({} similar errors suppressed)", message, skipped, t);
            else
                logger.error(message, t);
            return true;
        }
        suppressed.incrementAndGet();
        return false;
    }

    public long suppressedCount() {
        return suppressed.get();
    }
}
