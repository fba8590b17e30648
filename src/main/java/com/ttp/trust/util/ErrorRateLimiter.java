package com.ttp.trust.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Throttles error logging on hot paths. At most one message is written per
 * interval; the next written message reports how many were dropped.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(System.nanoTime() - Long.MAX_VALUE / 2);
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /** @return true if the message was written */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        // One thread wins the interval; the rest are counted.
        if (now - last > minIntervalNanos && lastLogTime.compareAndSet(last, now)) {
            long dropped = suppressed.getAndSet(0);
            if (dropped > 0)
                logger.error("{} ({} similar errors suppressed)", message, dropped, t);
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
