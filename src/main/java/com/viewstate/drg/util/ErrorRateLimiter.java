package com.viewstate.drg.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of error logging per key.
 * A node that keeps failing on every pass logs at most once per interval;
 * other nodes are not silenced by it.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final ConcurrentHashMap<String, AtomicLong> lastLogTimes = new ConcurrentHashMap<>();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /**
     * @return true if the message was written
     */
    public boolean log(String key, String message, Throwable t) {
        long now = System.nanoTime();
        AtomicLong lastLogTime = lastLogTimes.computeIfAbsent(key, k -> new AtomicLong(now - minIntervalNanos - 1));
        long last = lastLogTime.get();
        if (now - last > minIntervalNanos) {
            // Only one thread logs per interval
            if (lastLogTime.compareAndSet(last, now)) {
                logger.error(message + " (Throttled)", t);
                return true;
            }
        }
        return false;
    }
}
