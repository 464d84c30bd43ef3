package com.medscript.safety;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Enforces a minimum spacing between consecutive calls to the inference endpoint.
 *
 * Callers serialize on an internal lock, so concurrent requests are spaced
 * one after another instead of all passing after the same delay.
 */
public class RateLimiter {

    private final long minDelayNanos;
    private final ReentrantLock lock = new ReentrantLock();

    private long lastCallNanos;
    private boolean called;

    public RateLimiter(Duration minDelay) {
        this.minDelayNanos = minDelay.isNegative() ? 0 : minDelay.toNanos();
    }

    /**
     * Blocks until the minimum delay since the previous permitted call has passed,
     * then records this call.
     */
    public void waitIfNeeded() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            if (called) {
                long remaining = minDelayNanos - (System.nanoTime() - lastCallNanos);
                if (remaining > 0) {
                    TimeUnit.NANOSECONDS.sleep(remaining);
                }
            }
            lastCallNanos = System.nanoTime();
            called = true;
        } finally {
            lock.unlock();
        }
    }
}
