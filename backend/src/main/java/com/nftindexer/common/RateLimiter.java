package com.nftindexer.common;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Minimum-interval limiter for a throttled HTTP API such as the CoinGecko free tier. The quota belongs to the API
 * key, not to a caller, so one instance is a singleton bean per API and every resolver thread draws from it:
 * parallel normalization workers then stay under the per-minute limit together.
 */
public class RateLimiter {

    private final long minIntervalNanos;
    private final AtomicLong nextFreeAtNanos = new AtomicLong(0);

    /**
     * @param permitsPerMinute e.g. 30 for one call every two seconds
     */
    public RateLimiter(int permitsPerMinute) {
        if (permitsPerMinute <= 0) {
            throw new IllegalArgumentException("permitsPerMinute must be positive");
        }
        this.minIntervalNanos = 60_000_000_000L / permitsPerMinute;
    }

    /**
     * Blocks until a permit is available. Interrupts are restored on the thread and surface as
     * {@link IllegalStateException} so resolver guards treat them as a failed call.
     */
    public void acquire() {
        while (true) {
            long now = System.nanoTime();
            long next = nextFreeAtNanos.get();
            if (now >= next) {
                if (nextFreeAtNanos.compareAndSet(next, now + minIntervalNanos)) {
                    return;
                }
                continue;
            }
            long sleepNanos = next - now;
            try {
                Thread.sleep(sleepNanos / 1_000_000, (int) (sleepNanos % 1_000_000));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Rate limiter interrupted", e);
            }
        }
    }

    /**
     * Non-blocking: takes a permit if one is free right now.
     */
    public boolean tryAcquire() {
        long now = System.nanoTime();
        long next = nextFreeAtNanos.get();
        return now >= next && nextFreeAtNanos.compareAndSet(next, now + minIntervalNanos);
    }
}
