package com.nftindexer.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    @Test
    @DisplayName("tryAcquire allows first call and denies second immediately at 1/min")
    void tryAcquireOnePerMinute() {
        RateLimiter limiter = new RateLimiter(1);
        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isFalse();
    }

    @Test
    @DisplayName("acquire blocks for the minimum interval")
    void acquireBlocksThenAllows() throws InterruptedException {
        RateLimiter limiter = new RateLimiter(120);
        limiter.acquire();
        long start = System.nanoTime();
        limiter.acquire();
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        assertThat(elapsedMs).isGreaterThanOrEqualTo(400);
    }

    @Test
    @DisplayName("multiple threads respect rate")
    void multipleThreadsRespectRate() throws InterruptedException {
        int permitsPerMinute = 600;
        RateLimiter limiter = new RateLimiter(permitsPerMinute);
        int threadCount = 5;
        int acquiresPerThread = 4;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger(0);
        for (int t = 0; t < threadCount; t++) {
            new Thread(() -> {
                try {
                    start.await();
                    for (int i = 0; i < acquiresPerThread; i++) {
                        limiter.acquire();
                        successCount.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            }).start();
        }
        start.countDown();
        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        assertThat(successCount.get()).isEqualTo(threadCount * acquiresPerThread);
    }

    @Test
    @DisplayName("constructor rejects non-positive rate")
    void constructorRejectsNonPositive() {
        assertThatThrownBy(() -> new RateLimiter(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
    }

    @Test
    @DisplayName("interrupted wait surfaces as IllegalStateException and keeps the interrupt flag")
    void interruptedAcquire() throws InterruptedException {
        RateLimiter limiter = new RateLimiter(1);
        limiter.acquire();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        AtomicBoolean interruptFlag = new AtomicBoolean();
        Thread waiter = new Thread(() -> {
            try {
                limiter.acquire();
            } catch (IllegalStateException e) {
                failure.set(e);
                interruptFlag.set(Thread.currentThread().isInterrupted());
            }
        });
        waiter.start();
        waiter.interrupt();
        waiter.join(5_000);

        assertThat(failure.get()).isInstanceOf(IllegalStateException.class);
        assertThat(interruptFlag.get()).isTrue();
    }
}
