package com.portfolio.mirror.service.gateway;

import com.portfolio.mirror.common.exception.RateLimitExceededException;
import com.portfolio.mirror.common.exception.UpstreamUnavailableException;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-wide admission gate for brokerage calls: at most {@code maxConcurrent} in flight and at most
 * {@code maxPerSecond} started in any rolling one-second window, shared by all persons and endpoints.
 * <p>
 * Over-budget calls wait, they are not rejected. Waiters are released in arrival order.
 * A call that waits longer than {@code maxWait} fails with {@code BulkheadFullException} or
 * {@link RateLimitExceededException}; an interrupted waiter leaves without recording a start.
 */
@Slf4j
public class UpstreamRateLimiter {

    private static final long WINDOW_NANOS = TimeUnit.SECONDS.toNanos(1);

    private final String name;
    private final Bulkhead bulkhead;
    private final Duration maxWait;

    // Start times of the last maxPerSecond admitted calls; once full, starts[next] is the oldest.
    private final ReentrantLock windowLock = new ReentrantLock(true);
    private final long[] starts;
    private int next;
    private int recorded;

    public UpstreamRateLimiter(String name, int maxPerSecond, int maxConcurrent, Duration maxWait) {
        if (maxPerSecond < 1 || maxConcurrent < 1) {
            throw new IllegalArgumentException("Limiter budgets must be positive");
        }
        this.name = name;
        this.maxWait = maxWait;
        this.starts = new long[maxPerSecond];
        this.bulkhead = Bulkhead.of(name, BulkheadConfig.custom()
                .maxConcurrentCalls(maxConcurrent)
                .maxWaitDuration(maxWait)
                .fairCallHandlingStrategyEnabled(true)
                .build());
        log.info("Upstream limiter '{}': {} calls/s, {} concurrent, max wait {}", name, maxPerSecond,
                maxConcurrent, maxWait);
    }

    /**
     * Runs {@code call} once it holds a concurrency slot and a start slot. The concurrency slot is held until
     * the call returns or throws.
     */
    public <T> T execute(Supplier<T> call) {
        return Bulkhead.<T>decorateSupplier(bulkhead, () -> {
            awaitPermit();
            return call.get();
        }).get();
    }

    /**
     * Takes one more start slot for a follow-up request made while already holding a concurrency slot.
     */
    public void awaitPermit() {
        long deadline = System.nanoTime() + maxWait.toNanos();
        try {
            if (!windowLock.tryLock(maxWait.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new RateLimitExceededException(name, maxWait.toMillis());
            }
            try {
                long now = System.nanoTime();
                if (recorded == starts.length) {
                    long freeAt = starts[next] + WINDOW_NANOS;
                    if (freeAt - now > 0) {
                        if (freeAt - deadline > 0) {
                            throw new RateLimitExceededException(name, maxWait.toMillis());
                        }
                        log.debug("Limiter '{}' window full, waiting {} ms", name,
                                TimeUnit.NANOSECONDS.toMillis(freeAt - now));
                        TimeUnit.NANOSECONDS.sleep(freeAt - now);
                        now = System.nanoTime();
                    }
                }
                starts[next] = now;
                next = (next + 1) % starts.length;
                if (recorded < starts.length) recorded++;
            } finally {
                windowLock.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException("Interrupted while waiting for limiter '" + name + "'", 0, e);
        }
    }

    public int availableConcurrentCalls() {
        return bulkhead.getMetrics().getAvailableConcurrentCalls();
    }
}
