package com.di.tablenova.agent.analyzer;

import com.di.tablenova.config.AnalysisProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide minimum spacing between provider calls. Each caller reserves the next free
 * slot with a CAS and sleeps until it arrives, so concurrent callers are serialised.
 */
@Slf4j
@Component
public class RequestRateLimiter {

    private final long minIntervalNanos;
    private final AtomicLong nextFreeAtNanos = new AtomicLong(Long.MIN_VALUE);

    @Autowired
    public RequestRateLimiter(AnalysisProperties properties) {
        this(properties.getMinRequestInterval());
    }

    public RequestRateLimiter(Duration minInterval) {
        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must not be negative");
        }
        this.minIntervalNanos = minInterval.toNanos();
    }

    /**
     * Blocks until this caller's slot is reached.
     *
     * @throws IllegalStateException if interrupted while waiting (interrupt flag is restored)
     */
    public void acquire() {
        long slot;
        while (true) {
            long now = System.nanoTime();
            long next = nextFreeAtNanos.get();
            slot = (next == Long.MIN_VALUE || now - next >= 0) ? now : next;
            if (nextFreeAtNanos.compareAndSet(next, slot + minIntervalNanos)) {
                break;
            }
        }
        long waitNanos = slot - System.nanoTime();
        if (waitNanos > 0) {
            log.debug("[RATE-LIMIT] Waiting {} ms before provider call", waitNanos / 1_000_000);
            try {
                Thread.sleep(waitNanos / 1_000_000, (int) (waitNanos % 1_000_000));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Rate limiter interrupted", e);
            }
        }
    }

    public Duration getMinInterval() {
        return Duration.ofNanos(minIntervalNanos);
    }
}
