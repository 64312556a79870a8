package com.di.tablenova.resilience;

import java.time.Duration;

/**
 * Exponential backoff without jitter: {@code min(baseDelay * multiplier^(attempt-1), maxDelay)}.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double multiplier;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double multiplier) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (multiplier <= 1.0) {
            throw new IllegalArgumentException("multiplier must be greater than 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
    }

    /**
     * Delay before the retry that follows the given one-based failed attempt.
     */
    public Duration delayAfter(int attempt) {
        int exponent = Math.max(0, attempt - 1);
        double millis = baseDelay.toMillis() * Math.pow(multiplier, exponent);
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    /** 3 attempts, 1s base, 30s cap, doubling. */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0);
    }
}
