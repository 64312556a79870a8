package com.di.tablenova.resilience;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Circuit breaker for one operation name.
 * <p>CLOSED until {@code failureThreshold} consecutive exhausted executions, then OPEN. After
 * {@code openTimeout} the next {@link #tryAcquire()} moves it to HALF_OPEN and lets the call
 * through; success closes it, failure re-opens it. All methods are synchronized on the instance.
 */
public class CircuitState {

    public enum State {
        CLOSED, OPEN, HALF_OPEN;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final String operationName;
    private final int failureThreshold;
    private final Duration openTimeout;
    private final Clock clock;

    private int failureCount;
    private State state = State.CLOSED;
    private Instant openedAt;

    public CircuitState(String operationName, int failureThreshold, Duration openTimeout, Clock clock) {
        this.operationName = operationName;
        this.failureThreshold = failureThreshold;
        this.openTimeout = openTimeout;
        this.clock = clock;
    }

    /**
     * @return true if a call may proceed; false while open and the timeout has not elapsed
     */
    public synchronized boolean tryAcquire() {
        if (state != State.OPEN) {
            return true;
        }
        if (Duration.between(openedAt, clock.instant()).compareTo(openTimeout) >= 0) {
            state = State.HALF_OPEN;
            return true;
        }
        return false;
    }

    public synchronized void recordSuccess() {
        failureCount = 0;
        state = State.CLOSED;
        openedAt = null;
    }

    /**
     * @return true if this failure opened (or re-opened) the circuit
     */
    public synchronized boolean recordFailure() {
        failureCount++;
        if (state == State.HALF_OPEN || failureCount >= failureThreshold) {
            boolean wasOpen = state == State.OPEN;
            state = State.OPEN;
            openedAt = clock.instant();
            return !wasOpen;
        }
        return false;
    }

    public synchronized void reset() {
        recordSuccess();
    }

    public synchronized State getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public synchronized Instant getOpenedAt() {
        return openedAt;
    }

    public String getOperationName() {
        return operationName;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getOpenTimeout() {
        return openTimeout;
    }
}
