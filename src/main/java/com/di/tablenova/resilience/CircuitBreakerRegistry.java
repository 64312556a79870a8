package com.di.tablenova.resilience;

import com.di.tablenova.config.AnalysisProperties;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link CircuitState} per operation name, created on first use and shared by all callers.
 */
public class CircuitBreakerRegistry {

    private final int failureThreshold;
    private final Duration openTimeout;
    private final Clock clock;
    private final Map<String, CircuitState> circuits = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(int failureThreshold, Duration openTimeout, Clock clock) {
        this.failureThreshold = failureThreshold;
        this.openTimeout = openTimeout;
        this.clock = clock;
    }

    public static CircuitBreakerRegistry from(AnalysisProperties.CircuitBreakerConfig config, Clock clock) {
        return new CircuitBreakerRegistry(config.getFailureThreshold(), config.getOpenTimeout(), clock);
    }

    public CircuitState get(String operationName) {
        return circuits.computeIfAbsent(operationName,
                name -> new CircuitState(name, failureThreshold, openTimeout, clock));
    }

    /** @return false if no circuit exists for the name */
    public boolean reset(String operationName) {
        CircuitState state = circuits.get(operationName);
        if (state == null) {
            return false;
        }
        state.reset();
        return true;
    }

    /** Snapshot sorted by operation name. */
    public Map<String, CircuitState> all() {
        return new TreeMap<>(circuits);
    }
}
