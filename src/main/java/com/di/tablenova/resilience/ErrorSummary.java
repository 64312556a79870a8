package com.di.tablenova.resilience;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/** Aggregated view of the error log and circuit breakers. */
@Value
@Builder
public class ErrorSummary {
    int totalErrors;
    Map<String, Long> categoryBreakdown;
    Map<String, Long> severityBreakdown;
    int recentErrors;
    Map<String, Long> errorPatterns;
    Map<String, CircuitView> circuitBreakers;
    List<String> openCircuits;
    List<String> recommendations;

    @Value
    @Builder
    public static class CircuitView {
        String state;
        int failureCount;
        int failureThreshold;
        String openedAt;
    }
}
