package com.di.tablenova.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Binding for {@code tablenova.analysis.*}: rate limiting, batching, retry, circuit breaker,
 * error log, result cache and workflow defaults.
 *
 * <pre>
 * tablenova:
 *   analysis:
 *     min-request-interval: 1s
 *     batch:
 *       size:            5
 *       max-concurrency: 3
 *     retry:
 *       max-attempts: 3
 *       base-delay:   1s
 *       max-delay:    30s
 *       multiplier:   2.0
 *     circuit-breaker:
 *       failure-threshold: 5
 *       open-timeout:      60s
 *     error-log:
 *       capacity: 1000
 *     result-cache:
 *       maximum-size:      1000
 *       expire-after-write: 6h
 *     workflow:
 *       confidence-threshold: 0.7
 *       auto-update-metadata: true
 *       fallback-strategy:    cached
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "tablenova.analysis")
public class AnalysisProperties {

    /** Minimum spacing between two provider calls, process-wide. */
    private Duration minRequestInterval = Duration.ofSeconds(1);

    @NestedConfigurationProperty
    private BatchConfig batch = new BatchConfig();

    @NestedConfigurationProperty
    private RetryConfig retry = new RetryConfig();

    @NestedConfigurationProperty
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();

    @NestedConfigurationProperty
    private ErrorLogConfig errorLog = new ErrorLogConfig();

    @NestedConfigurationProperty
    private ResultCacheConfig resultCache = new ResultCacheConfig();

    @NestedConfigurationProperty
    private WorkflowConfig workflow = new WorkflowConfig();

    // ------------------------------------------------------------------ //

    @Data
    public static class BatchConfig {
        private int size           = 5;
        private int maxConcurrency = 3;
    }

    @Data
    public static class RetryConfig {
        private int      maxAttempts = 3;
        private Duration baseDelay   = Duration.ofSeconds(1);
        private Duration maxDelay    = Duration.ofSeconds(30);
        private double   multiplier  = 2.0;
    }

    @Data
    public static class CircuitBreakerConfig {
        private int      failureThreshold = 5;
        private Duration openTimeout      = Duration.ofSeconds(60);
    }

    @Data
    public static class ErrorLogConfig {
        private int capacity = 1000;
    }

    @Data
    public static class ResultCacheConfig {
        private long     maximumSize      = 1000;
        private Duration expireAfterWrite = Duration.ofHours(6);
    }

    @Data
    public static class WorkflowConfig {
        private double  confidenceThreshold = 0.7;
        private boolean autoUpdateMetadata  = true;
        private String  fallbackStrategy    = "cached";
        private int     expectedTableCount  = 35;
        private double  discoveryOverheadMinutes  = 2.0;
        private double  processingOverheadMinutes = 3.0;
        private double  updateOverheadMinutes     = 5.0;
    }
}
