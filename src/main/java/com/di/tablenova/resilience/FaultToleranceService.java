package com.di.tablenova.resilience;

import com.di.tablenova.analysis.model.Finding;
import com.di.tablenova.config.AnalysisProperties;
import com.di.tablenova.metrics.AnalysisMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Wraps a fallible analysis in retry with exponential backoff, a per-operation circuit breaker
 * and a named fallback strategy, and keeps a bounded log of every failure.
 *
 * <p>Flow for {@link #executeWithFallback}:
 * <ol>
 *   <li>Per attempt: skip the call if the circuit is open, otherwise invoke.</li>
 *   <li>Success resets the circuit, caches the findings and returns them.</li>
 *   <li>Failure is classified and recorded; retryable failures back off and retry while
 *       attempts remain; otherwise the circuit counts one failure and the loop ends.</li>
 *   <li>After exhaustion the named fallback runs; if it throws, {@code simplified} runs.</li>
 * </ol>
 */
@Slf4j
@Service
public class FaultToleranceService {

    static final Duration RECENT_WINDOW = Duration.ofHours(1);

    private final Map<String, FallbackStrategy> strategies;
    private final FallbackStrategy simplified;
    private final AnalysisResultCache resultCache;
    private final RetryPolicy retryPolicy;
    private final CircuitBreakerRegistry circuits;
    private final AnalysisMetrics metrics;
    private final Sleeper sleeper;
    private final Clock clock;
    private final int errorLogCapacity;

    private final Deque<ErrorRecord> errorLog = new ArrayDeque<>();
    private final Map<String, Long> errorPatterns = new TreeMap<>();
    private long totalErrors;

    @Autowired
    public FaultToleranceService(List<FallbackStrategy> strategies,
                                 AnalysisResultCache resultCache,
                                 AnalysisProperties properties,
                                 AnalysisMetrics metrics) {
        this(strategies, resultCache, retryPolicy(properties.getRetry()),
                CircuitBreakerRegistry.from(properties.getCircuitBreaker(), Clock.systemUTC()),
                metrics, Sleeper.THREAD, Clock.systemUTC(), properties.getErrorLog().getCapacity());
    }

    public FaultToleranceService(List<FallbackStrategy> strategies,
                                 AnalysisResultCache resultCache,
                                 RetryPolicy retryPolicy,
                                 CircuitBreakerRegistry circuits,
                                 AnalysisMetrics metrics,
                                 Sleeper sleeper,
                                 Clock clock,
                                 int errorLogCapacity) {
        this.strategies = strategies.stream()
                .collect(Collectors.toMap(FallbackStrategy::name, Function.identity(), (a, b) -> a, LinkedHashMap::new));
        this.simplified = this.strategies.get(SimplifiedFallbackStrategy.NAME);
        if (this.simplified == null) {
            throw new IllegalStateException("The '" + SimplifiedFallbackStrategy.NAME + "' fallback strategy must be registered");
        }
        this.resultCache = resultCache;
        this.retryPolicy = retryPolicy;
        this.circuits = circuits;
        this.metrics = metrics;
        this.sleeper = sleeper;
        this.clock = clock;
        this.errorLogCapacity = Math.max(1, errorLogCapacity);
        log.info("[FAULT] Fault tolerance ready: strategies={}, maxAttempts={}", this.strategies.keySet(),
                retryPolicy.getMaxAttempts());
    }

    private static RetryPolicy retryPolicy(AnalysisProperties.RetryConfig retry) {
        return new RetryPolicy(retry.getMaxAttempts(), retry.getBaseDelay(), retry.getMaxDelay(), retry.getMultiplier());
    }

    // ------------------------------------------------------------------ //
    // Execution                                                           //
    // ------------------------------------------------------------------ //

    /**
     * Runs {@code operation} under retry and circuit breaker; never throws for operation failures.
     *
     * @param fallbackStrategy name of a registered strategy ({@code simplified}, {@code cached}, {@code partial})
     * @throws IllegalArgumentException if the strategy name is unknown
     */
    public AnalysisOutcome executeWithFallback(Callable<List<Finding>> operation,
                                               ErrorContext context,
                                               String fallbackStrategy) {
        FallbackStrategy fallback = requireStrategy(fallbackStrategy);
        String operationName = context.getOperationName();
        CircuitState circuit = circuits.get(operationName);
        Throwable lastError = null;

        for (int attempt = 1; attempt <= context.getMaxAttempts(); attempt++) {
            context.setAttemptNumber(attempt);
            if (!circuit.tryAcquire()) {
                log.warn("[FAULT] Circuit open for operation={}, skipping call for table={}", operationName, context.getTableId());
                if (lastError == null) {
                    lastError = new CircuitOpenException(operationName);
                }
                break;
            }
            try {
                List<Finding> findings = operation.call();
                circuit.recordSuccess();
                resultCache.put(context.getTableId(), context.getCategory(), findings);
                return AnalysisOutcome.success(findings);
            } catch (Exception e) {
                lastError = e;
                if (e instanceof PartialResponseException) {
                    context.getAdditionalInfo().put(ErrorContext.PARTIAL_RESPONSE, ((PartialResponseException) e).getPartialText());
                }
                ErrorRecord record = recordError(e, context);
                boolean retry = attempt < context.getMaxAttempts() && record.getCategory().isRetryable();
                if (!retry) {
                    log.warn("[FAULT] operation={} table={} failed on attempt {}/{} [{}]: {}", operationName,
                            context.getTableId(), attempt, context.getMaxAttempts(), record.getCategory().getValue(), e.getMessage());
                    if (circuit.recordFailure()) {
                        metrics.recordCircuitOpened(operationName);
                    }
                    break;
                }
                Duration delay = retryPolicy.delayAfter(attempt);
                log.warn("[FAULT] operation={} table={} attempt {}/{} failed [{}], retrying in {} ms: {}", operationName,
                        context.getTableId(), attempt, context.getMaxAttempts(), record.getCategory().getValue(),
                        delay.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("[FAULT] Backoff interrupted for operation={}, falling back", operationName);
                    if (circuit.recordFailure()) {
                        metrics.recordCircuitOpened(operationName);
                    }
                    break;
                }
            }
        }
        return runFallback(fallback, context, lastError);
    }

    private AnalysisOutcome runFallback(FallbackStrategy fallback, ErrorContext context, Throwable lastError) {
        log.error("[FAULT] All attempts failed for operation={} table={} category={}, using fallback '{}'",
                context.getOperationName(), context.getTableId(), context.getCategory(), fallback.name());
        AnalysisOutcome outcome;
        try {
            outcome = fallback.apply(context, lastError);
        } catch (RuntimeException fallbackError) {
            log.error("[FAULT] Fallback '{}' failed, using '{}'", fallback.name(), SimplifiedFallbackStrategy.NAME, fallbackError);
            outcome = simplified.apply(context, lastError);
        }
        metrics.recordFallback(outcome.getFallbackType());
        return outcome;
    }

    // ------------------------------------------------------------------ //
    // Error log                                                           //
    // ------------------------------------------------------------------ //

    private ErrorRecord recordError(Throwable error, ErrorContext context) {
        ErrorCategory category = ErrorCategory.categorize(error);
        boolean finalAttempt = context.getAttemptNumber() >= context.getMaxAttempts();
        ErrorRecord record = ErrorRecord.builder()
                .timestamp(clock.instant())
                .errorType(error.getClass().getSimpleName())
                .message(error.getMessage())
                .category(category)
                .severity(ErrorSeverity.of(category, finalAttempt))
                .context(context.snapshot())
                .build();
        synchronized (errorLog) {
            errorLog.addLast(record);
            while (errorLog.size() > errorLogCapacity) {
                errorLog.removeFirst();
            }
            errorPatterns.merge(record.patternKey(), 1L, Long::sum);
            totalErrors++;
        }
        return record;
    }

    public List<ErrorRecord> recentErrors() {
        Instant cutoff = clock.instant().minus(RECENT_WINDOW);
        synchronized (errorLog) {
            return errorLog.stream().filter(r -> r.getTimestamp().isAfter(cutoff)).collect(Collectors.toList());
        }
    }

    public ErrorSummary errorSummary() {
        List<ErrorRecord> records;
        Map<String, Long> patterns;
        synchronized (errorLog) {
            records = new ArrayList<>(errorLog);
            patterns = new TreeMap<>(errorPatterns);
        }
        Instant cutoff = clock.instant().minus(RECENT_WINDOW);

        Map<String, ErrorSummary.CircuitView> circuitViews = new LinkedHashMap<>();
        List<String> open = new ArrayList<>();
        circuits.all().forEach((name, state) -> {
            CircuitState.State current = state.getState();
            circuitViews.put(name, ErrorSummary.CircuitView.builder()
                    .state(current.getValue())
                    .failureCount(state.getFailureCount())
                    .failureThreshold(state.getFailureThreshold())
                    .openedAt(state.getOpenedAt() != null ? state.getOpenedAt().toString() : null)
                    .build());
            if (current == CircuitState.State.OPEN) {
                open.add(name);
            }
        });

        return ErrorSummary.builder()
                .totalErrors(records.size())
                .categoryBreakdown(countBy(records, r -> r.getCategory().getValue()))
                .severityBreakdown(countBy(records, r -> r.getSeverity().getValue()))
                .recentErrors((int) records.stream().filter(r -> r.getTimestamp().isAfter(cutoff)).count())
                .errorPatterns(patterns)
                .circuitBreakers(circuitViews)
                .openCircuits(open)
                .recommendations(recommendations(records, open.size()))
                .build();
    }

    public List<String> errorRecommendations() {
        List<ErrorRecord> records;
        synchronized (errorLog) {
            records = new ArrayList<>(errorLog);
        }
        long openCount = circuits.all().values().stream()
                .filter(c -> c.getState() == CircuitState.State.OPEN)
                .count();
        return recommendations(records, (int) openCount);
    }

    private static List<String> recommendations(List<ErrorRecord> records, int openCircuits) {
        List<String> out = new ArrayList<>();
        if (!records.isEmpty()) {
            Map<String, Long> byCategory = countBy(records, r -> r.getCategory().getValue());
            double total = records.size();
            if (byCategory.getOrDefault(ErrorCategory.API_LIMIT.getValue(), 0L) > total * 0.2) {
                out.add("High rate of API limit errors. Consider more aggressive rate limiting.");
            }
            if (byCategory.getOrDefault(ErrorCategory.NETWORK.getValue(), 0L) > total * 0.3) {
                out.add("Frequent network errors. Check network stability and connection pooling.");
            }
            if (byCategory.getOrDefault(ErrorCategory.TIMEOUT.getValue(), 0L) > total * 0.25) {
                out.add("Many timeout errors. Consider increasing timeouts or reducing request complexity.");
            }
            if (byCategory.getOrDefault(ErrorCategory.PARSING.getValue(), 0L) > total * 0.15) {
                out.add("Parsing errors detected. Review prompts and response format expectations.");
            }
        }
        if (openCircuits > 0) {
            out.add(openCircuits + " circuit breaker(s) open. Monitor provider health and consider manual intervention.");
        }
        return out;
    }

    private static Map<String, Long> countBy(List<ErrorRecord> records, Function<ErrorRecord, String> key) {
        return records.stream().collect(Collectors.groupingBy(key, TreeMap::new, Collectors.counting()));
    }

    // ------------------------------------------------------------------ //
    // Circuit access                                                      //
    // ------------------------------------------------------------------ //

    public CircuitState circuit(String operationName) {
        return circuits.get(operationName);
    }

    public boolean resetCircuit(String operationName) {
        return circuits.reset(operationName);
    }

    /** @throws IllegalArgumentException if no strategy is registered under {@code name} */
    public FallbackStrategy requireStrategy(String name) {
        FallbackStrategy strategy = name == null ? null : strategies.get(name);
        if (strategy == null) {
            throw new IllegalArgumentException("Unknown fallback strategy: " + name
                    + " (available: " + strategies.keySet() + ")");
        }
        return strategy;
    }

    public Set<String> strategyNames() {
        return Collections.unmodifiableSet(strategies.keySet());
    }

    public int getMaxAttempts() {
        return retryPolicy.getMaxAttempts();
    }

    /** Total failures recorded since start, including those evicted from the bounded log. */
    public long getTotalErrorsRecorded() {
        synchronized (errorLog) {
            return totalErrors;
        }
    }
}
