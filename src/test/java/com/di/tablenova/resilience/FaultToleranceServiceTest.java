package com.di.tablenova.resilience;

import com.di.tablenova.analysis.FindingParser;
import com.di.tablenova.analysis.model.AnalysisCategory;
import com.di.tablenova.analysis.model.Finding;
import com.di.tablenova.analysis.model.Priority;
import com.di.tablenova.metrics.AnalysisMetrics;
import com.di.tablenova.support.MutableClock;
import com.di.tablenova.support.TestFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FaultToleranceService Tests")
class FaultToleranceServiceTest {

    private static final String OPERATION = "analyze_data_quality";

    private MutableClock clock;
    private AnalysisResultCache cache;
    private List<Duration> sleeps;
    private FaultToleranceService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        cache = new AnalysisResultCache(100, Duration.ofHours(1));
        sleeps = new ArrayList<>();
        service = newService(1000);
    }

    private FaultToleranceService newService(int errorLogCapacity) {
        SimplifiedFallbackStrategy simplified = new SimplifiedFallbackStrategy();
        List<FallbackStrategy> strategies = List.of(
                simplified,
                new CachedFallbackStrategy(cache, simplified),
                new PartialFallbackStrategy(new FindingParser(new ObjectMapper()), simplified));
        return new FaultToleranceService(strategies, cache,
                new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0),
                new CircuitBreakerRegistry(5, Duration.ofSeconds(60), clock),
                new AnalysisMetrics(new SimpleMeterRegistry()),
                sleeps::add, clock, errorLogCapacity);
    }

    private static ErrorContext context() {
        return ErrorContext.forCategory(OPERATION, "tbl1", "Customers", AnalysisCategory.DATA_QUALITY, 3);
    }

    private static List<Finding> findings() {
        return List.of(TestFixtures.strongFinding("tbl1", AnalysisCategory.DATA_QUALITY, Priority.HIGH, 0.9));
    }

    // ============================================================
    // Success and retry
    // ============================================================

    @Test
    @DisplayName("Should return findings without fallback on first success")
    void testExecute_Success() {
        AnalysisOutcome outcome = service.executeWithFallback(FaultToleranceServiceTest::findings, context(), "simplified");

        assertFalse(outcome.isFallbackUsed());
        assertNull(outcome.getFallbackType());
        assertEquals(1, outcome.getFindings().size());
        assertTrue(cache.get("tbl1", AnalysisCategory.DATA_QUALITY).isPresent());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Should retry retryable failures with growing backoff and then succeed")
    void testExecute_RetryThenSuccess() {
        AtomicInteger calls = new AtomicInteger();
        Callable<List<Finding>> operation = () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("Connection reset by peer");
            }
            return findings();
        };

        AnalysisOutcome outcome = service.executeWithFallback(operation, context(), "simplified");

        assertFalse(outcome.isFallbackUsed());
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
        assertEquals(2, service.getTotalErrorsRecorded());
        assertEquals(CircuitState.State.CLOSED, service.circuit(OPERATION).getState());
        assertEquals(0, service.circuit(OPERATION).getFailureCount());
    }

    @Test
    @DisplayName("Should not retry non-retryable failures")
    void testExecute_NonRetryable() {
        AtomicInteger calls = new AtomicInteger();

        AnalysisOutcome outcome = service.executeWithFallback(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("Unauthorized: invalid credentials");
        }, context(), "simplified");

        assertEquals(1, calls.get());
        assertTrue(outcome.isFallbackUsed());
        assertTrue(sleeps.isEmpty());
        assertEquals(1, service.circuit(OPERATION).getFailureCount());
    }

    @Test
    @DisplayName("Should count one circuit failure per exhausted execution")
    void testExecute_ExhaustedRetries() {
        AtomicInteger calls = new AtomicInteger();

        service.executeWithFallback(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("Read timeout");
        }, context(), "simplified");

        assertEquals(3, calls.get());
        assertEquals(2, sleeps.size());
        assertEquals(3, service.getTotalErrorsRecorded());
        assertEquals(1, service.circuit(OPERATION).getFailureCount());
    }

    // ============================================================
    // Circuit breaker
    // ============================================================

    @Test
    @DisplayName("Should open the circuit after five exhausted executions and skip further calls")
    void testExecute_CircuitOpens() {
        AtomicInteger calls = new AtomicInteger();
        Callable<List<Finding>> failing = () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("403 forbidden");
        };

        for (int i = 0; i < 4; i++) {
            service.executeWithFallback(failing, context(), "simplified");
            assertEquals(CircuitState.State.CLOSED, service.circuit(OPERATION).getState());
        }
        service.executeWithFallback(failing, context(), "simplified");
        assertEquals(CircuitState.State.OPEN, service.circuit(OPERATION).getState());
        assertEquals(5, calls.get());

        AnalysisOutcome skipped = service.executeWithFallback(failing, context(), "simplified");

        assertEquals(5, calls.get());
        assertTrue(skipped.isFallbackUsed());
        assertEquals(5, service.circuit(OPERATION).getFailureCount());
        assertEquals(List.of(OPERATION), service.errorSummary().getOpenCircuits());
    }

    @Test
    @DisplayName("Should let a trial call through after the open timeout and close on success")
    void testExecute_HalfOpenRecovery() {
        Callable<List<Finding>> failing = () -> {
            throw new IllegalStateException("403 forbidden");
        };
        for (int i = 0; i < 5; i++) {
            service.executeWithFallback(failing, context(), "simplified");
        }
        clock.advance(Duration.ofSeconds(61));

        AnalysisOutcome outcome = service.executeWithFallback(FaultToleranceServiceTest::findings, context(), "simplified");

        assertFalse(outcome.isFallbackUsed());
        assertEquals(CircuitState.State.CLOSED, service.circuit(OPERATION).getState());
    }

    @Test
    @DisplayName("Should close an open circuit on manual reset")
    void testResetCircuit() {
        for (int i = 0; i < 5; i++) {
            service.executeWithFallback(() -> {
                throw new IllegalStateException("403 forbidden");
            }, context(), "simplified");
        }

        assertTrue(service.resetCircuit(OPERATION));
        assertEquals(CircuitState.State.CLOSED, service.circuit(OPERATION).getState());
        assertFalse(service.resetCircuit("analyze_unknown"));
    }

    // ============================================================
    // Fallback strategies
    // ============================================================

    @Test
    @DisplayName("Should produce one tagged placeholder finding from the simplified strategy")
    void testFallback_Simplified() {
        AnalysisOutcome outcome = service.executeWithFallback(() -> {
            throw new IllegalStateException("Unauthorized");
        }, context(), "simplified");

        assertTrue(outcome.isFallbackUsed());
        assertEquals("simplified", outcome.getFallbackType());
        assertEquals(1, outcome.getFindings().size());
        Finding placeholder = outcome.getFindings().get(0);
        assertEquals(0.3, placeholder.getConfidenceScore());
        assertEquals(Priority.MEDIUM, placeholder.getPriority());
        assertEquals("analysis_fallback", placeholder.getIssueType());
        assertEquals(AnalysisCategory.DATA_QUALITY, placeholder.getCategory());
        assertEquals(3, placeholder.getImplementationSteps().size());
        assertTrue(outcome.getMetadata().containsKey("error_info"));
    }

    @Test
    @DisplayName("Should serve the last successful findings from the cached strategy")
    void testFallback_CachedHit() {
        service.executeWithFallback(FaultToleranceServiceTest::findings, context(), "cached");

        AnalysisOutcome outcome = service.executeWithFallback(() -> {
            throw new IllegalStateException("Unauthorized");
        }, context(), "cached");

        assertEquals("cached", outcome.getFallbackType());
        assertEquals(findings(), outcome.getFindings());
        assertTrue(outcome.getMetadata().containsKey("cache_info"));
    }

    @Test
    @DisplayName("Should use simplified when the cache has nothing for the table")
    void testFallback_CachedMiss() {
        AnalysisOutcome outcome = service.executeWithFallback(() -> {
            throw new IllegalStateException("Unauthorized");
        }, context(), "cached");

        assertEquals("simplified", outcome.getFallbackType());
    }

    @Test
    @DisplayName("Should salvage complete objects from a truncated response")
    void testFallback_PartialSalvage() {
        String truncated = "[{\"issue_type\":\"a\",\"description\":\"first\",\"confidence_score\":0.8},"
                + "{\"issue_type\":\"b\",\"descrip";

        AnalysisOutcome outcome = service.executeWithFallback(() -> {
            throw new PartialResponseException("Response truncated by max tokens", truncated);
        }, context(), "partial");

        assertEquals("partial", outcome.getFallbackType());
        assertEquals(1, outcome.getFindings().size());
        assertEquals("first", outcome.getFindings().get(0).getDescription());
        assertTrue(outcome.getMetadata().containsKey("partial_info"));
    }

    @Test
    @DisplayName("Should use simplified when nothing can be salvaged")
    void testFallback_PartialNothing() {
        AnalysisOutcome outcome = service.executeWithFallback(() -> {
            throw new IllegalStateException("Unauthorized");
        }, context(), "partial");

        assertEquals("simplified", outcome.getFallbackType());
    }

    @Test
    @DisplayName("Should use simplified when the chosen fallback strategy itself fails")
    void testFallback_StrategyThrows() {
        SimplifiedFallbackStrategy simplified = new SimplifiedFallbackStrategy();
        FallbackStrategy broken = new FallbackStrategy() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public AnalysisOutcome apply(ErrorContext context, Throwable lastError) {
                throw new IllegalStateException("fallback store unreachable");
            }
        };
        FaultToleranceService withBroken = new FaultToleranceService(List.of(simplified, broken), cache,
                new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0),
                new CircuitBreakerRegistry(5, Duration.ofSeconds(60), clock),
                new AnalysisMetrics(new SimpleMeterRegistry()),
                sleeps::add, clock, 1000);

        AnalysisOutcome outcome = withBroken.executeWithFallback(() -> {
            throw new IllegalStateException("Unauthorized");
        }, context(), "broken");

        assertTrue(outcome.isFallbackUsed());
        assertEquals("simplified", outcome.getFallbackType());
        assertEquals(1, outcome.getFindings().size());
        assertEquals("analysis_fallback", outcome.getFindings().get(0).getIssueType());
    }

    @Test
    @DisplayName("Should reject an unknown fallback strategy before running the operation")
    void testExecute_UnknownStrategy() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(IllegalArgumentException.class, () -> service.executeWithFallback(() -> {
            calls.incrementAndGet();
            return findings();
        }, context(), "magic"));
        assertEquals(0, calls.get());
        assertThrows(IllegalArgumentException.class, () -> service.requireStrategy(null));
    }

    @Test
    @DisplayName("Should require the simplified strategy to be registered")
    void testConstructor_MissingSimplified() {
        assertThrows(IllegalStateException.class, () -> new FaultToleranceService(List.of(), cache,
                RetryPolicy.defaultPolicy(), new CircuitBreakerRegistry(5, Duration.ofSeconds(60), clock),
                new AnalysisMetrics(new SimpleMeterRegistry()), d -> { }, clock, 10));
    }

    // ============================================================
    // Error log
    // ============================================================

    @Test
    @DisplayName("Should keep the error log bounded while counting every failure")
    void testErrorLog_Bounded() {
        FaultToleranceService small = newService(2);
        for (int i = 0; i < 4; i++) {
            small.executeWithFallback(() -> {
                throw new IllegalStateException("Unauthorized");
            }, ErrorContext.forCategory("op" + i, "tbl1", "Customers", AnalysisCategory.STRUCTURE, 3), "simplified");
        }

        assertEquals(2, small.recentErrors().size());
        assertEquals(4, small.getTotalErrorsRecorded());
        assertEquals(2, small.errorSummary().getTotalErrors());
    }

    @Test
    @DisplayName("Should summarise errors by category and suggest remedies")
    void testErrorSummary() {
        service.executeWithFallback(() -> {
            throw new IllegalStateException("Rate limit exceeded");
        }, context(), "simplified");

        ErrorSummary summary = service.errorSummary();

        assertEquals(3, summary.getTotalErrors());
        assertEquals(3L, summary.getCategoryBreakdown().get("api_limit"));
        assertEquals(3, summary.getRecentErrors());
        assertTrue(summary.getRecommendations().stream().anyMatch(r -> r.contains("API limit")));
        assertEquals(summary.getRecommendations(), service.errorRecommendations());
    }

    @Test
    @DisplayName("Should drop errors older than one hour from the recent view")
    void testRecentErrors_Window() {
        service.executeWithFallback(() -> {
            throw new IllegalStateException("Unauthorized");
        }, context(), "simplified");
        clock.advance(Duration.ofMinutes(61));

        assertTrue(service.recentErrors().isEmpty());
        assertEquals(1, service.errorSummary().getTotalErrors());
        assertEquals(0, service.errorSummary().getRecentErrors());
    }
}
